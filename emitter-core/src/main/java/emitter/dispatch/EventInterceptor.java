package emitter.dispatch;

/**
 * Cross-cutting hook around handler invocation.
 *
 * <p>Interceptors run inside the invoker's protected region:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order, for every interceptor whose
 *       {@code beforeDispatch} completed</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the handler is skipped and the trigger is reported as
 * {@link emitter.EmitStatus#HANDLER_FAILED}. {@code afterDispatch} exceptions are logged
 * and swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventBus.builder()
 *     .interceptor(EventInterceptor.before((key, args) -> audit.log(key)))
 *     .interceptor(EventInterceptor.after((key, args, error) -> {
 *         if (error != null) alerts.raise(key, error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before the handler is invoked.
     *
     * @param key the event key
     * @param args the trigger arguments
     * @throws Exception to skip the handler and report a failure
     */
    default void beforeDispatch(String key, Object[] args) throws Exception {
    }

    /**
     * Called after handler invocation (or after a beforeDispatch failure).
     *
     * @param key the event key
     * @param args the trigger arguments
     * @param error null on success, the failure otherwise
     */
    default void afterDispatch(String key, Object[] args, Throwable error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static EventInterceptor before(BeforeHook hook) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(String key, Object[] args) throws Exception {
                hook.accept(key, args);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static EventInterceptor after(AfterHook hook) {
        return new EventInterceptor() {
            @Override
            public void afterDispatch(String key, Object[] args, Throwable error) {
                hook.accept(key, args, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(String key, Object[] args) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(String key, Object[] args, Throwable error);
    }
}
