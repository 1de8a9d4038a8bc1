package emitter;

/**
 * Fixed-arity command bound to an event key.
 *
 * <p>The arity is read once, when the handler is registered, and every trigger is checked
 * against it before {@link #onEvent(Object[])} is called. Implementations receive exactly
 * {@link #arity()} arguments.
 *
 * <h2>Error Handling</h2>
 * <p>Anything thrown from {@code onEvent} is caught at the invoker boundary, logged, and
 * reported to the trigger side as {@link EmitStatus#HANDLER_FAILED}. It never propagates
 * into the caller of {@link Emitter#send(String, Object...)}.
 *
 * <p>Most callers do not implement this directly; see {@link Handlers} for typed factories.
 *
 * @see Handlers
 */
public interface EventHandler {

  /**
   * Returns the number of arguments this handler expects. Must be constant.
   *
   * @return the arity, never negative
   */
  int arity();

  /**
   * Handles one trigger.
   *
   * @param args exactly {@link #arity()} arguments, possibly containing nulls
   * @throws Exception if handling fails
   */
  void onEvent(Object[] args) throws Exception;
}
