package emitter;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Factories that turn lambdas and functional objects into {@link EventHandler}s.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventHandler add = Handlers.of((Integer a, Integer b) -> System.out.println(a + b));
 * EventHandler wide = Handlers.of(6, args -> audit(args));
 * Optional<EventHandler> adapted = Handlers.adapt((Runnable) () -> refresh());
 * }</pre>
 *
 * <p>Typed handlers do not check argument types up front. A trigger with an argument of the
 * wrong type fails inside the handler with a {@link ClassCastException}, which the invoker
 * recovers like any other handler failure.
 */
public final class Handlers {

  private Handlers() {
  }

  public static EventHandler of(Handler0 handler) {
    Objects.requireNonNull(handler, "handler");
    return fixed(0, args -> handler.accept());
  }

  @SuppressWarnings("unchecked")
  public static <A> EventHandler of(Handler1<A> handler) {
    Objects.requireNonNull(handler, "handler");
    return fixed(1, args -> handler.accept((A) args[0]));
  }

  @SuppressWarnings("unchecked")
  public static <A, B> EventHandler of(Handler2<A, B> handler) {
    Objects.requireNonNull(handler, "handler");
    return fixed(2, args -> handler.accept((A) args[0], (B) args[1]));
  }

  @SuppressWarnings("unchecked")
  public static <A, B, C> EventHandler of(Handler3<A, B, C> handler) {
    Objects.requireNonNull(handler, "handler");
    return fixed(3, args -> handler.accept((A) args[0], (B) args[1], (C) args[2]));
  }

  @SuppressWarnings("unchecked")
  public static <A, B, C, D> EventHandler of(Handler4<A, B, C, D> handler) {
    Objects.requireNonNull(handler, "handler");
    return fixed(4, args -> handler.accept((A) args[0], (B) args[1], (C) args[2], (D) args[3]));
  }

  /**
   * Creates a handler with an explicit arity whose body receives the raw argument array.
   *
   * @param arity the number of arguments the handler expects
   * @param handler the body
   * @return a fixed-arity handler
   * @throws IllegalArgumentException if {@code arity} is negative
   */
  public static EventHandler of(int arity, ArgsHandler handler) {
    if (arity < 0) {
      throw new IllegalArgumentException("arity must be >= 0");
    }
    return fixed(arity, Objects.requireNonNull(handler, "handler"));
  }

  /**
   * Adapts an arbitrary value into a handler.
   *
   * <p>Accepted values are {@link EventHandler} instances and objects implementing exactly one
   * functional interface ({@link Runnable}, {@link java.util.function.BiConsumer}, or a
   * user-defined one). For the latter the single abstract method is resolved here, once, and
   * its parameter count becomes the arity.
   *
   * @param callable the value to adapt, may be null
   * @return the handler, or empty when the value is not invocable
   */
  public static Optional<EventHandler> adapt(Object callable) {
    if (callable == null) {
      return Optional.empty();
    }
    if (callable instanceof EventHandler handler) {
      return Optional.of(handler);
    }
    Method method = functionalMethod(callable.getClass());
    if (method == null) {
      return Optional.empty();
    }
    try {
      method.setAccessible(true);
    } catch (RuntimeException e) {
      return Optional.empty();
    }
    return Optional.of(new ReflectiveHandler(callable, method));
  }

  private static EventHandler fixed(int arity, ArgsHandler body) {
    return new EventHandler() {
      @Override
      public int arity() {
        return arity;
      }

      @Override
      public void onEvent(Object[] args) throws Exception {
        body.accept(args);
      }
    };
  }

  private static Method functionalMethod(Class<?> type) {
    Method found = null;
    Set<Class<?>> seen = new HashSet<>();
    Deque<Class<?>> pending = new ArrayDeque<>();
    for (Class<?> c = type; c != null; c = c.getSuperclass()) {
      for (Class<?> itf : c.getInterfaces()) {
        pending.add(itf);
      }
    }
    while (!pending.isEmpty()) {
      Class<?> itf = pending.poll();
      if (!seen.add(itf)) {
        continue;
      }
      Method candidate = singleAbstractMethod(itf);
      if (candidate != null) {
        if (found != null && !sameShape(found, candidate)) {
          return null;
        }
        if (found == null) {
          found = candidate;
        }
      }
      for (Class<?> parent : itf.getInterfaces()) {
        pending.add(parent);
      }
    }
    return found;
  }

  private static Method singleAbstractMethod(Class<?> itf) {
    Method single = null;
    for (Method m : itf.getMethods()) {
      if (!Modifier.isAbstract(m.getModifiers()) || isObjectMethod(m)) {
        continue;
      }
      if (single != null && !sameShape(single, m)) {
        return null;
      }
      single = m;
    }
    return single;
  }

  private static boolean isObjectMethod(Method m) {
    try {
      Object.class.getMethod(m.getName(), m.getParameterTypes());
      return true;
    } catch (NoSuchMethodException e) {
      return false;
    }
  }

  private static boolean sameShape(Method a, Method b) {
    return a.getName().equals(b.getName()) && a.getParameterCount() == b.getParameterCount();
  }

  /** Arity-0 handler body. */
  @FunctionalInterface
  public interface Handler0 {
    void accept() throws Exception;
  }

  /** Arity-1 handler body. */
  @FunctionalInterface
  public interface Handler1<A> {
    void accept(A a) throws Exception;
  }

  /** Arity-2 handler body. */
  @FunctionalInterface
  public interface Handler2<A, B> {
    void accept(A a, B b) throws Exception;
  }

  /** Arity-3 handler body. */
  @FunctionalInterface
  public interface Handler3<A, B, C> {
    void accept(A a, B b, C c) throws Exception;
  }

  /** Arity-4 handler body. */
  @FunctionalInterface
  public interface Handler4<A, B, C, D> {
    void accept(A a, B b, C c, D d) throws Exception;
  }

  /** Handler body over the raw argument array. */
  @FunctionalInterface
  public interface ArgsHandler {
    void accept(Object[] args) throws Exception;
  }

  private static final class ReflectiveHandler implements EventHandler {
    private final Object target;
    private final Method method;
    private final int arity;

    ReflectiveHandler(Object target, Method method) {
      this.target = target;
      this.method = method;
      this.arity = method.getParameterCount();
    }

    @Override
    public int arity() {
      return arity;
    }

    @Override
    public void onEvent(Object[] args) throws Exception {
      try {
        method.invoke(target, args);
      } catch (InvocationTargetException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception ex) {
          throw ex;
        }
        if (cause instanceof Error err) {
          throw err;
        }
        throw e;
      }
    }

    @Override
    public String toString() {
      return method.getDeclaringClass().getSimpleName() + "." + method.getName() + "/" + arity;
    }
  }
}
