package emitter;

/**
 * Outcome of an {@link Emitter} operation.
 *
 * <p>Every failure the emitter can observe is reported through one of these values rather
 * than thrown. Callers that prefer exceptions can use {@link #orThrow()} or
 * {@link Emitter#sendOrThrow(String, Object...)}.
 */
public enum EmitStatus {
  /** The operation completed. */
  OK("ok"),
  /** Triggered with a number of arguments different from the handler's arity. */
  ARGS_NOT_MATCH("the number of input args not match"),
  /** Registration attempted for a key that already has a live handler. */
  ALREADY_EXISTS("event already exists"),
  /** Registration attempted with a value that cannot be invoked. */
  NOT_CALLABLE("event not callable"),
  /** No live handler for the key (never registered, removed, or a consumed once handler). */
  NOT_FOUND("event not found"),
  /** The handler threw; the failure was recovered and logged. */
  HANDLER_FAILED("event handler failed, failure recovered"),
  /** The registry returned an entry that does not belong to the requested key. */
  INVALID_ENTRY("event entry does not match key"),
  /** Asynchronous mode only: the dispatch queue is full or the bus is closed. */
  REJECTED("event dispatch rejected");

  private final String message;

  EmitStatus(String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }

  public boolean isOk() {
    return this == OK;
  }

  /**
   * Throws an {@link EmitterException} unless this status is {@link #OK}.
   *
   * @throws EmitterException carrying this status
   */
  public void orThrow() {
    if (this != OK) {
      throw new EmitterException(this);
    }
  }
}
