package emitter;

import java.util.Objects;

/**
 * Unchecked exception carrying a non-OK {@link EmitStatus}.
 *
 * <p>The emitter itself never throws this from {@code on}, {@code once} or {@code send};
 * it is raised only on request through {@link EmitStatus#orThrow()} and
 * {@link Emitter#sendOrThrow(String, Object...)}.
 */
public class EmitterException extends RuntimeException {

  private final EmitStatus status;

  public EmitterException(EmitStatus status) {
    super(Objects.requireNonNull(status, "status").message());
    this.status = status;
  }

  public EmitterException(EmitStatus status, String key) {
    super(Objects.requireNonNull(status, "status").message() + ": " + key);
    this.status = status;
  }

  /**
   * Returns the status that caused this exception.
   *
   * @return the status, never {@link EmitStatus#OK}
   */
  public EmitStatus status() {
    return status;
  }
}
