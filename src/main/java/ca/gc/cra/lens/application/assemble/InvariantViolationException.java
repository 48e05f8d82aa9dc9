package ca.gc.cra.lens.application.assemble;

/**
 * Raised when an upstream stage hands the assembler incomplete output. Indicates a defect, not bad input.
 *
 * @since 0.1.0
 */
public final class InvariantViolationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public InvariantViolationException(String message) {
    super(message);
  }
}
