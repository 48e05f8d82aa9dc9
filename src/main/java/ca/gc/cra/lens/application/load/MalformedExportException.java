package ca.gc.cra.lens.application.load;

/**
 * Raised when the export document does not have the expected conversation structure.
 *
 * <p>Fatal: the whole load is aborted and no partial corpus is returned.
 *
 * @since 0.1.0
 */
public class MalformedExportException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public MalformedExportException(String message) {
    super(message);
  }

  public MalformedExportException(String message, Throwable cause) {
    super(message, cause);
  }
}
