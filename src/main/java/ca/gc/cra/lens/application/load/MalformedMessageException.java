package ca.gc.cra.lens.application.load;

/**
 * Raised when a single message lacks a required field or carries an unparsable timestamp.
 *
 * @since 0.1.0
 */
public final class MalformedMessageException extends MalformedExportException {
  private static final long serialVersionUID = 1L;

  private final String conversationId;
  private final int messageIndex;

  public MalformedMessageException(String conversationId, int messageIndex, String reason) {
    this(conversationId, messageIndex, reason, null);
  }

  public MalformedMessageException(String conversationId, int messageIndex, String reason, Throwable cause) {
    super("Malformed message " + messageIndex + " in conversation " + conversationId + ": " + reason, cause);
    this.conversationId = conversationId;
    this.messageIndex = messageIndex;
  }

  public String conversationId() {
    return conversationId;
  }

  public int messageIndex() {
    return messageIndex;
  }
}
