package nudge.model;

/**
 * Queue entry status. Transitions only move forward:
 * {@code QUEUED -> SENDING -> SENT | FAILED}.
 */
public enum DeliveryStatus {
  QUEUED(0),
  SENDING(1),
  SENT(2),
  FAILED(3);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == SENT || this == FAILED;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
