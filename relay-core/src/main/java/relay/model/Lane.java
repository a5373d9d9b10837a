package relay.model;

/**
 * Logical partition of the message log.
 *
 * <p>{@link #INCOMING} holds traffic received from the network (plus echoes of
 * delivered outgoing messages); {@link #OUTGOING} holds messages queued by plugins
 * for delivery.
 */
public enum Lane {
  INCOMING(1),
  OUTGOING(2);

  private final int code;

  Lane(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Resolves a lane from its stored code.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static Lane fromCode(int code) {
    for (Lane lane : values()) {
      if (lane.code == code) {
        return lane;
      }
    }
    throw new IllegalArgumentException("Unknown lane code: " + code);
  }
}
