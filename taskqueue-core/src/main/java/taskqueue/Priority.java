package taskqueue;

/**
 * Strict priority levels. Lower {@link #level()} is served first.
 *
 * <p>A task keeps its priority for its whole lifetime, including retries.
 */
public enum Priority {
  /** Fraud alerts, chargebacks and other work that must not wait. */
  HIGH(0),
  /** Regular payments. */
  MEDIUM(1),
  /** Reports, analytics, notifications. */
  LOW(2);

  private final int level;

  Priority(int level) {
    this.level = level;
  }

  /**
   * Returns the numeric level; {@code 0} is the most urgent.
   *
   * @return the priority level
   */
  public int level() {
    return level;
  }
}
