package ca.gc.cra.scribe.infrastructure.destination;

/**
 * Outcome of one attempt to persist an entry or flush a sink.
 *
 * @param failure cause of the failure; {@code null} on success
 * @since 0.1.0
 */
public record DeliveryResult(Throwable failure) {
  private static final DeliveryResult OK = new DeliveryResult(null);

  /** Work that may fail with any exception. */
  @FunctionalInterface
  public interface Attempt {
    void run() throws Exception;
  }

  public static DeliveryResult success() {
    return OK;
  }

  public static DeliveryResult failed(Throwable failure) {
    return new DeliveryResult(failure);
  }

  /**
   * Runs the attempt and captures its outcome.
   *
   * @param attempt work to run
   * @return success, or the captured failure
   */
  public static DeliveryResult attempt(Attempt attempt) {
    try {
      attempt.run();
      return success();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return failed(ex);
    } catch (Exception ex) {
      return failed(ex);
    }
  }

  public boolean succeeded() {
    return failure == null;
  }
}
