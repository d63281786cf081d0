package io.intellixity.tessera.persistence.jdbc.pool;

/** No usable connection could be handed out for a pool name. */
public final class PoolUnavailableException extends RuntimeException {
  public enum Reason {
    /** No pool is configured under the name. */
    NO_POOL,
    CLOSED,
    /** The health-check ping failed. */
    UNHEALTHY,
    /** The pool stayed exhausted for the whole acquire timeout. */
    ACQUIRE_TIMEOUT
  }

  private final String pool;
  private final Reason reason;

  public PoolUnavailableException(String pool, Reason reason, String message, Throwable cause) {
    super("tessera.pool name=" + pool + " reason=" + reason + ": " + message, cause);
    this.pool = pool;
    this.reason = reason;
  }

  public String pool() { return pool; }
  public Reason reason() { return reason; }

  /** Only an acquire timeout may succeed when the caller tries again. */
  public boolean isRetryable() { return reason == Reason.ACQUIRE_TIMEOUT; }
}
