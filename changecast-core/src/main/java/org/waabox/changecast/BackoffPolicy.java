package org.waabox.changecast;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how long a change source adapter waits before each attempt to
 * re-establish a lost upstream subscription.
 *
 * <p>The delay doubles with every consecutive failed attempt, starting at
 * {@code initial} and never exceeding {@code max}. The default policy waits
 * 1s, 2s, 4s, 8s, 16s and then 30s for every following attempt.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackoffPolicy {

  /** The default delay before the first retry. */
  private static final Duration DEFAULT_INITIAL = Duration.ofSeconds(1);

  /** The default upper bound of the delay. */
  private static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

  /** The delay before the first retry. */
  private final Duration initial;

  /** The upper bound of the delay. */
  private final Duration max;

  /**
   * Creates a new backoff policy.
   *
   * @param theInitial the first delay, never null
   * @param theMax     the maximum delay, never null
   */
  private BackoffPolicy(final Duration theInitial, final Duration theMax) {
    initial = theInitial;
    max = theMax;
  }

  /**
   * Creates a backoff policy with the given bounds.
   *
   * @param initial the delay before the first retry, must be positive
   * @param max     the maximum delay, must not be shorter than initial
   *
   * @return a new backoff policy, never null
   *
   * @throws IllegalArgumentException if initial is not positive or max is
   *                                  shorter than initial
   * @throws NullPointerException if any argument is null
   */
  public static BackoffPolicy of(final Duration initial, final Duration max) {
    Objects.requireNonNull(initial, "initial must not be null");
    Objects.requireNonNull(max, "max must not be null");
    if (initial.isZero() || initial.isNegative()) {
      throw new IllegalArgumentException(
          "initial must be positive, got: " + initial);
    }
    if (max.compareTo(initial) < 0) {
      throw new IllegalArgumentException(
          "max must not be shorter than initial, got: " + max);
    }
    return new BackoffPolicy(initial, max);
  }

  /**
   * Creates the default policy: 1 second doubling up to 30 seconds.
   *
   * @return the default backoff policy, never null
   */
  public static BackoffPolicy defaultPolicy() {
    return new BackoffPolicy(DEFAULT_INITIAL, DEFAULT_MAX);
  }

  /**
   * Returns the delay to wait before the given retry attempt.
   *
   * @param attempt the 1-based number of consecutive failed attempts
   *
   * @return the delay, between initial and max, never null
   *
   * @throws IllegalArgumentException if attempt is lower than 1
   */
  public Duration delayFor(final int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException(
          "attempt must be at least 1, got: " + attempt);
    }
    Duration delay = initial;
    for (int i = 1; i < attempt && delay.compareTo(max) < 0; i++) {
      delay = delay.multipliedBy(2);
    }
    return delay.compareTo(max) > 0 ? max : delay;
  }

  /**
   * Returns the delay before the first retry.
   *
   * @return the initial delay, never null
   */
  public Duration initial() {
    return initial;
  }

  /**
   * Returns the upper bound of the delay.
   *
   * @return the maximum delay, never null
   */
  public Duration max() {
    return max;
  }
}
