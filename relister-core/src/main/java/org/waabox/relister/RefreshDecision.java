package org.waabox.relister;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of checking one listed item against the authoritative source.
 *
 * <p>A decision either says no refresh is needed, says a refresh is needed
 * because the authoritative copy has a status, or carries the failure that
 * prevented the check. A failed check always requires a refresh.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RefreshDecision {

  /** The decision for items that do not need a refresh. */
  private static final RefreshDecision NOT_NEEDED =
      new RefreshDecision(false, null, null);

  /** Whether the list must be read again bypassing the cache. */
  private final boolean refreshNeeded;

  /** The key of the item that triggered the refresh, may be null. */
  private final ResourceKey key;

  /** The failure of the direct read, may be null. */
  private final RuntimeException failure;

  /** Private constructor; use the static factory methods. */
  private RefreshDecision(final boolean theRefreshNeeded,
      final ResourceKey theKey, final RuntimeException theFailure) {
    refreshNeeded = theRefreshNeeded;
    key = theKey;
    failure = theFailure;
  }

  /**
   * Returns the decision for an item that needs no refresh.
   *
   * @return the decision, never null
   */
  public static RefreshDecision notNeeded() {
    return NOT_NEEDED;
  }

  /**
   * Returns the decision for an item whose cached copy is stale.
   *
   * @param key the key of the stale item, never null
   *
   * @return the decision, never null
   */
  public static RefreshDecision needed(final ResourceKey key) {
    Objects.requireNonNull(key, "key must not be null");
    return new RefreshDecision(true, key, null);
  }

  /**
   * Returns the decision for an item that could not be verified.
   *
   * @param key     the key of the item, null if it could not be read
   * @param failure the failure of the direct read, never null
   *
   * @return a decision that requires a refresh, never null
   */
  public static RefreshDecision failed(final ResourceKey key,
      final RuntimeException failure) {
    Objects.requireNonNull(failure, "failure must not be null");
    return new RefreshDecision(true, key, failure);
  }

  /**
   * Tells whether the list must be read again bypassing the cache.
   *
   * @return true if a refresh is needed
   */
  public boolean refreshNeeded() {
    return refreshNeeded;
  }

  /**
   * Returns the key of the item that triggered the refresh.
   *
   * @return the key, or empty if no refresh is needed or the key of the
   *         item could not be read
   */
  public Optional<ResourceKey> key() {
    return Optional.ofNullable(key);
  }

  /**
   * Returns the failure that prevented the check.
   *
   * @return the failure, or empty if the check completed
   */
  public Optional<RuntimeException> failure() {
    return Optional.ofNullable(failure);
  }

  @Override
  public String toString() {
    return "RefreshDecision{refreshNeeded=" + refreshNeeded
        + ", key=" + key + ", failure=" + failure + "}";
  }
}
