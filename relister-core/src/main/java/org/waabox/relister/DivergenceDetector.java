package org.waabox.relister;

import java.util.Objects;

/**
 * Decides whether a listed item shows that the watch cache is stale.
 *
 * <p>An item listed with an empty status is read again directly from the
 * authoritative source. If that copy has a status, the cached list is stale.
 * Items listed with a status are never read again, so the check costs
 * nothing when the cache is consistent.
 *
 * <p>A failed direct read, including a missing resource, also requires a
 * refresh: an item that cannot be verified does not prove the cache right.
 *
 * <p>This class is stateless and thread-safe.
 *
 * @param <T> the resource item type
 * @param <L> the resource list type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DivergenceDetector<T, L> {

  /** The adapter of the resource kind. */
  private final RefreshLister<T, L> lister;

  /**
   * Creates a new detector.
   *
   * @param theLister the adapter of the resource kind, never null
   */
  public DivergenceDetector(final RefreshLister<T, L> theLister) {
    lister = Objects.requireNonNull(theLister, "lister must not be null");
  }

  /**
   * Checks one listed item against the authoritative source.
   *
   * @param item the item as listed, may be null
   *
   * @return the decision, never null
   */
  public RefreshDecision needsRefresh(final T item) {
    if (!lister.statusIsEmpty(item)) {
      return RefreshDecision.notNeeded();
    }
    if (item == null) {
      return RefreshDecision.failed(null,
          new RelisterException("Listed " + lister.kind() + " is null"));
    }
    ResourceKey key = null;
    final T fresh;
    try {
      key = lister.keyOf(item);
      fresh = lister.get(key.namespace(), key.name());
    } catch (final RuntimeException e) {
      return RefreshDecision.failed(key, e);
    }
    if (lister.statusIsEmpty(fresh)) {
      return RefreshDecision.notNeeded();
    }
    return RefreshDecision.needed(key);
  }
}
