package org.waabox.relister;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.relister.metrics.NoopRelisterMetrics;
import org.waabox.relister.metrics.RelisterMetrics;

/**
 * Lists resources and repairs lists that the watch cache served stale.
 *
 * <p>Right after a resource definition changes, the API server watch cache
 * may return items with an empty status while the authoritative store
 * already has it. The first time a namespace is listed, its items are
 * checked with a {@link DivergenceDetector}; on the first stale item the
 * scan stops and the namespace is listed again without a resource version,
 * which bypasses the cache.
 *
 * <p>After a successful list the namespace is marked in
 * {@link CheckedNamespaces} and later lists of that namespace are returned
 * as they come. A failed list leaves the namespace unmarked, so the next
 * call checks it again.
 *
 * <p>Usage:
 * <pre>{@code
 * RefreshingLister<V1TaskRun, V1TaskRunList> taskRuns =
 *     RefreshingLister.of(new TaskRunLister(apiClient));
 *
 * V1TaskRunList runs = taskRuns.fetchOrRefreshList("ci",
 *     ListOptions.builder().resourceVersion("0").build());
 * }</pre>
 *
 * <p>One instance is meant to live as long as the process and is shared by
 * all its callers. This class is thread-safe when the adapter is.
 *
 * @param <T> the resource item type
 * @param <L> the resource list type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RefreshingLister<T, L> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RefreshingLister.class);

  /** The adapter of the resource kind. */
  private final RefreshLister<T, L> lister;

  /** The detector built over the adapter. */
  private final DivergenceDetector<T, L> detector;

  /** The metrics reporter. */
  private final RelisterMetrics metrics;

  /** The namespaces already checked by this instance. */
  private final CheckedNamespaces checkedNamespaces;

  /**
   * Creates a new orchestrator.
   *
   * @param theLister            the adapter of the resource kind, never null
   * @param theMetrics           the metrics reporter, never null
   * @param theCheckedNamespaces the memo owned by this instance, never null
   */
  public RefreshingLister(final RefreshLister<T, L> theLister,
      final RelisterMetrics theMetrics,
      final CheckedNamespaces theCheckedNamespaces) {
    lister = Objects.requireNonNull(theLister, "lister must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    checkedNamespaces = Objects.requireNonNull(theCheckedNamespaces,
        "checkedNamespaces must not be null");
    detector = new DivergenceDetector<>(lister);
  }

  /**
   * Creates a new orchestrator with no metrics and an empty memo.
   *
   * @param lister the adapter of the resource kind, never null
   * @param <T>    the resource item type
   * @param <L>    the resource list type
   *
   * @return the orchestrator, never null
   */
  public static <T, L> RefreshingLister<T, L> of(
      final RefreshLister<T, L> lister) {
    return new RefreshingLister<>(lister, new NoopRelisterMetrics(),
        new CheckedNamespaces());
  }

  /**
   * Lists a namespace, refreshing the list if the cache served it stale.
   *
   * @param namespace the namespace to list, never null
   * @param options   the read options, never null
   *
   * @return the list, refreshed when needed, never null
   *
   * @throws RelisterException if the final list call fails
   */
  public L fetchOrRefreshList(final String namespace,
      final ListOptions options) {
    return fetchOrRefreshList(namespace, options, checkedNamespaces);
  }

  /**
   * Lists a namespace using the given memo instead of the owned one.
   *
   * @param namespace the namespace to list, never null
   * @param options   the read options, never null
   * @param checked   the memo to read and update, never null
   *
   * @return the list, refreshed when needed, never null
   *
   * @throws RelisterException if the final list call fails
   */
  public L fetchOrRefreshList(final String namespace,
      final ListOptions options, final CheckedNamespaces checked) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(options, "options must not be null");
    Objects.requireNonNull(checked, "checked must not be null");

    L list = lister.list(namespace, options);

    if (checked.isChecked(namespace)) {
      log.debug("Namespace '{}' already checked for {}", namespace,
          lister.kind());
      return list;
    }

    if (isStale(namespace, options, list)) {
      list = refresh(namespace, options);
    }

    if (checked.markChecked(namespace)) {
      log.debug("Marked namespace '{}' as checked for {}", namespace,
          lister.kind());
      metrics.namespaceChecked(lister.kind(), namespace);
    }
    return list;
  }

  /**
   * Tells whether the namespace has been checked by this instance.
   *
   * @param namespace the namespace, never null
   *
   * @return true if later lists of the namespace skip the check
   */
  public boolean isChecked(final String namespace) {
    return checkedNamespaces.isChecked(namespace);
  }

  /**
   * Scans the listed items up to the first one that requires a refresh.
   *
   * @return true if a refresh is needed
   */
  private boolean isStale(final String namespace, final ListOptions options,
      final L list) {
    final List<T> items = lister.items(list);
    for (final T item : items) {
      final RefreshDecision decision = detector.needsRefresh(item);
      if (decision.refreshNeeded()) {
        log.info("Detected a need to refresh cache for {} '{}' in namespace"
            + " '{}' with options {}, error: {}", lister.kind(),
            decision.key().map(ResourceKey::name).orElse(null), namespace,
            options, decision.failure().map(Object::toString).orElse(null));
        metrics.refreshTriggered(lister.kind(), namespace);
        return true;
      }
    }
    return false;
  }

  /** Lists the namespace again without the resource version. */
  private L refresh(final String namespace, final ListOptions options) {
    final long start = System.nanoTime();
    try {
      final L list = lister.list(namespace, options.withoutResourceVersion());
      final long durationMs = elapsedMs(start);
      log.info("Refreshed the cache for {} in namespace '{}' in {} ms",
          lister.kind(), namespace, durationMs);
      metrics.refreshCompleted(lister.kind(), namespace, durationMs, true);
      return list;
    } catch (final RuntimeException e) {
      final long durationMs = elapsedMs(start);
      log.info("Refreshing the cache for {} in namespace '{}' failed after"
          + " {} ms, error: {}", lister.kind(), namespace, durationMs,
          e.toString());
      metrics.refreshCompleted(lister.kind(), namespace, durationMs, false);
      throw e;
    }
  }

  /** Returns the milliseconds elapsed since the given nano time. */
  private static long elapsedMs(final long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
