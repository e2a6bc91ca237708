package org.waabox.relister.metrics;

/**
 * An abstraction for recording how often lists had to be refreshed.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopRelisterMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RelisterMetrics {

  /**
   * Records that a stale list was detected and a refresh will follow.
   *
   * @param kind      the resource kind, never null
   * @param namespace the namespace being listed, never null
   */
  void refreshTriggered(String kind, String namespace);

  /**
   * Records the end of a refresh list call.
   *
   * @param kind       the resource kind, never null
   * @param namespace  the namespace being listed, never null
   * @param durationMs the duration of the list call in milliseconds
   * @param success    whether the list call succeeded
   */
  void refreshCompleted(String kind, String namespace, long durationMs,
      boolean success);

  /**
   * Records that a namespace was marked as checked.
   *
   * @param kind      the resource kind, never null
   * @param namespace the namespace, never null
   */
  void namespaceChecked(String kind, String namespace);
}
