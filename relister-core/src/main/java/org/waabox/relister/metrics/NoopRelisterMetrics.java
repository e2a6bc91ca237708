package org.waabox.relister.metrics;

/**
 * A no-operation implementation of {@link RelisterMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopRelisterMetrics implements RelisterMetrics {

  /** {@inheritDoc} */
  @Override
  public void refreshTriggered(final String kind, final String namespace) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshCompleted(final String kind, final String namespace,
      final long durationMs, final boolean success) {
  }

  /** {@inheritDoc} */
  @Override
  public void namespaceChecked(final String kind, final String namespace) {
  }
}
