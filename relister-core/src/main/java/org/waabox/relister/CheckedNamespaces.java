package org.waabox.relister;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The namespaces whose lists have already been verified or refreshed.
 *
 * <p>Marks only grow: once a namespace is marked it stays marked for the
 * life of this instance, and its lists are never scanned again. Nothing is
 * persisted.
 *
 * <p>This class is thread-safe. Two concurrent calls for the same unmarked
 * namespace may both scan before either marks it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CheckedNamespaces {

  /** The marked namespaces. */
  private final Set<String> checked = ConcurrentHashMap.newKeySet();

  /**
   * Tells whether the namespace has been marked.
   *
   * @param namespace the namespace, never null
   *
   * @return true if marked
   */
  public boolean isChecked(final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    return checked.contains(namespace);
  }

  /**
   * Marks the namespace as checked.
   *
   * @param namespace the namespace, never null
   *
   * @return true if the namespace was not marked before
   */
  public boolean markChecked(final String namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    return checked.add(namespace);
  }

  /**
   * Returns the number of marked namespaces.
   *
   * @return the count
   */
  public int size() {
    return checked.size();
  }

  /**
   * Returns a read-only view of the marked namespaces.
   *
   * @return the namespaces, never null
   */
  public Set<String> namespaces() {
    return Collections.unmodifiableSet(checked);
  }
}
