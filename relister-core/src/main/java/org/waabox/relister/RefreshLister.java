package org.waabox.relister;

import java.util.List;

/**
 * Access to one resource kind, as needed to detect and repair stale lists.
 *
 * <p>Implementations wrap a transport client and are stateless; one instance
 * exists per resource kind. Failures are thrown as {@link RelisterException}
 * and never retried here.
 *
 * @param <T> the resource item type
 * @param <L> the resource list type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RefreshLister<T, L> {

  /**
   * Lists the resources of a namespace.
   *
   * <p>The list may be served from the watch cache when the options carry a
   * resource version.
   *
   * @param namespace the namespace to list, never null
   * @param options   the read options, never null
   *
   * @return the list, never null
   *
   * @throws RelisterException if the list call fails
   */
  L list(String namespace, ListOptions options);

  /**
   * Reads one resource directly from the authoritative source.
   *
   * @param namespace the namespace of the resource, never null
   * @param name      the name of the resource, never null
   *
   * @return the resource, never null
   *
   * @throws ResourceNotFoundException if the resource does not exist
   * @throws RelisterException if the read fails
   */
  T get(String namespace, String name);

  /**
   * Extracts the items of a list.
   *
   * @param list the list, may be null
   *
   * @return the items in list order, empty when the list is null
   */
  List<T> items(L list);

  /**
   * Tells whether the status of a resource has not been populated yet.
   *
   * @param item the resource, may be null
   *
   * @return true if the status is empty or the item is null
   */
  boolean statusIsEmpty(T item);

  /**
   * Returns the namespace and name of a resource.
   *
   * @param item the resource, never null
   *
   * @return the key, never null
   */
  ResourceKey keyOf(T item);

  /**
   * Returns a description of the resource kind, used when logging.
   *
   * @return the kind, never null
   */
  String kind();
}
