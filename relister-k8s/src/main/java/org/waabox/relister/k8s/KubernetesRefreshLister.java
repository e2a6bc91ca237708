package org.waabox.relister.k8s;

import java.util.List;
import java.util.Objects;

import org.waabox.relister.ListOptions;
import org.waabox.relister.RefreshLister;
import org.waabox.relister.RelisterException;
import org.waabox.relister.ResourceKey;
import org.waabox.relister.ResourceNotFoundException;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Status;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;

/**
 * A {@link RefreshLister} backed by the official Kubernetes Java client.
 *
 * <p>Lists go through {@link GenericKubernetesApi#list(String,
 * io.kubernetes.client.util.generic.options.ListOptions)} with the resource
 * version of the given options, so the API server may answer from its watch
 * cache. Gets go through {@link GenericKubernetesApi#get(String, String)},
 * which never uses the watch cache.
 *
 * <p>Failed responses are thrown as {@link RelisterException} carrying the
 * HTTP status code; a 404 on a get is thrown as
 * {@link ResourceNotFoundException}.
 *
 * <p>Subclasses only decide how to extract items and when a status is empty.
 *
 * @param <T> the resource type
 * @param <L> the resource list type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class KubernetesRefreshLister<T extends KubernetesObject,
    L extends KubernetesListObject> implements RefreshLister<T, L> {

  /** The HTTP status code of a missing resource. */
  private static final int NOT_FOUND = 404;

  /** The generic client for the resource kind. */
  private final GenericKubernetesApi<T, L> api;

  /** The group, version and kind, used when logging. */
  private final String kind;

  /**
   * Creates a new adapter.
   *
   * @param theApi  the generic client for the resource kind, never null
   * @param theKind the group, version and kind, never null
   */
  protected KubernetesRefreshLister(final GenericKubernetesApi<T, L> theApi,
      final String theKind) {
    api = Objects.requireNonNull(theApi, "api must not be null");
    kind = Objects.requireNonNull(theKind, "kind must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public L list(final String namespace, final ListOptions options) {
    Objects.requireNonNull(namespace, "namespace must not be null");
    Objects.requireNonNull(options, "options must not be null");
    final KubernetesApiResponse<L> response;
    try {
      response = api.list(namespace, toClientOptions(options));
    } catch (final RuntimeException e) {
      throw new RelisterException("Failed to list " + kind
          + " in namespace '" + namespace + "'", e);
    }
    if (!response.isSuccess()) {
      throw new RelisterException("Failed to list " + kind
          + " in namespace '" + namespace + "': " + message(response),
          response.getHttpStatusCode(), null);
    }
    return response.getObject();
  }

  /** {@inheritDoc} */
  @Override
  public T get(final String namespace, final String name) {
    final ResourceKey key = ResourceKey.of(namespace, name);
    final KubernetesApiResponse<T> response;
    try {
      response = api.get(namespace, name);
    } catch (final RuntimeException e) {
      throw new RelisterException("Failed to get " + kind + " '" + key
          + "'", e);
    }
    if (response.getHttpStatusCode() == NOT_FOUND) {
      throw new ResourceNotFoundException(kind, key, null);
    }
    if (!response.isSuccess()) {
      throw new RelisterException("Failed to get " + kind + " '" + key
          + "': " + message(response), response.getHttpStatusCode(), null);
    }
    return response.getObject();
  }

  /** {@inheritDoc} */
  @Override
  public List<T> items(final L list) {
    if (list == null) {
      return List.of();
    }
    final List<T> items = itemsOf(list);
    return items == null ? List.of() : items;
  }

  /** {@inheritDoc} */
  @Override
  public ResourceKey keyOf(final T item) {
    final V1ObjectMeta metadata = item.getMetadata();
    if (metadata == null) {
      throw new RelisterException(kind + " has no metadata");
    }
    return ResourceKey.of(metadata.getNamespace(), metadata.getName());
  }

  /** {@inheritDoc} */
  @Override
  public String kind() {
    return kind;
  }

  /**
   * Returns the items of a non-null list.
   *
   * @param list the list, never null
   *
   * @return the items, may be null
   */
  protected abstract List<T> itemsOf(L list);

  /**
   * Translates the options into the Kubernetes client ones.
   *
   * <p>A null resource version is left unset, which makes the API server
   * serve the list from etcd.
   *
   * @param options the options, never null
   *
   * @return the client options, never null
   */
  static io.kubernetes.client.util.generic.options.ListOptions
      toClientOptions(final ListOptions options) {
    final io.kubernetes.client.util.generic.options.ListOptions result =
        new io.kubernetes.client.util.generic.options.ListOptions();
    result.setResourceVersion(options.resourceVersion());
    result.setLabelSelector(options.labelSelector());
    result.setFieldSelector(options.fieldSelector());
    result.setLimit(options.limit());
    result.setContinue(options.continueToken());
    result.setTimeoutSeconds(options.timeoutSeconds());
    return result;
  }

  /** Returns the message of a failed response. */
  private static String message(final KubernetesApiResponse<?> response) {
    final V1Status status = response.getStatus();
    if (status == null || status.getMessage() == null) {
      return "HTTP " + response.getHttpStatusCode();
    }
    return status.getMessage();
  }
}
