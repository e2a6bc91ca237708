package org.waabox.relister.k8s;

import java.util.List;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;

/**
 * Lists and reads core {@code v1} Pods.
 *
 * <p>A Pod has an empty status until the kubelet records its start time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PodLister extends KubernetesRefreshLister<V1Pod, V1PodList> {

  /** The group, version and kind, used when logging. */
  static final String KIND = "/v1, Kind=Pod";

  /**
   * Creates a new lister.
   *
   * @param apiClient the Kubernetes API client, never null
   */
  public PodLister(final ApiClient apiClient) {
    this(new GenericKubernetesApi<>(V1Pod.class, V1PodList.class,
        "", "v1", "pods", apiClient));
  }

  // Visible for testing.
  PodLister(final GenericKubernetesApi<V1Pod, V1PodList> api) {
    super(api, KIND);
  }

  /** {@inheritDoc} */
  @Override
  public boolean statusIsEmpty(final V1Pod pod) {
    return pod == null
        || pod.getStatus() == null
        || pod.getStatus().getStartTime() == null;
  }

  /** {@inheritDoc} */
  @Override
  protected List<V1Pod> itemsOf(final V1PodList list) {
    return list.getItems();
  }
}
