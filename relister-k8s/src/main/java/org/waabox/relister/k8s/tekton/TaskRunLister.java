package org.waabox.relister.k8s.tekton;

import java.util.List;

import org.waabox.relister.k8s.KubernetesRefreshLister;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.generic.GenericKubernetesApi;

/**
 * Lists and reads Tekton {@code TaskRun}s of the {@code tekton.dev/v1} API.
 *
 * <p>A TaskRun has an empty status until the Tekton controller records its
 * start time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TaskRunLister
    extends KubernetesRefreshLister<V1TaskRun, V1TaskRunList> {

  /** The API group of Tekton pipelines. */
  static final String GROUP = "tekton.dev";

  /** The served API version. */
  static final String VERSION = "v1";

  /** The resource plural. */
  static final String PLURAL = "taskruns";

  /** The group, version and kind, used when logging. */
  static final String KIND = GROUP + "/" + VERSION + ", Kind=TaskRun";

  /**
   * Creates a new lister.
   *
   * @param apiClient the Kubernetes API client, never null
   */
  public TaskRunLister(final ApiClient apiClient) {
    this(new GenericKubernetesApi<>(V1TaskRun.class, V1TaskRunList.class,
        GROUP, VERSION, PLURAL, apiClient));
  }

  // Visible for testing.
  TaskRunLister(final GenericKubernetesApi<V1TaskRun, V1TaskRunList> api) {
    super(api, KIND);
  }

  /** {@inheritDoc} */
  @Override
  public boolean statusIsEmpty(final V1TaskRun run) {
    return run == null
        || run.getStatus() == null
        || run.getStatus().getStartTime() == null;
  }

  /** {@inheritDoc} */
  @Override
  protected List<V1TaskRun> itemsOf(final V1TaskRunList list) {
    return list.getItems();
  }
}
