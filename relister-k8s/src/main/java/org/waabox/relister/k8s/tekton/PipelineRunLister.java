package org.waabox.relister.k8s.tekton;

import java.util.List;

import org.waabox.relister.k8s.KubernetesRefreshLister;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.generic.GenericKubernetesApi;

/**
 * Lists and reads Tekton {@code PipelineRun}s of the {@code tekton.dev/v1} API.
 *
 * <p>A PipelineRun has an empty status until the Tekton controller records its
 * start time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PipelineRunLister
    extends KubernetesRefreshLister<V1PipelineRun, V1PipelineRunList> {

  /** The API group of Tekton pipelines. */
  static final String GROUP = "tekton.dev";

  /** The served API version. */
  static final String VERSION = "v1";

  /** The resource plural. */
  static final String PLURAL = "pipelineruns";

  /** The group, version and kind, used when logging. */
  static final String KIND = GROUP + "/" + VERSION + ", Kind=PipelineRun";

  /**
   * Creates a new lister.
   *
   * @param apiClient the Kubernetes API client, never null
   */
  public PipelineRunLister(final ApiClient apiClient) {
    this(new GenericKubernetesApi<>(V1PipelineRun.class, V1PipelineRunList.class,
        GROUP, VERSION, PLURAL, apiClient));
  }

  // Visible for testing.
  PipelineRunLister(final GenericKubernetesApi<V1PipelineRun, V1PipelineRunList> api) {
    super(api, KIND);
  }

  /** {@inheritDoc} */
  @Override
  public boolean statusIsEmpty(final V1PipelineRun run) {
    return run == null
        || run.getStatus() == null
        || run.getStatus().getStartTime() == null;
  }

  /** {@inheritDoc} */
  @Override
  protected List<V1PipelineRun> itemsOf(final V1PipelineRunList list) {
    return list.getItems();
  }
}
