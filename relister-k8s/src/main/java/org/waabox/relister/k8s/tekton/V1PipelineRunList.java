package org.waabox.relister.k8s.tekton;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.SerializedName;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.openapi.models.V1ListMeta;

/**
 * A list of {@link V1PipelineRun} resources.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class V1PipelineRunList implements KubernetesListObject {

  @SerializedName("apiVersion")
  private String apiVersion;

  @SerializedName("kind")
  private String kind;

  @SerializedName("metadata")
  private V1ListMeta metadata;

  @SerializedName("items")
  private List<V1PipelineRun> items = new ArrayList<>();

  public V1PipelineRunList metadata(final V1ListMeta theMetadata) {
    metadata = theMetadata;
    return this;
  }

  public V1PipelineRunList items(final List<V1PipelineRun> theItems) {
    items = theItems;
    return this;
  }

  @Override
  public String getApiVersion() {
    return apiVersion;
  }

  @Override
  public String getKind() {
    return kind;
  }

  @Override
  public V1ListMeta getMetadata() {
    return metadata;
  }

  @Override
  public List<V1PipelineRun> getItems() {
    return items;
  }
}
