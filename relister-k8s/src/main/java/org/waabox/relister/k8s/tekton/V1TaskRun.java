package org.waabox.relister.k8s.tekton;

import java.util.Map;

import com.google.gson.annotations.SerializedName;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;

/**
 * A Tekton {@code TaskRun} of the {@code tekton.dev/v1} API.
 *
 * <p>The spec is kept as a raw map; only metadata and the status fields of
 * {@link V1RunStatus} are typed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class V1TaskRun implements KubernetesObject {

  @SerializedName("apiVersion")
  private String apiVersion;

  @SerializedName("kind")
  private String kind;

  @SerializedName("metadata")
  private V1ObjectMeta metadata;

  @SerializedName("spec")
  private Map<String, Object> spec;

  @SerializedName("status")
  private V1RunStatus status;

  public V1TaskRun apiVersion(final String theApiVersion) {
    apiVersion = theApiVersion;
    return this;
  }

  public V1TaskRun kind(final String theKind) {
    kind = theKind;
    return this;
  }

  public V1TaskRun metadata(final V1ObjectMeta theMetadata) {
    metadata = theMetadata;
    return this;
  }

  public V1TaskRun spec(final Map<String, Object> theSpec) {
    spec = theSpec;
    return this;
  }

  public V1TaskRun status(final V1RunStatus theStatus) {
    status = theStatus;
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
  public V1ObjectMeta getMetadata() {
    return metadata;
  }

  public Map<String, Object> getSpec() {
    return spec;
  }

  /** @return the status, null when the server sent none. */
  public V1RunStatus getStatus() {
    return status;
  }
}
