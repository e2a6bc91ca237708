package org.waabox.relister.k8s.tekton;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * The status fields shared by Tekton TaskRuns and PipelineRuns.
 *
 * <p>Only the fields needed to tell whether the controller has started
 * reconciling the run are mapped; the rest of the status is ignored.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class V1RunStatus {

  /** The time the run started, null until the controller picks it up. */
  @SerializedName("startTime")
  private OffsetDateTime startTime;

  /** The time the run completed, may be null. */
  @SerializedName("completionTime")
  private OffsetDateTime completionTime;

  /** The conditions of the run, may be null. */
  @SerializedName("conditions")
  private List<RunCondition> conditions;

  public V1RunStatus startTime(final OffsetDateTime theStartTime) {
    startTime = theStartTime;
    return this;
  }

  public V1RunStatus completionTime(final OffsetDateTime theCompletionTime) {
    completionTime = theCompletionTime;
    return this;
  }

  public V1RunStatus addConditionsItem(final RunCondition condition) {
    if (conditions == null) {
      conditions = new ArrayList<>();
    }
    conditions.add(condition);
    return this;
  }

  public OffsetDateTime getStartTime() {
    return startTime;
  }

  public OffsetDateTime getCompletionTime() {
    return completionTime;
  }

  public List<RunCondition> getConditions() {
    return conditions;
  }
}
