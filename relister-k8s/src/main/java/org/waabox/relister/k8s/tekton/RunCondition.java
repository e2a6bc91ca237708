package org.waabox.relister.k8s.tekton;

import com.google.gson.annotations.SerializedName;

/**
 * A condition reported in the status of a Tekton run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RunCondition {

  @SerializedName("type")
  private String type;

  @SerializedName("status")
  private String status;

  @SerializedName("reason")
  private String reason;

  @SerializedName("message")
  private String message;

  public RunCondition type(final String theType) {
    type = theType;
    return this;
  }

  public RunCondition status(final String theStatus) {
    status = theStatus;
    return this;
  }

  public RunCondition reason(final String theReason) {
    reason = theReason;
    return this;
  }

  public RunCondition message(final String theMessage) {
    message = theMessage;
    return this;
  }

  /** @return the condition type, for example "Succeeded". */
  public String getType() {
    return type;
  }

  /** @return "True", "False" or "Unknown". */
  public String getStatus() {
    return status;
  }

  public String getReason() {
    return reason;
  }

  public String getMessage() {
    return message;
  }
}
