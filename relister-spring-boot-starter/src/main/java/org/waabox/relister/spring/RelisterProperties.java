package org.waabox.relister.spring;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Relister, mapped from the {@code relister.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code relister.read-timeout} - the read timeout of the Kubernetes
 *       API client created when the application defines none. Defaults to
 *       5 seconds.</li>
 *   <li>{@code relister.task-runs.enabled} - whether to create the Tekton
 *       TaskRun lister. Defaults to true.</li>
 *   <li>{@code relister.pipeline-runs.enabled} - whether to create the
 *       Tekton PipelineRun lister. Defaults to true.</li>
 *   <li>{@code relister.pods.enabled} - whether to create the Pod lister.
 *       Defaults to false.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "relister")
public class RelisterProperties {

  /** The read timeout of the auto-configured Kubernetes API client. */
  private Duration readTimeout = Duration.ofSeconds(5);

  /** The TaskRun lister settings. */
  private final Resource taskRuns = new Resource(true);

  /** The PipelineRun lister settings. */
  private final Resource pipelineRuns = new Resource(true);

  /** The Pod lister settings. */
  private final Resource pods = new Resource(false);

  /**
   * Returns the read timeout of the auto-configured client.
   *
   * @return the read timeout, never null
   */
  public Duration getReadTimeout() {
    return readTimeout;
  }

  /**
   * Sets the read timeout of the auto-configured client.
   *
   * @param theReadTimeout the read timeout, never null
   */
  public void setReadTimeout(final Duration theReadTimeout) {
    readTimeout = theReadTimeout;
  }

  /** @return the TaskRun lister settings, never null */
  public Resource getTaskRuns() {
    return taskRuns;
  }

  /** @return the PipelineRun lister settings, never null */
  public Resource getPipelineRuns() {
    return pipelineRuns;
  }

  /** @return the Pod lister settings, never null */
  public Resource getPods() {
    return pods;
  }

  /** The settings of the lister of one resource kind. */
  public static class Resource {

    /** Whether the lister bean is created. */
    private boolean enabled;

    /**
     * Creates the settings.
     *
     * @param theEnabled the default value of the enabled flag
     */
    Resource(final boolean theEnabled) {
      enabled = theEnabled;
    }

    /** @return whether the lister bean is created */
    public boolean isEnabled() {
      return enabled;
    }

    /** @param theEnabled whether the lister bean is created */
    public void setEnabled(final boolean theEnabled) {
      enabled = theEnabled;
    }
  }
}
