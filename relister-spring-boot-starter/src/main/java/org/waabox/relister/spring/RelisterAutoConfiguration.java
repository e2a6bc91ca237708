package org.waabox.relister.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.waabox.relister.CheckedNamespaces;
import org.waabox.relister.RefreshLister;
import org.waabox.relister.RefreshingLister;
import org.waabox.relister.k8s.KubernetesClients;
import org.waabox.relister.k8s.PodLister;
import org.waabox.relister.k8s.tekton.PipelineRunLister;
import org.waabox.relister.k8s.tekton.TaskRunLister;
import org.waabox.relister.k8s.tekton.V1PipelineRun;
import org.waabox.relister.k8s.tekton.V1PipelineRunList;
import org.waabox.relister.k8s.tekton.V1TaskRun;
import org.waabox.relister.k8s.tekton.V1TaskRunList;
import org.waabox.relister.metrics.NoopRelisterMetrics;
import org.waabox.relister.metrics.RelisterMetrics;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;

/**
 * Spring Boot auto-configuration for Relister.
 *
 * <p>Creates one {@link RefreshingLister} per enabled resource kind. Each
 * one lives as long as the application context and owns its own
 * {@link CheckedNamespaces}: a namespace checked for TaskRuns is still
 * unchecked for PipelineRuns.
 *
 * <p>The Kubernetes {@link ApiClient} is created from the default
 * configuration unless the application defines one. An optional
 * {@link RelisterMetrics} bean is wired into every lister.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(RelisterProperties.class)
public class RelisterAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RelisterAutoConfiguration.class);

  /**
   * Creates the Kubernetes API client.
   *
   * @param properties the configuration properties, never null
   *
   * @return the client, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public ApiClient relisterApiClient(final RelisterProperties properties) {
    return KubernetesClients.defaultClient(properties.getReadTimeout());
  }

  /**
   * Creates the TaskRun lister.
   *
   * @param apiClient       the Kubernetes API client, never null
   * @param metricsProvider provider for an optional RelisterMetrics bean
   *
   * @return the lister, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "relister.task-runs", name = "enabled",
      havingValue = "true", matchIfMissing = true)
  public RefreshingLister<V1TaskRun, V1TaskRunList> taskRunRefreshingLister(
      final ApiClient apiClient,
      final ObjectProvider<RelisterMetrics> metricsProvider) {
    return create(new TaskRunLister(apiClient), metricsProvider);
  }

  /**
   * Creates the PipelineRun lister.
   *
   * @param apiClient       the Kubernetes API client, never null
   * @param metricsProvider provider for an optional RelisterMetrics bean
   *
   * @return the lister, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "relister.pipeline-runs", name = "enabled",
      havingValue = "true", matchIfMissing = true)
  public RefreshingLister<V1PipelineRun, V1PipelineRunList>
      pipelineRunRefreshingLister(final ApiClient apiClient,
          final ObjectProvider<RelisterMetrics> metricsProvider) {
    return create(new PipelineRunLister(apiClient), metricsProvider);
  }

  /**
   * Creates the Pod lister.
   *
   * @param apiClient       the Kubernetes API client, never null
   * @param metricsProvider provider for an optional RelisterMetrics bean
   *
   * @return the lister, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "relister.pods", name = "enabled",
      havingValue = "true")
  public RefreshingLister<V1Pod, V1PodList> podRefreshingLister(
      final ApiClient apiClient,
      final ObjectProvider<RelisterMetrics> metricsProvider) {
    return create(new PodLister(apiClient), metricsProvider);
  }

  /** Creates a lister with its own memo and the available metrics. */
  private static <T, L> RefreshingLister<T, L> create(
      final RefreshLister<T, L> lister,
      final ObjectProvider<RelisterMetrics> metricsProvider) {
    final RelisterMetrics metrics =
        metricsProvider.getIfAvailable(NoopRelisterMetrics::new);
    log.info("Relister created for {} using {}", lister.kind(),
        metrics.getClass().getSimpleName());
    return new RefreshingLister<>(lister, metrics, new CheckedNamespaces());
  }
}
