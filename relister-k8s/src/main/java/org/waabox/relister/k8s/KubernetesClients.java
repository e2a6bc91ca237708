package org.waabox.relister.k8s;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.relister.RelisterException;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;

/** Creates Kubernetes API clients.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KubernetesClients {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(KubernetesClients.class);

  /** Utility class. */
  private KubernetesClients() {
  }

  /** Creates the default Kubernetes API client.
   *
   * <p>Uses {@link Config#defaultClient()} which checks, in order:
   * <ol>
   *   <li>KUBECONFIG environment variable</li>
   *   <li>~/.kube/config</li>
   *   <li>In-cluster service account token</li>
   * </ol>
   *
   * @param readTimeout the read timeout of every call, never null.
   *
   * @return a configured {@link ApiClient}, never null.
   *
   * @throws RelisterException if the client cannot be created.
   */
  public static ApiClient defaultClient(final Duration readTimeout) {
    Objects.requireNonNull(readTimeout, "readTimeout must not be null");
    try {
      final ApiClient client = Config.defaultClient();
      client.setReadTimeout((int) readTimeout.toMillis());
      log.info("Kubernetes API client created for {} with read timeout {}",
          client.getBasePath(), readTimeout);
      return client;
    } catch (final IOException e) {
      throw new RelisterException("Failed to create Kubernetes API client",
          e);
    }
  }
}
