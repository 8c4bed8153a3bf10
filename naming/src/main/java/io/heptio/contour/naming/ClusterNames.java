package io.heptio.contour.naming;

import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/**
 * {@code ClusterNames} derives the Envoy cluster name of a backend.
 *
 * <p>A cluster name has the form {@code namespace/name/port/fingerprint}. Namespace and name are
 * bounded with {@link Names#hashName(int, String...)}; the fingerprint is the first
 * {@value #FINGERPRINT_LENGTH} hex characters of {@link #FINGERPRINT_HASH} over
 * {@link #canonicalConfig(BackendDescriptor)}, so backends that differ only in load balancing or
 * health checking get different clusters.
 *
 * <p>Names are recomputed on every pass and must come out byte-identical for an unchanged backend,
 * otherwise Envoy sees a new cluster.
 */
public class ClusterNames {

  /** Length budget of the {@code namespace/name} part. */
  public static final int IDENTITY_BUDGET = 42;

  /** Longest name produced for a port in the valid range. */
  public static final int MAX_CLUSTER_NAME_LENGTH = 60;

  public static final int FINGERPRINT_LENGTH = 10;

  /**
   * Digest of the backend configuration. Changing it changes every cluster name.
   */
  @SuppressWarnings("deprecation")
  public static final HashFunction FINGERPRINT_HASH = Hashing.sha1();

  /**
   * Returns the cluster name of the given backend.
   *
   * @param backend the backend to name
   */
  public static String clusterName(BackendDescriptor backend) {
    return Names.hashName(IDENTITY_BUDGET, backend.namespace(), backend.name())
        + Names.SEPARATOR
        + backend.port()
        + Names.SEPARATOR
        + fingerprint(backend);
  }

  /**
   * Returns the configuration fingerprint of the given backend, the last segment of its cluster
   * name.
   */
  public static String fingerprint(BackendDescriptor backend) {
    return FINGERPRINT_HASH
        .hashString(canonicalConfig(backend), StandardCharsets.UTF_8)
        .toString()
        .substring(0, FINGERPRINT_LENGTH);
  }

  /**
   * Renders the non-identity configuration of a backend: the load balancer strategy, then the
   * health check timeout, interval, unhealthy threshold, healthy threshold and path, with no
   * separator. Unset numbers and an empty path contribute nothing, so a health check with only
   * defaults renders like no health check at all.
   *
   * <p>Durations use the {@code 1h2m3s} form, e.g. {@code Maglev30s5s31/healthz}.
   *
   * @param backend the backend whose configuration is rendered
   */
  public static String canonicalConfig(BackendDescriptor backend) {
    StringBuilder buf = new StringBuilder(nullToEmpty(backend.loadBalancerStrategy()));

    HealthCheckPolicy hc = backend.healthCheck();
    if (hc != null) {
      if (hc.timeoutSeconds() > 0) {
        buf.append(duration(hc.timeoutSeconds()));
      }
      if (hc.intervalSeconds() > 0) {
        buf.append(duration(hc.intervalSeconds()));
      }
      if (hc.unhealthyThresholdCount() > 0) {
        buf.append(hc.unhealthyThresholdCount());
      }
      if (hc.healthyThresholdCount() > 0) {
        buf.append(hc.healthyThresholdCount());
      }
      buf.append(hc.path());
    }

    return buf.toString();
  }

  /** Formats a positive number of seconds as {@code 45s}, {@code 1m30s} or {@code 2h0m5s}. */
  static String duration(int seconds) {
    int hours = seconds / 3600;
    int minutes = seconds % 3600 / 60;
    int secs = seconds % 60;
    if (hours > 0) {
      return hours + "h" + minutes + "m" + secs + "s";
    }
    if (minutes > 0) {
      return minutes + "m" + secs + "s";
    }
    return secs + "s";
  }

  private ClusterNames() {}
}
