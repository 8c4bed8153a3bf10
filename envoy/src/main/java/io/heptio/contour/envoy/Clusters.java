package io.heptio.contour.envoy;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Duration;
import com.google.protobuf.UInt32Value;
import com.google.protobuf.util.Durations;
import io.envoyproxy.envoy.config.cluster.v3.Cluster;
import io.envoyproxy.envoy.config.cluster.v3.Cluster.DiscoveryType;
import io.envoyproxy.envoy.config.cluster.v3.Cluster.EdsClusterConfig;
import io.envoyproxy.envoy.config.cluster.v3.Cluster.LbPolicy;
import io.envoyproxy.envoy.config.core.v3.AggregatedConfigSource;
import io.envoyproxy.envoy.config.core.v3.ApiVersion;
import io.envoyproxy.envoy.config.core.v3.ConfigSource;
import io.envoyproxy.envoy.config.core.v3.HealthCheck;
import io.envoyproxy.envoy.config.core.v3.HealthCheck.HttpHealthCheck;
import io.heptio.contour.naming.BackendDescriptor;
import io.heptio.contour.naming.ClusterNames;
import io.heptio.contour.naming.HealthCheckPolicy;
import java.util.Map;

/**
 * {@code Clusters} translates backends into Envoy v3 {@link Cluster} resources named by
 * {@link ClusterNames}.
 */
public class Clusters {

  static final Duration CONNECT_TIMEOUT = Durations.fromMillis(250);

  static final String HEALTH_CHECK_PATH = "/";
  static final String HEALTH_CHECK_HOST = "contour-envoy-healthcheck";
  static final int HEALTH_CHECK_TIMEOUT_SECONDS = 2;
  static final int HEALTH_CHECK_INTERVAL_SECONDS = 10;
  static final int UNHEALTHY_THRESHOLD = 3;
  static final int HEALTHY_THRESHOLD = 2;

  private static final Map<String, LbPolicy> LB_POLICIES =
      ImmutableMap.of(
          "WeightedLeastRequest", LbPolicy.LEAST_REQUEST,
          "Random", LbPolicy.RANDOM,
          "RingHash", LbPolicy.RING_HASH,
          "Maglev", LbPolicy.MAGLEV);

  /**
   * Returns the EDS cluster for the given backend.
   *
   * @param backend the backend the cluster routes to
   */
  public static Cluster cluster(BackendDescriptor backend) {
    Preconditions.checkNotNull(backend, "backend cannot be null");

    ConfigSource edsSource =
        ConfigSource.newBuilder()
            .setAds(AggregatedConfigSource.getDefaultInstance())
            .setResourceApiVersion(ApiVersion.V3)
            .build();

    Cluster.Builder cluster =
        Cluster.newBuilder()
            .setName(ClusterNames.clusterName(backend))
            .setType(DiscoveryType.EDS)
            .setEdsClusterConfig(
                EdsClusterConfig.newBuilder()
                    .setEdsConfig(edsSource)
                    .setServiceName(serviceName(backend)))
            .setConnectTimeout(CONNECT_TIMEOUT)
            .setLbPolicy(lbPolicy(backend.loadBalancerStrategy()));

    if (backend.healthCheck() != null) {
      cluster.addHealthChecks(healthCheck(backend.healthCheck()));
    }

    return cluster.build();
  }

  /**
   * Returns the EDS service name of a backend, {@code namespace/name/port}. Endpoints are published
   * under this name, independently of the cluster configuration.
   */
  public static String serviceName(BackendDescriptor backend) {
    return backend.namespace() + "/" + backend.name() + "/" + backend.port();
  }

  /**
   * Returns the Envoy load balancer policy for a strategy name. Unknown and missing strategies map
   * to round robin.
   */
  static LbPolicy lbPolicy(String strategy) {
    return LB_POLICIES.getOrDefault(Strings.nullToEmpty(strategy), LbPolicy.ROUND_ROBIN);
  }

  static HealthCheck healthCheck(HealthCheckPolicy policy) {
    return HealthCheck.newBuilder()
        .setTimeout(
            Durations.fromSeconds(orDefault(policy.timeoutSeconds(), HEALTH_CHECK_TIMEOUT_SECONDS)))
        .setInterval(
            Durations.fromSeconds(orDefault(policy.intervalSeconds(), HEALTH_CHECK_INTERVAL_SECONDS)))
        .setUnhealthyThreshold(
            UInt32Value.of(orDefault(policy.unhealthyThresholdCount(), UNHEALTHY_THRESHOLD)))
        .setHealthyThreshold(
            UInt32Value.of(orDefault(policy.healthyThresholdCount(), HEALTHY_THRESHOLD)))
        .setHttpHealthCheck(
            HttpHealthCheck.newBuilder()
                .setPath(Strings.isNullOrEmpty(policy.path()) ? HEALTH_CHECK_PATH : policy.path())
                .setHost(HEALTH_CHECK_HOST))
        .build();
  }

  private static int orDefault(int value, int defaultValue) {
    return value > 0 ? value : defaultValue;
  }

  private Clusters() {}
}
