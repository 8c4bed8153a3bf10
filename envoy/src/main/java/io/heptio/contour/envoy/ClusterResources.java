package io.heptio.contour.envoy;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.envoyproxy.envoy.config.cluster.v3.Cluster;
import io.heptio.contour.naming.BackendDescriptor;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ClusterResources} is the set of clusters produced by one configuration pass, keyed by
 * cluster name.
 *
 * <p>The set is rebuilt from scratch on every pass. Backends that did not change produce the same
 * names and the same bytes, so {@link #version()} and {@link #version(String)} only move when the
 * backends do.
 */
@AutoValue
public abstract class ClusterResources {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClusterResources.class);

  /**
   * Returns the clusters of the given backends.
   *
   * <p>Backends equal to one already seen are skipped. A backend that differs from an earlier one
   * but maps to the same cluster name is dropped with a warning.
   *
   * @param backends the backends of this pass
   */
  public static ClusterResources create(Iterable<BackendDescriptor> backends) {
    Preconditions.checkNotNull(backends, "backends cannot be null");

    Map<String, BackendDescriptor> owners = new HashMap<>();
    ImmutableSortedMap.Builder<String, Cluster> clusters = ImmutableSortedMap.naturalOrder();
    ImmutableSortedMap.Builder<String, String> versions = ImmutableSortedMap.naturalOrder();
    Hasher aggregate = Hashing.sha256().newHasher();

    for (BackendDescriptor backend : backends) {
      Cluster cluster = Clusters.cluster(backend);
      String name = cluster.getName();

      BackendDescriptor owner = owners.putIfAbsent(name, backend);
      if (owner != null) {
        if (!owner.equals(backend)) {
          LOGGER.warn("cluster name {} of {} is already used by {}, ignoring it", name, backend, owner);
        }
        continue;
      }

      clusters.put(name, cluster);
      versions.put(name, Hashing.sha256().hashBytes(cluster.toByteArray()).toString());
    }

    ImmutableSortedMap<String, Cluster> resources = clusters.build();
    ImmutableSortedMap<String, String> resourceVersions = versions.build();
    resourceVersions.forEach(
        (name, version) -> aggregate.putString(name, StandardCharsets.UTF_8)
            .putString(version, StandardCharsets.UTF_8));

    String version = aggregate.hash().toString();
    LOGGER.debug("built {} clusters, version {}", resources.size(), version);

    return new AutoValue_ClusterResources(resources, resourceVersions, version);
  }

  /**
   * Returns the clusters of this pass, ordered by name.
   */
  public abstract ImmutableSortedMap<String, Cluster> resources();

  /**
   * Returns the version of each cluster, a digest of its serialized form.
   */
  public abstract ImmutableSortedMap<String, String> versions();

  /**
   * Returns the version of the whole set.
   */
  public abstract String version();

  /**
   * Returns the version of the named cluster, or null if this set has no such cluster.
   *
   * @param clusterName the cluster name
   */
  @Nullable
  public String version(String clusterName) {
    return versions().get(clusterName);
  }
}
