package io.heptio.contour.naming;

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;

/**
 * {@code BackendDescriptor} is a Kubernetes service port as seen by the Envoy config generator.
 * Namespace, name and port identify the backend; the load balancer strategy and the health check
 * only configure it.
 */
@AutoValue
public abstract class BackendDescriptor {

  /**
   * Returns a new builder with an empty namespace and name and no configuration.
   */
  public static Builder builder() {
    return new AutoValue_BackendDescriptor.Builder()
        .namespace("")
        .name("")
        .port(0);
  }

  /**
   * Returns a descriptor for the given identity with no load balancer strategy or health check.
   *
   * @param namespace the namespace of the service
   * @param name the name of the service
   * @param port the service port
   */
  public static BackendDescriptor of(String namespace, String name, int port) {
    return builder().namespace(namespace).name(name).port(port).build();
  }

  public abstract String namespace();

  public abstract String name();

  /** Returns the service port Envoy connects to. */
  public abstract int port();

  /** Returns the load balancer strategy, e.g. {@code Maglev}, or null for the default. */
  @Nullable
  public abstract String loadBalancerStrategy();

  @Nullable
  public abstract HealthCheckPolicy healthCheck();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder namespace(String namespace);

    public abstract Builder name(String name);

    public abstract Builder port(int port);

    public abstract Builder loadBalancerStrategy(@Nullable String loadBalancerStrategy);

    public abstract Builder healthCheck(@Nullable HealthCheckPolicy healthCheck);

    public abstract BackendDescriptor build();
  }
}
