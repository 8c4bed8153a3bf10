package io.heptio.contour.naming;

import com.google.auto.value.AutoValue;

/**
 * Active health check parameters of a backend. Numeric fields use {@code 0} for "not set".
 */
@AutoValue
public abstract class HealthCheckPolicy {

  public static Builder builder() {
    return new AutoValue_HealthCheckPolicy.Builder()
        .path("")
        .intervalSeconds(0)
        .timeoutSeconds(0)
        .unhealthyThresholdCount(0)
        .healthyThresholdCount(0);
  }

  /** Returns the HTTP path probed by the health check. */
  public abstract String path();

  public abstract int intervalSeconds();

  public abstract int timeoutSeconds();

  /** Returns the number of failed probes before an endpoint is marked unhealthy. */
  public abstract int unhealthyThresholdCount();

  /** Returns the number of successful probes before an endpoint is marked healthy. */
  public abstract int healthyThresholdCount();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder path(String path);

    public abstract Builder intervalSeconds(int intervalSeconds);

    public abstract Builder timeoutSeconds(int timeoutSeconds);

    public abstract Builder unhealthyThresholdCount(int unhealthyThresholdCount);

    public abstract Builder healthyThresholdCount(int healthyThresholdCount);

    public abstract HealthCheckPolicy build();
  }
}
