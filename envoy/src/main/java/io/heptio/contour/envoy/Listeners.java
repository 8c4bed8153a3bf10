package io.heptio.contour.envoy;

import com.google.common.base.Preconditions;
import com.google.protobuf.Any;
import com.google.protobuf.BoolValue;
import io.envoyproxy.envoy.config.accesslog.v3.AccessLog;
import io.envoyproxy.envoy.config.core.v3.ApiConfigSource;
import io.envoyproxy.envoy.config.core.v3.ApiVersion;
import io.envoyproxy.envoy.config.core.v3.ConfigSource;
import io.envoyproxy.envoy.config.core.v3.GrpcService;
import io.envoyproxy.envoy.config.core.v3.TypedExtensionConfig;
import io.envoyproxy.envoy.config.listener.v3.Filter;
import io.envoyproxy.envoy.config.listener.v3.ListenerFilter;
import io.envoyproxy.envoy.extensions.access_loggers.file.v3.FileAccessLog;
import io.envoyproxy.envoy.extensions.compression.gzip.compressor.v3.Gzip;
import io.envoyproxy.envoy.extensions.filters.http.compressor.v3.Compressor;
import io.envoyproxy.envoy.extensions.filters.http.grpc_web.v3.GrpcWeb;
import io.envoyproxy.envoy.extensions.filters.http.router.v3.Router;
import io.envoyproxy.envoy.extensions.filters.listener.tls_inspector.v3.TlsInspector;
import io.envoyproxy.envoy.extensions.filters.network.http_connection_manager.v3.HttpConnectionManager;
import io.envoyproxy.envoy.extensions.filters.network.http_connection_manager.v3.HttpFilter;
import io.envoyproxy.envoy.extensions.filters.network.http_connection_manager.v3.Rds;

/**
 * {@code Listeners} provides the listener and network filters installed on every Envoy listener.
 */
public class Listeners {

  /** Name of the cluster through which Envoy reaches the xDS server. */
  public static final String XDS_CLUSTER = "contour";

  static final String FILTER_TLS_INSPECTOR = "envoy.filters.listener.tls_inspector";
  static final String FILTER_HTTP_CONNECTION_MANAGER = "envoy.filters.network.http_connection_manager";
  static final String FILTER_COMPRESSOR = "envoy.filters.http.compressor";
  static final String FILTER_GRPC_WEB = "envoy.filters.http.grpc_web";
  static final String FILTER_ROUTER = "envoy.filters.http.router";
  static final String COMPRESSOR_GZIP = "envoy.compression.gzip.compressor";
  static final String ACCESS_LOG_FILE = "envoy.access_loggers.file";

  /**
   * Returns a new TLS inspector listener filter.
   */
  public static ListenerFilter tlsInspector() {
    return ListenerFilter.newBuilder()
        .setName(FILTER_TLS_INSPECTOR)
        .setTypedConfig(Any.pack(TlsInspector.getDefaultInstance()))
        .build();
  }

  /**
   * Returns a new HTTP connection manager filter that fetches the given route configuration over
   * RDS and writes its access log to the given path.
   *
   * @param routeName name of the route configuration, also used as stat prefix
   * @param accessLogPath file the access log is written to
   */
  public static Filter httpConnectionManager(String routeName, String accessLogPath) {
    Preconditions.checkNotNull(routeName, "routeName cannot be null");
    Preconditions.checkNotNull(accessLogPath, "accessLogPath cannot be null");

    ConfigSource rdsSource =
        ConfigSource.newBuilder()
            .setResourceApiVersion(ApiVersion.V3)
            .setApiConfigSource(
                ApiConfigSource.newBuilder()
                    .setApiType(ApiConfigSource.ApiType.GRPC)
                    .setTransportApiVersion(ApiVersion.V3)
                    .addGrpcServices(
                        GrpcService.newBuilder()
                            .setEnvoyGrpc(
                                GrpcService.EnvoyGrpc.newBuilder().setClusterName(XDS_CLUSTER))))
            .build();

    HttpConnectionManager manager =
        HttpConnectionManager.newBuilder()
            .setStatPrefix(routeName)
            .setRds(Rds.newBuilder().setConfigSource(rdsSource).setRouteConfigName(routeName))
            .addHttpFilters(
                HttpFilter.newBuilder()
                    .setName(FILTER_COMPRESSOR)
                    .setTypedConfig(
                        Any.pack(
                            Compressor.newBuilder()
                                .setCompressorLibrary(
                                    TypedExtensionConfig.newBuilder()
                                        .setName(COMPRESSOR_GZIP)
                                        .setTypedConfig(Any.pack(Gzip.getDefaultInstance())))
                                .build())))
            .addHttpFilters(
                HttpFilter.newBuilder()
                    .setName(FILTER_GRPC_WEB)
                    .setTypedConfig(Any.pack(GrpcWeb.getDefaultInstance())))
            .addHttpFilters(
                HttpFilter.newBuilder()
                    .setName(FILTER_ROUTER)
                    .setTypedConfig(Any.pack(Router.getDefaultInstance())))
            .setUseRemoteAddress(BoolValue.of(true))
            .addAccessLog(accessLog(accessLogPath))
            .build();

    return Filter.newBuilder()
        .setName(FILTER_HTTP_CONNECTION_MANAGER)
        .setTypedConfig(Any.pack(manager))
        .build();
  }

  private static AccessLog accessLog(String path) {
    return AccessLog.newBuilder()
        .setName(ACCESS_LOG_FILE)
        .setTypedConfig(Any.pack(FileAccessLog.newBuilder().setPath(path).build()))
        .build();
  }

  private Listeners() {}
}
