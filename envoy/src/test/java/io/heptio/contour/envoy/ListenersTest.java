package io.heptio.contour.envoy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.protobuf.InvalidProtocolBufferException;
import io.envoyproxy.envoy.config.core.v3.ApiConfigSource;
import io.envoyproxy.envoy.config.core.v3.ConfigSource;
import io.envoyproxy.envoy.config.listener.v3.Filter;
import io.envoyproxy.envoy.config.listener.v3.ListenerFilter;
import io.envoyproxy.envoy.extensions.access_loggers.file.v3.FileAccessLog;
import io.envoyproxy.envoy.extensions.filters.listener.tls_inspector.v3.TlsInspector;
import io.envoyproxy.envoy.extensions.filters.network.http_connection_manager.v3.HttpConnectionManager;
import io.envoyproxy.envoy.extensions.filters.network.http_connection_manager.v3.HttpFilter;
import java.util.stream.Collectors;
import org.junit.Test;

public class ListenersTest {

  @Test
  public void tlsInspectorCarriesTypedConfig() {
    ListenerFilter filter = Listeners.tlsInspector();

    assertThat(filter.getName()).isEqualTo(Listeners.FILTER_TLS_INSPECTOR);
    assertThat(filter.getTypedConfig().is(TlsInspector.class)).isTrue();
  }

  @Test
  public void httpConnectionManagerUsesRdsForRoute() throws InvalidProtocolBufferException {
    Filter filter = Listeners.httpConnectionManager("ingress_http", "/dev/stdout");

    assertThat(filter.getName()).isEqualTo(Listeners.FILTER_HTTP_CONNECTION_MANAGER);

    HttpConnectionManager manager = filter.getTypedConfig().unpack(HttpConnectionManager.class);
    assertThat(manager.getStatPrefix()).isEqualTo("ingress_http");
    assertThat(manager.getRds().getRouteConfigName()).isEqualTo("ingress_http");

    ConfigSource source = manager.getRds().getConfigSource();
    assertThat(source.getApiConfigSource().getApiType()).isEqualTo(ApiConfigSource.ApiType.GRPC);
    assertThat(source.getApiConfigSource().getGrpcServices(0).getEnvoyGrpc().getClusterName())
        .isEqualTo(Listeners.XDS_CLUSTER);

    assertThat(manager.getHttpFiltersList().stream().map(HttpFilter::getName).collect(Collectors.toList()))
        .containsExactly(
            Listeners.FILTER_COMPRESSOR, Listeners.FILTER_GRPC_WEB, Listeners.FILTER_ROUTER);
    assertThat(manager.getUseRemoteAddress().getValue()).isTrue();
  }

  @Test
  public void httpConnectionManagerWritesAccessLog() throws InvalidProtocolBufferException {
    HttpConnectionManager manager =
        Listeners.httpConnectionManager("ingress_https", "/var/log/envoy/access.log")
            .getTypedConfig()
            .unpack(HttpConnectionManager.class);

    assertThat(manager.getAccessLogList()).hasSize(1);
    assertThat(manager.getAccessLog(0).getName()).isEqualTo(Listeners.ACCESS_LOG_FILE);
    assertThat(manager.getAccessLog(0).getTypedConfig().unpack(FileAccessLog.class).getPath())
        .isEqualTo("/var/log/envoy/access.log");
  }

  @Test
  public void httpConnectionManagerRejectsNullRouteName() {
    assertThatThrownBy(() -> Listeners.httpConnectionManager(null, "/dev/stdout"))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("routeName cannot be null");
    assertThatThrownBy(() -> Listeners.httpConnectionManager("ingress_http", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("accessLogPath cannot be null");
  }
}
