package io.streamgateway.server;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayConfigTest {

    @Test
    void loadsDefaultsFromReferenceConf() {
        GatewayConfig config = GatewayConfig.fromConfig(ConfigFactory.load());

        assertThat(config.port()).isEqualTo(8000);
        assertThat(config.bufferCapacity()).isEqualTo(100);
        assertThat(config.heartbeatInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.backendIdleTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.httpClient()).isEqualTo(GatewayConfig.HttpClientKind.JDK);
        assertThat(config.callPathTemplate()).isEqualTo("/math/{method}");
        assertThat(config.streamQuery()).containsEntry("n", "50");
        assertThat(config.servers()).isEmpty();
    }

    @Test
    void overridesFromHocon() {
        Config hocon = ConfigFactory.parseString("""
                gateway {
                  port = 9100
                  session { buffer-capacity = 10, heartbeat-interval = 500ms, backend-idle-timeout = 0 }
                  backend { http-client = okhttp, stream-query { n = 7 } }
                  servers = [ { name = "math1", base-url = "http://127.0.0.1:9001" } ]
                }
                """);

        GatewayConfig config = GatewayConfig.fromConfig(hocon);

        assertThat(config.port()).isEqualTo(9100);
        assertThat(config.bufferCapacity()).isEqualTo(10);
        assertThat(config.heartbeatInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.backendIdleTimeout()).isEqualTo(Duration.ZERO);
        assertThat(config.httpClient()).isEqualTo(GatewayConfig.HttpClientKind.OKHTTP);
        assertThat(config.streamQuery()).isEqualTo(Map.of("n", "7"));
        assertThat(config.servers()).containsExactly(
                new GatewayConfig.StaticServer("math1", URI.create("http://127.0.0.1:9001")));
        assertThat(config.host()).isEqualTo("0.0.0.0");
    }
}
