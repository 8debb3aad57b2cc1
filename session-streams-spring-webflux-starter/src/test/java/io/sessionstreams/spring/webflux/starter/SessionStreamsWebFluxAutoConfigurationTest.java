package io.sessionstreams.spring.webflux.starter;

import io.sessionstreams.core.ActionResult;
import io.sessionstreams.server.core.HttpMethod;
import io.sessionstreams.server.core.InMemorySessionEventLog;
import io.sessionstreams.server.core.ServerRequest;
import io.sessionstreams.server.core.ServerResponse;
import io.sessionstreams.server.core.SessionStreamsHandler;
import io.sessionstreams.server.spi.DomainActionHandler;
import io.sessionstreams.server.spi.SessionEventLog;
import io.sessionstreams.spring.webflux.SessionStreamsWebFluxAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ReactiveWebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SessionStreamsWebFluxAutoConfigurationTest {

    private final ReactiveWebApplicationContextRunner contextRunner = new ReactiveWebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SessionStreamsWebFluxAutoConfiguration.class));

    @Test
    void providesDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SessionEventLog.class);
            assertThat(context).hasSingleBean(SessionStreamsHandler.class);
            assertThat(context).hasSingleBean(SessionStreamsWebFluxAdapter.class);
            assertThat(context.getBean(SessionEventLog.class)).isInstanceOf(InMemorySessionEventLog.class);
            assertThat(((InMemorySessionEventLog) context.getBean(SessionEventLog.class)).maxEventsPerSession())
                    .isEqualTo(100);
        });
    }

    @Test
    void bindsSessionStreamsProperties() {
        contextRunner
                .withPropertyValues(
                        "session-streams.max-events-per-session=5",
                        "session-streams.heartbeat-interval=10s",
                        "session-streams.session-timeout=15m",
                        "session-streams.max-body-size=64KB")
                .run(context -> {
                    SessionStreamsProperties properties = context.getBean(SessionStreamsProperties.class);
                    assertThat(properties.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(properties.getSessionTimeout()).isEqualTo(Duration.ofMinutes(15));
                    assertThat(properties.getSweepInterval()).isEqualTo(Duration.ofMinutes(1));
                    assertThat(properties.getMaxBodySize()).isEqualTo(DataSize.ofKilobytes(64));
                    assertThat(((InMemorySessionEventLog) context.getBean(SessionEventLog.class)).maxEventsPerSession())
                            .isEqualTo(5);
                });
    }

    @Test
    void backsOffWhenUserDefinesEventLog() {
        contextRunner.withUserConfiguration(CustomLogConfig.class).run(context -> {
            assertThat(context).hasSingleBean(SessionEventLog.class);
            assertThat(context.getBean(SessionEventLog.class)).isSameAs(CustomLogConfig.LOG);
        });
    }

    @Test
    void routesToolCallsToActionHandlerBean() {
        contextRunner.withUserConfiguration(ActionHandlerConfig.class).run(context -> {
            SessionStreamsHandler handler = context.getBean(SessionStreamsHandler.class);

            ServerResponse response = handler.handle(new ServerRequest(
                    HttpMethod.POST,
                    URI.create("http://localhost/api/stream"),
                    Map.of(),
                    new ByteArrayInputStream("{\"tool\":\"ping\"}".getBytes(StandardCharsets.UTF_8))));

            assertThat(response.status()).isEqualTo(200);
        });
    }

    @Test
    void staysOffOutsideReactiveWebApplications() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SessionStreamsWebFluxAutoConfiguration.class))
                .run(context -> assertThat(context).doesNotHaveBean(SessionStreamsHandler.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomLogConfig {
        static final SessionEventLog LOG = new InMemorySessionEventLog(7);

        @Bean
        SessionEventLog customLog() {
            return LOG;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class ActionHandlerConfig {
        @Bean
        DomainActionHandler pingHandler() {
            return (tool, args) -> ActionResult.ok(Map.of("pong", true));
        }
    }
}
