package io.sessionstreams.spring.webflux.starter;

import io.sessionstreams.server.core.InMemorySessionEventLog;
import io.sessionstreams.server.core.SessionStreamsHandler;
import io.sessionstreams.server.spi.DomainActionHandler;
import io.sessionstreams.server.spi.SessionEventLog;
import io.sessionstreams.spring.webflux.SessionStreamsWebFluxAdapter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for session event streams with Spring WebFlux.
 *
 * <p>Provides default beans for {@link SessionEventLog}, {@link SessionStreamsHandler} and
 * {@link SessionStreamsWebFluxAdapter}; each can be overridden by defining your own bean. A
 * {@link DomainActionHandler} bean, when present, serves tool calls.
 *
 * <p>No routes are registered. Map the adapter yourself:
 * <pre>{@code
 * @Bean
 * public RouterFunction<ServerResponse> sessionStreamRoutes(SessionStreamsWebFluxAdapter adapter) {
 *     return RouterFunctions.route(RequestPredicates.path("/api/stream/**"), adapter::handle);
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass({SessionStreamsHandler.class, SessionStreamsWebFluxAdapter.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@EnableConfigurationProperties(SessionStreamsProperties.class)
public class SessionStreamsWebFluxAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SessionEventLog sessionEventLog(SessionStreamsProperties properties) {
        return new InMemorySessionEventLog(properties.getMaxEventsPerSession());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public SessionStreamsHandler sessionStreamsHandler(
            SessionEventLog eventLog,
            SessionStreamsProperties properties,
            ObjectProvider<DomainActionHandler> actionHandler
    ) {
        return SessionStreamsHandler.builder(eventLog)
                .actionHandler(actionHandler.getIfAvailable())
                .heartbeatInterval(properties.getHeartbeatInterval())
                .sessionTimeout(properties.getSessionTimeout())
                .sweepInterval(properties.getSweepInterval())
                .maxQueuedFrames(properties.getMaxQueuedFrames())
                .maxBodySize(properties.getMaxBodySize().toBytes())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStreamsWebFluxAdapter sessionStreamsWebFluxAdapter(SessionStreamsHandler handler) {
        return new SessionStreamsWebFluxAdapter(handler);
    }
}
