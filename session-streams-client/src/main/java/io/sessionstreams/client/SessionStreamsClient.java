package io.sessionstreams.client;

import io.sessionstreams.core.ActionResult;
import io.sessionstreams.core.DomainEvent;
import io.sessionstreams.core.SessionStreamEvent;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Flow;

public interface SessionStreamsClient {

    /**
     * Follows a session's event stream, reconnecting with the last seen event id until the subscriber cancels
     * or the server rejects the subscription with a 4xx status.
     *
     * <p>Duplicate domain events are dropped; a jump in sequence numbers is reported as
     * {@link SessionStreamEvent.Gap} before the event that revealed it.
     */
    Flow.Publisher<SessionStreamEvent> subscribe(SubscribeRequest request);

    /**
     * Runs a domain action. Rejected actions (HTTP 400) are returned as failed results.
     */
    ActionResult callTool(URI toolUrl, String tool, Map<String, Object> args) throws Exception;

    DispatchResult dispatch(URI eventsUrl, String sessionId, List<DomainEvent> events) throws Exception;

    static SessionStreamsClient create() {
        return builder().build();
    }

    static SessionStreamsClientBuilder builder() {
        return new SessionStreamsClientBuilder();
    }
}
