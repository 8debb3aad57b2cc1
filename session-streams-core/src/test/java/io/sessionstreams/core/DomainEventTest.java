package io.sessionstreams.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainEventTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    void factoryBuildsCanonicalId() {
        DomainEvent event = DomainEvent.of("s1", 4, "move", Map.of("x", 1), clock);

        assertThat(event.id()).isEqualTo("s1:4");
        assertThat(event.seq()).isEqualTo(4);
        assertThat(event.timestamp()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    void rejectsNonPositiveSeq() {
        assertThatThrownBy(() -> new DomainEvent("e0", 0, "move", "s1", null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMissingFields() {
        assertThatThrownBy(() -> new DomainEvent(null, 1, "move", "s1", null, 0))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new DomainEvent("e1", 1, " ", "s1", null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void actionResultDefaultsToNoEvents() {
        ActionResult result = new ActionResult(false, null, "boom", null);

        assertThat(result.events()).isEmpty();
        assertThat(ActionResult.failure("x").success()).isFalse();
    }
}
