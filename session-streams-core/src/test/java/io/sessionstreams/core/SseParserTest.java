package io.sessionstreams.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SseParserTest {

    @Test
    void parsesIdEventAndData() throws Exception {
        try (SseParser parser = parser("id: s1:1\nevent: move\ndata: {\"a\":1}\n\n")) {
            SseParser.Event ev = parser.next();

            assertThat(ev.id()).isEqualTo("s1:1");
            assertThat(ev.eventType()).isEqualTo("move");
            assertThat(ev.data()).isEqualTo("{\"a\":1}");
            assertThat(parser.next()).isNull();
        }
    }

    @Test
    void skipsHeartbeatComments() throws Exception {
        try (SseParser parser = parser(": heartbeat\n\nevent: connected\ndata: {}\n\n: heartbeat\n\n")) {
            SseParser.Event ev = parser.next();

            assertThat(ev.eventType()).isEqualTo("connected");
            assertThat(ev.id()).isNull();
            assertThat(parser.next()).isNull();
        }
    }

    @Test
    void joinsMultilineData() throws Exception {
        try (SseParser parser = parser("data: line1\ndata: line2\n\n")) {
            SseParser.Event ev = parser.next();

            assertThat(ev.eventType()).isEqualTo("message");
            assertThat(ev.data()).isEqualTo("line1\nline2");
        }
    }

    @Test
    void keepsInnerWhitespace() throws Exception {
        try (SseParser parser = parser("event:x\ndata:  padded \n\n")) {
            SseParser.Event ev = parser.next();

            assertThat(ev.eventType()).isEqualTo("x");
            assertThat(ev.data()).isEqualTo(" padded ");
        }
    }

    private static SseParser parser(String body) {
        return new SseParser(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }
}
