package io.sessionstreams.server.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SseFrameTest {

    @Test
    void rendersIdEventAndData() {
        SseFrame frame = new SseFrame("move", "s1:1", "{\"seq\":1}");

        assertThat(frame.render()).isEqualTo("id: s1:1\nevent: move\ndata: {\"seq\":1}\n\n");
    }

    @Test
    void omitsIdWhenAbsent() {
        assertThat(new SseFrame("connected", "{}").render()).isEqualTo("event: connected\ndata: {}\n\n");
    }

    @Test
    void splitsMultilineData() {
        assertThat(new SseFrame("x", "a\nb").render()).isEqualTo("event: x\ndata: a\ndata: b\n\n");
    }

    @Test
    void heartbeatIsCommentOnly() {
        assertThat(SseFrames.HEARTBEAT.isComment()).isTrue();
        assertThat(SseFrames.HEARTBEAT.render()).isEqualTo(": heartbeat\n\n");
        assertThat(SseFrames.HEARTBEAT.event()).isNull();
    }
}
