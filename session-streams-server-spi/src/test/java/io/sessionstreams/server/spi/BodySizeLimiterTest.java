package io.sessionstreams.server.spi;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BodySizeLimiterTest {

    @Test
    void readsBodyWithinLimit() throws Exception {
        byte[] bytes = BodySizeLimiter.readAll(new ByteArrayInputStream("hello".getBytes()), 5);

        assertThat(new String(bytes)).isEqualTo("hello");
    }

    @Test
    void rejectsBodyOverLimit() {
        assertThatThrownBy(() -> BodySizeLimiter.readAll(new ByteArrayInputStream(new byte[20_000]), 10_000))
                .isInstanceOf(BodySizeLimiter.PayloadTooLargeException.class)
                .satisfies(e -> assertThat(((BodySizeLimiter.PayloadTooLargeException) e).maxBytes()).isEqualTo(10_000));
    }

    @Test
    void nonPositiveLimitMeansUnlimited() throws Exception {
        assertThat(BodySizeLimiter.readAll(new ByteArrayInputStream(new byte[100]), 0)).hasSize(100);
        assertThat(BodySizeLimiter.readAll(null, 10)).isEmpty();
    }
}
