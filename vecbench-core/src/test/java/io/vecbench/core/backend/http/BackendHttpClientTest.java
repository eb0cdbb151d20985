package io.vecbench.core.backend.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class BackendHttpClientTest {

    @Test
    void shouldParseRetryAfterSeconds() {
        assertThat(BackendHttpClient.retryAfterMs("3")).isEqualTo(3000);
        assertThat(BackendHttpClient.retryAfterMs("0.5")).isEqualTo(500);
        assertThat(BackendHttpClient.retryAfterMs("Wed, 21 Oct 2026 07:28:00 GMT")).isEqualTo(-1);
        assertThat(BackendHttpClient.retryAfterMs(null)).isEqualTo(-1);
    }

    @Test
    void shouldReadVectorsFromArraysAndText() {
        assertThat(JsonVectors.read(TextNode.valueOf("[1, -0.5]"))).containsExactly(1f, -0.5f);
        assertThat(JsonVectors.read(JsonNodeFactory.instance.arrayNode().add(0.25).add(0.75))).containsExactly(0.25f, 0.75f);
        assertThat(JsonVectors.read(JsonNodeFactory.instance.nullNode())).isNull();
        assertThat(JsonVectors.read(TextNode.valueOf("[]"))).isNull();
        assertThat(JsonVectors.truncate("abcdef", 4)).isEqualTo("abcd");
    }
}
