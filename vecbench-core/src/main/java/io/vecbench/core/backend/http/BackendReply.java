package io.vecbench.core.backend.http;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.Headers;

public record BackendReply(int status, JsonNode body, Headers headers) {
}
