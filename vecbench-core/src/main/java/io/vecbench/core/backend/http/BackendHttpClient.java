package io.vecbench.core.backend.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.vecbench.core.backend.BackendException;
import io.vecbench.core.backend.NamespaceNotFoundException;
import java.io.IOException;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON over HTTP for the backend adapters. Non-2xx replies become {@link BackendException}s
 * (404 as {@link NamespaceNotFoundException}) carrying the server's Retry-After hint.
 */
public final class BackendHttpClient {
    private static final Logger LOG = LoggerFactory.getLogger(BackendHttpClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 500;

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public BackendHttpClient(OkHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public BackendReply send(String method, HttpUrl url, Map<String, String> headers, Object body) throws IOException {
        RequestBody requestBody = null;
        if (body != null) {
            requestBody = RequestBody.create(mapper.writeValueAsString(body), JSON);
        } else if (requiresBody(method)) {
            requestBody = RequestBody.create("{}", JSON);
        }

        Request.Builder requestBuilder = new Request.Builder().url(url);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            requestBuilder.header(header.getKey(), header.getValue());
        }
        Request request = requestBuilder.method(method, requestBody).build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody == null ? "" : responseBody.string();
            LOG.debug("{} {} -> {}", method, url.encodedPath(), response.code());
            if (!response.isSuccessful()) {
                throw toException(response, url, raw);
            }
            return new BackendReply(response.code(), parseJsonBody(raw), response.headers());
        }
    }

    private BackendException toException(Response response, HttpUrl url, String raw) {
        String detail = url.encodedPath() + " " + truncate(raw);
        if (response.code() == 404) {
            return new NamespaceNotFoundException(detail);
        }
        return new BackendException(response.code(), detail, retryAfterMs(response.header("Retry-After")));
    }

    static long retryAfterMs(String header) {
        if (header == null || header.isBlank()) {
            return -1L;
        }
        try {
            return (long) (Double.parseDouble(header.trim()) * 1000);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private boolean requiresBody(String method) {
        return "POST".equalsIgnoreCase(method)
            || "PUT".equalsIgnoreCase(method)
            || "PATCH".equalsIgnoreCase(method);
    }

    private JsonNode parseJsonBody(String raw) {
        if (raw == null || raw.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(raw);
        } catch (IOException e) {
            return TextNode.valueOf(raw);
        }
    }

    private String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= MAX_ERROR_BODY ? value : value.substring(0, MAX_ERROR_BODY) + "...";
    }
}
