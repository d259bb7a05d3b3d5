package io.loremesh.core.advisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Talks to a knowledge backend over HTTP: {@code POST /query}, {@code POST /chat} and
 * {@code POST /store}, JSON in and out. Answers are read from the {@code response} field.
 */
public final class HttpKnowledgeAdvisor implements KnowledgeAdvisor {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public HttpKnowledgeAdvisor(String baseUrl) {
        this(baseUrl, Duration.ofSeconds(30));
    }

    public HttpKnowledgeAdvisor(String baseUrl, Duration timeout) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.mapper = new ObjectMapper();
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .callTimeout(timeout == null || timeout.isNegative() || timeout.isZero() ? Duration.ofSeconds(30) : timeout)
            .build();
    }

    @Override
    public String query(String text) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", text == null ? "" : text);
        payload.put("limit", 5);
        return responseText(post("/query", payload));
    }

    @Override
    public void store(LearningRecord record) throws IOException {
        post("/store", record);
    }

    @Override
    public String chat(String message) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message == null ? "" : message);
        payload.put("store_result", false);
        return responseText(post("/chat", payload));
    }

    private JsonNode post(String endpoint, Object payload) throws IOException {
        Request request = new Request.Builder()
            .url(baseUrl + endpoint)
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("Knowledge backend returned HTTP " + response.code() + " for " + endpoint);
            }
            if (raw.isBlank()) {
                return mapper.createObjectNode();
            }
            return mapper.readTree(raw);
        }
    }

    private String responseText(JsonNode root) {
        JsonNode value = root.path("response");
        return value.isMissingNode() || value.isNull() ? "" : value.asText("");
    }

    private String normalizeBaseUrl(String value) {
        String raw = (value == null || value.isBlank()) ? "http://127.0.0.1:8420" : value.trim();
        if (raw.endsWith("/")) {
            return raw.substring(0, raw.length() - 1);
        }
        return raw;
    }
}
