package im.arun.mdblocks.logseq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import im.arun.mdblocks.config.MdBlocksConfig;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Client for the Logseq HTTP API server.
 *
 * <p>Every operation is a {@code POST /api} carrying
 * {@code {"method": "logseq.Editor.xxx", "args": [...]}}. Failures to reach the
 * server are retried with exponential backoff. Anything that can happen after
 * the request left (read timeouts, dropped connections, HTTP errors) fails at
 * once, since most editor calls are not idempotent.
 */
public class LogseqClient {
    private static final Logger logger = LoggerFactory.getLogger(LogseqClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long MAX_BACKOFF_MS = 10000;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String apiToken;
    private final int maxRetries;
    private final long retryBackoffMillis;

    public LogseqClient(MdBlocksConfig config) {
        if (!config.hasApiToken()) {
            throw new IllegalArgumentException("Logseq API token must be provided or set in LOGSEQ_API_TOKEN environment variable");
        }
        this.apiToken = config.getApiToken();
        this.endpoint = stripTrailingSlash(config.getApiUrl()) + "/api";
        this.maxRetries = Math.max(0, config.getMaxRetries());
        this.retryBackoffMillis = Math.max(0, config.getRetryBackoffMillis());

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();

        this.objectMapper = new ObjectMapper();
    }

    public String getEndpoint() {
        return endpoint;
    }

    // =========================================================================
    // Page-level API
    // =========================================================================

    public JsonNode createPage(String title, Map<String, Object> properties, boolean createFirstBlock) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("createFirstBlock", createFirstBlock);
        Map<String, Object> pageProperties = properties != null ? properties : new LinkedHashMap<>();
        return call("logseq.Editor.createPage", title, pageProperties, options);
    }

    public List<JsonNode> getAllPages() {
        return toList(call("logseq.Editor.getAllPages"));
    }

    /**
     * @return the page entity, or null when the page does not exist
     */
    public JsonNode getPage(String pageName) {
        JsonNode page = call("logseq.Editor.getPage", pageName);
        return page.isNull() ? null : page;
    }

    public List<JsonNode> getPageBlocksTree(String pageName) {
        return toList(call("logseq.Editor.getPageBlocksTree", pageName));
    }

    public JsonNode deletePage(String pageName) {
        return call("logseq.Editor.deletePage", pageName);
    }

    public JsonNode search(String query, Map<String, Object> options) {
        return call("logseq.search", query, options != null ? options : new LinkedHashMap<>());
    }

    // =========================================================================
    // Block-level API
    // =========================================================================

    public void removeBlock(String blockUuid) {
        call("logseq.Editor.removeBlock", blockUuid);
    }

    /**
     * Insert a tree of blocks in one call.
     *
     * @param srcBlockUuid anchor block
     * @param blocks       batch records with {@code content}, optional
     *                     {@code children} and {@code properties}
     * @param sibling      true to insert after the anchor, false to insert as its children
     */
    public JsonNode insertBatchBlock(String srcBlockUuid, List<Map<String, Object>> blocks, boolean sibling) {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("sibling", sibling);
        logger.debug("Inserting batch of {} blocks (sibling={})", blocks.size(), sibling);
        return call("logseq.Editor.insertBatchBlock", srcBlockUuid, blocks, options);
    }

    public JsonNode appendBlockInPage(String pageName, String content, Map<String, Object> properties) {
        if (properties != null && !properties.isEmpty()) {
            Map<String, Object> options = new LinkedHashMap<>();
            options.put("properties", properties);
            return call("logseq.Editor.appendBlockInPage", pageName, content, options);
        }
        return call("logseq.Editor.appendBlockInPage", pageName, content);
    }

    public void upsertBlockProperty(String blockUuid, String key, Object value) {
        call("logseq.Editor.upsertBlockProperty", blockUuid, key, value);
    }

    // =========================================================================
    // Transport
    // =========================================================================

    /**
     * Invoke an API method with positional arguments.
     *
     * @return the decoded response; {@link NullNode} for an empty or null body
     */
    public JsonNode call(String method, Object... args) {
        String body = buildRequestBody(method, args);

        for (int attempt = 0; ; attempt++) {
            try {
                return executeRequest(method, body);
            } catch (IOException e) {
                if (!isRetryable(e)) {
                    logger.error("Logseq API call {} failed: {}", method, e.getMessage());
                    throw new LogseqApiException("Logseq API call " + method + " failed: " + e.getMessage(), e);
                }
                if (attempt >= maxRetries) {
                    logger.error("Logseq API call {} failed after {} attempt(s): {}", method, attempt + 1, e.getMessage());
                    throw new LogseqApiException("Logseq API call " + method + " failed: " + e.getMessage(), e);
                }
                long backoff = Math.min(retryBackoffMillis * (1L << attempt), MAX_BACKOFF_MS);
                logger.warn("Logseq API call {} failed (attempt {}/{}), retrying in {}ms: {}",
                        method, attempt + 1, maxRetries + 1, backoff, e.getMessage());
                sleep(backoff);
            }
        }
    }

    /**
     * Only failures raised before the request is written are safe to repeat.
     */
    static boolean isRetryable(IOException e) {
        return e instanceof ConnectException
                || e instanceof UnknownHostException
                || e instanceof NoRouteToHostException;
    }

    private String buildRequestBody(String method, Object[] args) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("method", method);
        requestBody.put("args", args != null ? Arrays.asList(args) : new ArrayList<>());
        try {
            return objectMapper.writeValueAsString(requestBody);
        } catch (IOException e) {
            throw new LogseqApiException("Cannot encode arguments for " + method, e);
        }
    }

    private JsonNode executeRequest(String method, String jsonBody) throws IOException {
        logger.debug("Calling {}", method);
        Request request = new Request.Builder()
                .url(endpoint)
                .addHeader("Authorization", "Bearer " + apiToken)
                .post(RequestBody.create(jsonBody, JSON))
                .build();

        String responseText;
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            responseText = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new LogseqApiException(
                        "Logseq API error for " + method + " (HTTP " + response.code() + "): " + responseText,
                        response.code());
            }
        }

        if (responseText.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(responseText);
        } catch (IOException e) {
            throw new LogseqApiException("Unreadable response from " + method + ": " + e.getMessage(), e);
        }
    }

    private List<JsonNode> toList(JsonNode node) {
        List<JsonNode> items = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(items::add);
        }
        return items;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LogseqApiException("Interrupted during retry wait", ie);
        }
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
