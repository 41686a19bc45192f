package im.arun.mdblocks.logseq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MockWebServer dispatcher that answers Logseq API calls by method name and
 * records every call. Method names may omit the {@code logseq.Editor.}
 * prefix. Queued bodies are served in order; the last one repeats.
 */
public class LogseqApiStub extends Dispatcher {
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Deque<String>> responses = new HashMap<>();
    private final List<JsonNode> calls = new ArrayList<>();

    public synchronized LogseqApiStub respond(String method, String... bodies) {
        responses.computeIfAbsent(fullName(method), k -> new ArrayDeque<>()).addAll(Arrays.asList(bodies));
        return this;
    }

    @Override
    public synchronized MockResponse dispatch(RecordedRequest request) {
        JsonNode call;
        try {
            call = mapper.readTree(request.getBody().readUtf8());
        } catch (IOException e) {
            return new MockResponse().setResponseCode(400).setBody(e.getMessage());
        }
        calls.add(call);

        Deque<String> queued = responses.get(call.path("method").asText());
        if (queued == null || queued.isEmpty()) {
            return new MockResponse().setBody("null");
        }
        String body = queued.size() > 1 ? queued.poll() : queued.peek();
        return new MockResponse().setBody(body);
    }

    public synchronized List<String> methods() {
        return calls.stream()
                .map(call -> call.path("method").asText().replace("logseq.Editor.", ""))
                .collect(Collectors.toList());
    }

    /**
     * Arguments of every recorded call to {@code method} (short or full name).
     */
    public synchronized List<JsonNode> argsOf(String method) {
        String target = fullName(method);
        return calls.stream()
                .filter(call -> target.equals(call.path("method").asText()))
                .map(call -> call.get("args"))
                .collect(Collectors.toList());
    }

    private static String fullName(String method) {
        return method.startsWith("logseq.") ? method : "logseq.Editor." + method;
    }
}
