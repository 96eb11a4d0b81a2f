package com.openforge.streamfold.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.streamfold.callback.RunContext;
import com.openforge.streamfold.llm.model.ChatRequest;
import com.openforge.streamfold.llm.model.ChatResponse;
import com.openforge.streamfold.llm.model.StreamingChunk;
import com.openforge.streamfold.llm.model.Tool;
import com.openforge.streamfold.llm.model.WireMessage;
import com.openforge.streamfold.message.FieldValue;
import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.message.Role;
import com.openforge.streamfold.model.AbstractChatModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Chat model backed by any OpenAI-compatible /chat/completions endpoint
 * (Fireworks, OpenAI, DeepSeek …).
 *
 *  invoke()  — blocking POST, whole response at once.
 *  stream()  — POST with "stream": true.  The HTTP exchange is opened eagerly
 *              when stream() is called; SSE lines are then parsed lazily as the
 *              consumer pulls, one MessageChunk per frame, until "data: [DONE]".
 *
 * Chunk mapping per SSE frame:
 *   id          ← frame id (identical on all frames of one response)
 *   content     ← delta.content, "" when absent
 *   fields      ← delta.tool_calls as tool_calls.<index>.{id,type,function.{name,arguments}};
 *                 id, type and name are kept from their first frame only
 * so folding the chunks reassembles tool calls exactly like the blocking path.
 *
 * Instances are immutable; {@link #bindTools} returns a copy.
 */
@Slf4j
public class OpenAiCompatibleChatModel extends AbstractChatModel {

    private static final String SSE_DATA_PREFIX = "data: ";
    private static final String SSE_DONE        = "data: [DONE]";

    private final HttpClient                   httpClient;
    private final ObjectMapper                 objectMapper;
    private final LlmProperties.ProviderConfig config;
    private final List<Tool>                   tools;
    private final Object                       toolChoice;

    public OpenAiCompatibleChatModel(HttpClient httpClient,
                                     ObjectMapper objectMapper,
                                     LlmProperties.ProviderConfig config) {
        this(httpClient, objectMapper, config, List.of(), null);
    }

    private OpenAiCompatibleChatModel(HttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      LlmProperties.ProviderConfig config,
                                      List<Tool> tools,
                                      Object toolChoice) {
        if (config == null || config.baseUrl() == null || config.baseUrl().isBlank()) {
            throw new IllegalArgumentException("Provider config with a base-url is required");
        }
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
        this.tools        = List.copyOf(tools);
        this.toolChoice   = toolChoice;
    }

    // ── Tool binding ─────────────────────────────────────────────────────────

    /**
     * Returns a copy that offers {@code tools} to the model.
     *
     * toolChoice:
     *   null / false             → let the provider decide
     *   true                     → force the single bound tool (exactly one required)
     *   "auto" "none" "required" → passed through; "any" is sent as "required"
     *   any other string         → force the tool with that name
     */
    public OpenAiCompatibleChatModel bindTools(List<Tool> tools, Object toolChoice) {
        return new OpenAiCompatibleChatModel(httpClient, objectMapper, config, tools,
                normalizeToolChoice(tools, toolChoice));
    }

    public OpenAiCompatibleChatModel bindTools(List<Tool> tools) {
        return bindTools(tools, null);
    }

    static Object normalizeToolChoice(List<Tool> tools, Object toolChoice) {
        if (toolChoice == null || Boolean.FALSE.equals(toolChoice)) return null;
        if (Boolean.TRUE.equals(toolChoice)) {
            if (tools.size() != 1) {
                throw new IllegalArgumentException(
                        "tool_choice=true needs exactly one bound tool, got %d".formatted(tools.size()));
            }
            return forcedFunction(tools.get(0).name());
        }
        if (toolChoice instanceof String choice) {
            return switch (choice) {
                case "auto", "none", "required" -> choice;
                case "any" -> "required";
                default -> forcedFunction(choice);
            };
        }
        throw new IllegalArgumentException("Unsupported tool_choice: " + toolChoice);
    }

    private static Map<String, Object> forcedFunction(String name) {
        return Map.of("type", "function", "function", Map.of("name", name));
    }

    // ── AbstractChatModel ────────────────────────────────────────────────────

    @Override
    public String modelType() {
        return "openai-compatible-chat";
    }

    @Override
    protected Map<String, Object> identifyingParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("provider", config.name());
        params.put("model", config.model());
        if (config.temperature() != null) params.put("temperature", config.temperature());
        if (!tools.isEmpty()) params.put("tools", tools.stream().map(Tool::name).toList());
        return params;
    }

    @Override
    protected Message generate(List<Message> messages, RunContext run) {
        String requestBody = serialize(buildRequest(messages), false);
        log.debug("[ChatModel:{}] → invoke POST body-length={}", config.name(), requestBody.length());

        HttpResponse<String> httpResponse;
        try {
            httpResponse = httpClient.send(buildHttpRequest(requestBody, false),
                    HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]".formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted calling provider [%s]".formatted(config.name()), e);
        }

        ChatResponse response = parseFullResponse(httpResponse);
        WireMessage reply = response.firstMessage();
        return Message.builder()
                .role(Role.AI)
                .content(reply.content())
                .additionalFields(ToolCallFields.fromToolCalls(reply.toolCalls()))
                .id(response.id())
                .build();
    }

    @Override
    protected Stream<MessageChunk> generateStream(List<Message> messages, RunContext run) {
        String requestBody = serialize(buildRequest(messages), true);
        log.debug("[ChatModel:{}] → stream POST body-length={}", config.name(), requestBody.length());

        HttpResponse<Stream<String>> httpResponse;
        try {
            httpResponse = httpClient.send(buildHttpRequest(requestBody, true),
                    HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw new LlmException("Network error (streaming) calling provider [%s]"
                    .formatted(config.name()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted opening stream to provider [%s]"
                    .formatted(config.name()), e);
        }

        int status = httpResponse.statusCode();
        Stream<String> lines = httpResponse.body();
        if (status == 429) {
            closeQuietly(lines);
            throw new LlmRateLimitException("Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            String bodySnippet = lines == null ? "" : String.join("\n", lines.limit(20).toList());
            closeQuietly(lines);
            throw new LlmException("Provider [%s] returned HTTP %d on stream open: %s"
                    .formatted(config.name(), status, bodySnippet));
        }

        ToolCallDeltaTracker toolCalls = new ToolCallDeltaTracker();
        return lines
                .filter(line -> line.startsWith(SSE_DATA_PREFIX))
                .takeWhile(line -> !SSE_DONE.equals(line))
                .map(line -> parseFrame(line.substring(SSE_DATA_PREFIX.length()), toolCalls))
                .flatMap(Optional::stream);
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    ChatRequest buildRequest(List<Message> messages) {
        return ChatRequest.builder()
                .model(config.model())
                .messages(messages.stream().map(OpenAiCompatibleChatModel::toWire).toList())
                .tools(tools.isEmpty() ? null : tools)
                .toolChoice(toolChoice)
                .temperature(config.temperature())
                .maxTokens(config.maxTokens())
                .build();
    }

    static WireMessage toWire(Message message) {
        WireMessage.WireMessageBuilder wire = WireMessage.builder().content(message.content());
        switch (message.role()) {
            case HUMAN, CHAT -> wire.role("user");
            case AI -> {
                wire.role("assistant");
                var toolCalls = ToolCallFields.toolCalls(message);
                if (!toolCalls.isEmpty()) wire.toolCalls(toolCalls);
            }
            case SYSTEM -> wire.role("system");
            case TOOL -> wire.role("tool").toolCallId(textField(message, ToolCallFields.TOOL_CALL_ID));
            case FUNCTION -> wire.role("function").name(textField(message, "name"));
        }
        return wire.build();
    }

    private static String textField(Message message, String key) {
        return message.additionalFields().get(key) instanceof FieldValue.Text t ? t.value() : null;
    }

    /** One SSE frame → at most one chunk; malformed or choice-less frames are skipped. */
    private Optional<MessageChunk> parseFrame(String json, ToolCallDeltaTracker toolCalls) {
        StreamingChunk frame;
        try {
            frame = objectMapper.readValue(json, StreamingChunk.class);
        } catch (JsonProcessingException e) {
            log.warn("[ChatModel:{}] Failed to parse SSE chunk: {}", config.name(), json);
            return Optional.empty();
        }
        if (frame.choices() == null || frame.choices().isEmpty()) return Optional.empty();

        StreamingChunk.Delta delta = frame.choices().get(0).delta();
        if (delta == null) return Optional.empty();

        return Optional.of(MessageChunk.builder()
                .role(Role.AI)
                .content(delta.content())
                .additionalFields(ToolCallFields.fromDeltas(toolCalls.firstOccurrences(delta.toolCalls())))
                .id(frame.id())
                .build());
    }

    // ── HTTP helpers ─────────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body, boolean streaming) {
        return HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                // Streaming responses can take a long time to complete
                .timeout(Duration.ofSeconds(streaming ? config.timeoutSeconds() * 2L : config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[ChatModel:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException(
                "Rate-limited by provider [%s].".formatted(config.name()));
        if (status < 200 || status >= 300) throw new LlmException(
                "Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, body));

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(
                    "Failed to parse response from provider [%s]: %s".formatted(config.name(), body), e);
        }
    }

    /** Serializes the request, injecting "stream": true for SSE calls. */
    private String serialize(ChatRequest request, boolean streaming) {
        try {
            if (!streaming) return objectMapper.writeValueAsString(request);
            ObjectNode node = objectMapper.valueToTree(request);
            node.put("stream", true);
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to serialize request for provider [%s]".formatted(config.name()), e);
        }
    }

    private static void closeQuietly(Stream<String> lines) {
        if (lines != null) lines.close();
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {
        public LlmException(String message) { super(message); }
        public LlmException(String message, Throwable cause) { super(message, cause); }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) { super(message); }
    }
}
