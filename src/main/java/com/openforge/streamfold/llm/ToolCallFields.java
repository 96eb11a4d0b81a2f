package com.openforge.streamfold.llm;

import com.openforge.streamfold.llm.model.FunctionCallResult;
import com.openforge.streamfold.llm.model.StreamingChunk;
import com.openforge.streamfold.llm.model.ToolCall;
import com.openforge.streamfold.message.FieldValue;
import com.openforge.streamfold.message.Message;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps tool calls onto message fields and back.
 *
 * Layout, keyed by the call's position so that streamed deltas of the same
 * call land on the same key path and merge by string concatenation:
 * <pre>
 *   tool_calls:
 *     "0": { id, type, function: { name, arguments } }
 *     "1": { ... }
 * </pre>
 */
public final class ToolCallFields {

    public static final String TOOL_CALLS   = "tool_calls";
    public static final String TOOL_CALL_ID = "tool_call_id";

    private ToolCallFields() {}

    /** Fields for a complete response. */
    public static Map<String, FieldValue> fromToolCalls(List<ToolCall> toolCalls) {
        if (toolCalls == null || toolCalls.isEmpty()) return Map.of();
        Map<String, FieldValue> byIndex = new LinkedHashMap<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            byIndex.put(String.valueOf(i), callFields(call.id(), call.type(), call.function()));
        }
        return Map.of(TOOL_CALLS, FieldValue.fields(byIndex));
    }

    /** Fields for one streamed frame; absent parts are left out so they never overwrite. */
    public static Map<String, FieldValue> fromDeltas(List<StreamingChunk.ToolCallDelta> deltas) {
        if (deltas == null || deltas.isEmpty()) return Map.of();
        Map<String, FieldValue> byIndex = new LinkedHashMap<>();
        for (StreamingChunk.ToolCallDelta delta : deltas) {
            int index = delta.index() != null ? delta.index() : 0;
            byIndex.put(String.valueOf(index), callFields(delta.id(), delta.type(), delta.function()));
        }
        return Map.of(TOOL_CALLS, FieldValue.fields(byIndex));
    }

    /** Reassembled tool calls of a (folded) message, in index order. */
    public static List<ToolCall> toolCalls(Message message) {
        FieldValue raw = message.additionalFields().get(TOOL_CALLS);
        if (!(raw instanceof FieldValue.Fields calls)) return List.of();

        List<Map.Entry<String, FieldValue>> entries = new ArrayList<>(calls.entries().entrySet());
        entries.sort(Comparator.comparingInt(e -> Integer.parseInt(e.getKey())));

        List<ToolCall> result = new ArrayList<>(entries.size());
        for (Map.Entry<String, FieldValue> entry : entries) {
            if (!(entry.getValue() instanceof FieldValue.Fields call)) continue;
            Map<String, FieldValue> function = call.entries().get("function") instanceof FieldValue.Fields f
                    ? f.entries()
                    : Map.of();
            result.add(new ToolCall(
                    text(call.entries(), "id"),
                    text(call.entries(), "type"),
                    new FunctionCallResult(text(function, "name"), text(function, "arguments"))));
        }
        return result;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static FieldValue callFields(String id, String type, FunctionCallResult function) {
        Map<String, FieldValue> call = new LinkedHashMap<>();
        if (id != null) call.put("id", FieldValue.text(id));
        if (type != null) call.put("type", FieldValue.text(type));
        if (function != null) {
            Map<String, FieldValue> fn = new LinkedHashMap<>();
            if (function.name() != null) fn.put("name", FieldValue.text(function.name()));
            if (function.arguments() != null) fn.put("arguments", FieldValue.text(function.arguments()));
            call.put("function", FieldValue.fields(fn));
        }
        return FieldValue.fields(call);
    }

    private static String text(Map<String, FieldValue> fields, String key) {
        return fields.get(key) instanceof FieldValue.Text t ? t.value() : null;
    }
}
