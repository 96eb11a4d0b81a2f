package com.openforge.streamfold.llm;

import com.openforge.streamfold.llm.model.FunctionCallResult;
import com.openforge.streamfold.llm.model.StreamingChunk;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-stream memory of which tool-call parts were already emitted.
 *
 * Some providers repeat id, type and function.name on every frame of a call.
 * Those parts are identifiers, not fragments: only their first occurrence per
 * call index is kept, so the merged fields hold them once.  Arguments are
 * always passed through and concatenate.
 *
 * One instance per SSE stream; not thread-safe.
 */
final class ToolCallDeltaTracker {

    private final Map<Integer, Set<String>> emitted = new HashMap<>();

    List<StreamingChunk.ToolCallDelta> firstOccurrences(List<StreamingChunk.ToolCallDelta> deltas) {
        if (deltas == null || deltas.isEmpty()) return deltas;
        List<StreamingChunk.ToolCallDelta> kept = new ArrayList<>(deltas.size());
        for (StreamingChunk.ToolCallDelta delta : deltas) {
            int index = delta.index() != null ? delta.index() : 0;
            Set<String> seen = emitted.computeIfAbsent(index, i -> new HashSet<>());

            FunctionCallResult function = delta.function();
            String name = function == null ? null : once(seen, "name", function.name());
            kept.add(new StreamingChunk.ToolCallDelta(
                    index,
                    once(seen, "id", delta.id()),
                    once(seen, "type", delta.type()),
                    function == null ? null : new FunctionCallResult(name, function.arguments())));
        }
        return kept;
    }

    private static String once(Set<String> seen, String part, String value) {
        if (value == null || value.isEmpty()) return value;
        return seen.add(part) ? value : null;
    }
}
