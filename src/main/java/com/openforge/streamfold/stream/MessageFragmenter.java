package com.openforge.streamfold.stream;

import com.openforge.streamfold.message.FieldValue;
import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Decomposes a complete {@link Message} into emission-ordered chunks.
 *
 * Emission order:
 *   1. content tokens, cut by the content policy (default: whitespace kept
 *      as separate tokens, so "hello goodbye" → "hello", " ", "goodbye")
 *   2. one group per top-level additional field, in insertion order:
 *        Text leaf   → one chunk per piece of the leaf policy (default: commas)
 *        Scalar leaf → one chunk carrying the value as-is
 *        Fields      → recurse into each nested key; every chunk is wrapped
 *                      in the full key path, e.g. {"function_call": {"arguments": ","}}
 *
 * A message with empty content and no fields yields a single empty chunk, so
 * folding the output always produces a value.
 *
 * Every chunk of one {@link #fragment} call carries the same id: the source
 * message's id when present, otherwise a fresh one from the id supplier.
 *
 * The returned stream is lazy and single-use: not even the id is drawn before
 * a terminal operation runs.  The source is never mutated.
 */
public final class MessageFragmenter {

    private final ChunkPolicy      contentPolicy;
    private final ChunkPolicy      leafPolicy;
    private final Supplier<String> idSupplier;

    public MessageFragmenter(ChunkPolicy contentPolicy,
                             ChunkPolicy leafPolicy,
                             Supplier<String> idSupplier) {
        this.contentPolicy = contentPolicy;
        this.leafPolicy    = leafPolicy;
        this.idSupplier    = idSupplier;
    }

    public static MessageFragmenter withDefaults() {
        return new MessageFragmenter(ChunkPolicy.whitespace(), ChunkPolicy.commas(),
                () -> "run-" + UUID.randomUUID());
    }

    public Stream<MessageChunk> fragment(Message message) {
        return Stream.of(message).flatMap(this::fragmentNow);
    }

    private Stream<MessageChunk> fragmentNow(Message message) {
        String id = message.id() != null ? message.id() : idSupplier.get();

        if (message.content().isEmpty() && message.additionalFields().isEmpty()) {
            return Stream.of(MessageChunk.builder().role(message.role()).id(id).build());
        }

        Stream<MessageChunk> contentChunks = Stream.of(message.content())
                .flatMap(content -> contentPolicy.split(content).stream())
                .filter(token -> !token.isEmpty())
                .map(token -> MessageChunk.builder()
                        .role(message.role())
                        .content(token)
                        .id(id)
                        .build());

        Stream<MessageChunk> fieldChunks = message.additionalFields().entrySet().stream()
                .flatMap(entry -> leafFragments(List.of(entry.getKey()), entry.getValue()))
                .map(fields -> MessageChunk.builder()
                        .role(message.role())
                        .additionalFields(fields)
                        .id(id)
                        .build());

        return Stream.concat(contentChunks, fieldChunks);
    }

    // ── Field decomposition ──────────────────────────────────────────────────

    private Stream<Map<String, FieldValue>> leafFragments(List<String> path, FieldValue value) {
        if (value instanceof FieldValue.Text text) {
            List<String> pieces = leafPolicy.split(text.value());
            if (pieces.isEmpty()) return Stream.of(wrap(path, text));
            return pieces.stream().map(piece -> wrap(path, FieldValue.text(piece)));
        }
        if (value instanceof FieldValue.Fields nested && !nested.entries().isEmpty()) {
            return nested.entries().entrySet().stream()
                    .flatMap(entry -> leafFragments(append(path, entry.getKey()), entry.getValue()));
        }
        // scalars and empty mappings are emitted whole
        return Stream.of(wrap(path, value));
    }

    /** Builds {path[0]: {path[1]: ... {path[n]: leaf}}}. */
    private static Map<String, FieldValue> wrap(List<String> path, FieldValue leaf) {
        FieldValue current = leaf;
        for (int i = path.size() - 1; i > 0; i--) {
            current = FieldValue.fields(Map.of(path.get(i), current));
        }
        return Map.of(path.get(0), current);
    }

    private static List<String> append(List<String> path, String key) {
        List<String> extended = new ArrayList<>(path.size() + 1);
        extended.addAll(path);
        extended.add(key);
        return extended;
    }
}
