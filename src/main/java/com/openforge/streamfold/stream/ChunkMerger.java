package com.openforge.streamfold.stream;

import com.openforge.streamfold.message.FieldValue;
import com.openforge.streamfold.message.MessageChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stateless, pure combination of two chunks of one stream.
 *
 * Rules:
 *   null side      → the other side is returned unchanged (fold seed)
 *   role           → must match, otherwise {@link RoleConflictException}
 *   content        → left + right
 *   fields         → key-wise structural merge, see {@link #mergeFields}
 *   id             → left's id if present, else right's
 *
 * The merge is associative for chunk sequences emitted by
 * {@link MessageFragmenter}; within a string leaf order matters, across keys
 * it does not.  Inputs are never modified.
 */
@Slf4j
public final class ChunkMerger {

    private ChunkMerger() {}

    public static MessageChunk merge(MessageChunk left, MessageChunk right) {
        if (left == null) return right;
        if (right == null) return left;

        if (left.role() != right.role()) {
            throw new RoleConflictException(left.role(), right.role());
        }

        return MessageChunk.builder()
                .role(left.role())
                .content(left.content() + right.content())
                .additionalFields(mergeFields(left.additionalFields(), right.additionalFields()))
                .id(mergeId(left.id(), right.id()))
                .build();
    }

    /**
     * Keys present on one side pass through; keys on both sides combine:
     *   Fields + Fields   → recursive merge
     *   Text   + Text     → concatenation
     *   Scalar + Scalar   → kept when equal
     *   null scalar + x   → x (either side)
     * Anything else raises {@link IncompatibleMergeException}.
     * Result key order: left's keys, then keys new on the right.
     */
    public static Map<String, FieldValue> mergeFields(Map<String, FieldValue> left,
                                                      Map<String, FieldValue> right) {
        return mergeFields(left, right, "");
    }

    private static Map<String, FieldValue> mergeFields(Map<String, FieldValue> left,
                                                       Map<String, FieldValue> right,
                                                       String prefix) {
        if (right.isEmpty()) return left;
        if (left.isEmpty()) return right;

        Map<String, FieldValue> merged = new LinkedHashMap<>(left);
        right.forEach((key, rightValue) -> {
            FieldValue leftValue = merged.get(key);
            merged.put(key, leftValue == null
                    ? rightValue
                    : mergeValue(prefix + key, leftValue, rightValue));
        });
        return merged;
    }

    private static FieldValue mergeValue(String path, FieldValue left, FieldValue right) {
        if (left instanceof FieldValue.Scalar l && l.isNull()) return right;
        if (right instanceof FieldValue.Scalar r && r.isNull()) return left;

        if (left instanceof FieldValue.Text l && right instanceof FieldValue.Text r) {
            return FieldValue.text(l.value() + r.value());
        }
        if (left instanceof FieldValue.Fields l && right instanceof FieldValue.Fields r) {
            return FieldValue.fields(mergeFields(l.entries(), r.entries(), path + "."));
        }
        if (left instanceof FieldValue.Scalar l && right instanceof FieldValue.Scalar r
                && Objects.equals(l.value(), r.value())) {
            return left;
        }
        throw new IncompatibleMergeException(path, describe(left), describe(right));
    }

    private static String mergeId(String left, String right) {
        if (left == null) return right;
        if (right != null && !left.equals(right)) {
            log.warn("[ChunkMerger] Chunk id '{}' differs from stream id '{}'; keeping '{}'",
                    right, left, left);
        }
        return left;
    }

    private static String describe(FieldValue value) {
        if (value instanceof FieldValue.Scalar s) {
            return "scalar(" + s.value() + ")";
        }
        return value instanceof FieldValue.Text ? "string" : "mapping";
    }
}
