package com.openforge.streamfold.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.streamfold.stream.ChunkMerger;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One incremental piece of a {@link Message} under construction.
 *
 * Same shape as Message; the difference is semantic.  Folding every chunk of
 * a stream in emission order with {@link #concat} yields the full message.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageChunk(
        Role role,
        String content,
        Map<String, FieldValue> additionalFields,
        String id
) {

    public MessageChunk {
        role = role == null ? Role.AI : role;
        content = content == null ? "" : content;
        additionalFields = FieldValue.orderedCopy(additionalFields);
    }

    public static MessageChunk ofContent(String content, String id) {
        return MessageChunk.builder().content(content).id(id).build();
    }

    /** Pure merge, see {@link ChunkMerger#merge}. */
    public MessageChunk concat(MessageChunk next) {
        return ChunkMerger.merge(this, next);
    }

    public MessageChunk withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public Message toMessage() {
        return new Message(role, content, additionalFields, id);
    }

    public Map<String, Object> plainFields() {
        return plain(additionalFields);
    }

    static Map<String, Object> plain(Map<String, FieldValue> fields) {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((k, v) -> plain.put(k, v.toPlain()));
        return plain;
    }
}
