package com.openforge.streamfold.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.Map;

/**
 * A complete chat message.
 *
 * Immutable: every "with" method returns a copy.  Missing values are
 * normalised in the canonical constructor:
 *   role             → AI
 *   content          → ""
 *   additionalFields → empty ordered map; a null value becomes a null Scalar
 *   id               → stays null until a model or fragmenter assigns one
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        Role role,

        String content,

        /** Structured extras (function calls, tool calls, provider metadata). Insertion-ordered. */
        Map<String, FieldValue> additionalFields,

        /** Opaque identity shared by every chunk of one logical response. */
        String id
) {

    public Message {
        role = role == null ? Role.AI : role;
        content = content == null ? "" : content;
        additionalFields = FieldValue.orderedCopy(additionalFields);
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message human(String content) {
        return Message.builder().role(Role.HUMAN).content(content).build();
    }

    public static Message ai(String content) {
        return Message.builder().role(Role.AI).content(content).build();
    }

    public static Message system(String content) {
        return Message.builder().role(Role.SYSTEM).content(content).build();
    }

    /** AI message whose fields are converted from plain Java values. */
    public static Message ai(String content, Map<String, ?> additionalFields) {
        return Message.builder()
                .role(Role.AI)
                .content(content)
                .additionalFields(FieldValue.mapOf(additionalFields))
                .build();
    }

    /** Coerces a ("ai", "blah") style pair. */
    public static Message of(String role, String content) {
        return Message.builder().role(Role.fromAlias(role)).content(content).build();
    }

    // ── Copies ───────────────────────────────────────────────────────────────

    public Message withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public MessageChunk toChunk() {
        return new MessageChunk(role, content, additionalFields, id);
    }

    /** Plain-Java view of the additional fields, e.g. for JSON or assertions. */
    public Map<String, Object> plainFields() {
        return MessageChunk.plain(additionalFields);
    }
}
