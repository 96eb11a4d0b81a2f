package com.openforge.streamfold.stream;

import com.openforge.streamfold.message.FieldValue;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.message.Role;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkMergerTest {

    private static MessageChunk fields(Map<String, ?> raw) {
        return MessageChunk.builder().additionalFields(FieldValue.mapOf(raw)).build();
    }

    private static Map<String, Object> nullable(String key) {
        Map<String, Object> map = new HashMap<>();
        map.put(key, null);
        return map;
    }

    @Test
    void shouldConcatenateContentAndKeepFirstId() {
        MessageChunk merged = MessageChunk.ofContent("hello", "a")
                .concat(MessageChunk.ofContent(" world", null));

        assertThat(merged.content()).isEqualTo("hello world");
        assertThat(merged.id()).isEqualTo("a");
    }

    @Test
    void shouldTakeRightIdWhenLeftHasNone() {
        MessageChunk merged = ChunkMerger.merge(MessageChunk.ofContent("x", null), MessageChunk.ofContent("y", "b"));

        assertThat(merged.id()).isEqualTo("b");
    }

    @Test
    void shouldKeepLeftIdWhenIdsDiffer() {
        MessageChunk merged = ChunkMerger.merge(MessageChunk.ofContent("x", "a"), MessageChunk.ofContent("y", "b"));

        assertThat(merged.id()).isEqualTo("a");
    }

    @Test
    void shouldTreatNullSideAsIdentity() {
        MessageChunk chunk = MessageChunk.ofContent("only", "id");

        assertThat(ChunkMerger.merge(null, chunk)).isSameAs(chunk);
        assertThat(ChunkMerger.merge(chunk, null)).isSameAs(chunk);
    }

    @Test
    void shouldMergeNestedStringLeavesByConcatenation() {
        MessageChunk left = fields(Map.of("function_call", Map.of("name", "move_file", "arguments", "{\"a\"")));
        MessageChunk right = fields(Map.of("function_call", Map.of("arguments", ": 1}")));

        MessageChunk merged = left.concat(right);

        assertThat(merged.plainFields()).isEqualTo(
                Map.of("function_call", Map.of("name", "move_file", "arguments", "{\"a\": 1}")));
    }

    @Test
    void shouldOrderKeysLeftFirstThenNewOnRight() {
        MessageChunk merged = fields(Map.of("b", "1")).concat(fields(Map.of("a", "2")));

        assertThat(merged.additionalFields().keySet()).containsExactly("b", "a");
    }

    @Test
    void shouldKeepEqualScalarsAndLetNullYield() {
        assertThat(fields(Map.of("n", 1)).concat(fields(Map.of("n", 1))).plainFields())
                .isEqualTo(Map.of("n", 1));
        assertThat(fields(nullable("n")).concat(fields(Map.of("n", "text"))).plainFields())
                .isEqualTo(Map.of("n", "text"));
        assertThat(fields(Map.of("n", true)).concat(fields(nullable("n"))).plainFields())
                .isEqualTo(Map.of("n", true));
    }

    @Test
    void shouldRejectStringMergedWithMapping() {
        MessageChunk left = fields(Map.of("function_call", Map.of("arguments", "{")));
        MessageChunk right = fields(Map.of("function_call", Map.of("arguments", Map.of("x", "1"))));

        assertThatThrownBy(() -> left.concat(right))
                .isInstanceOf(IncompatibleMergeException.class)
                .hasMessageContaining("function_call.arguments")
                .satisfies(e -> assertThat(((IncompatibleMergeException) e).getFieldPath())
                        .isEqualTo("function_call.arguments"));
    }

    @Test
    void shouldRejectDifferingScalars() {
        assertThatThrownBy(() -> fields(Map.of("n", 1)).concat(fields(Map.of("n", 2))))
                .isInstanceOf(IncompatibleMergeException.class)
                .hasMessageContaining("scalar(1)");
    }

    @Test
    void shouldRejectDifferentRoles() {
        MessageChunk human = MessageChunk.builder().role(Role.HUMAN).content("a").build();
        MessageChunk ai = MessageChunk.builder().role(Role.AI).content("b").build();

        assertThatThrownBy(() -> human.concat(ai))
                .isInstanceOf(RoleConflictException.class)
                .isInstanceOf(MergeException.class);
    }

    @Test
    void shouldNotModifyInputs() {
        MessageChunk left = fields(Map.of("k", Map.of("a", "x")));
        MessageChunk right = fields(Map.of("k", Map.of("a", "y")));
        Map<String, Object> leftBefore = left.plainFields();

        left.concat(right);

        assertThat(left.plainFields()).isEqualTo(leftBefore);
    }

    @Test
    void shouldBeAssociative() {
        MessageChunk a = MessageChunk.builder().content("he").additionalFields(
                FieldValue.mapOf(Map.of("f", Map.of("args", "{")))).id("x").build();
        MessageChunk b = MessageChunk.builder().content("l").additionalFields(
                FieldValue.mapOf(Map.of("f", Map.of("args", "1,")))).id("x").build();
        MessageChunk c = MessageChunk.builder().content("lo").additionalFields(
                FieldValue.mapOf(Map.of("g", 2))).id("x").build();

        assertThat(a.concat(b).concat(c)).isEqualTo(a.concat(b.concat(c)));
    }

    @Test
    void shouldCommuteAcrossDisjointKeysButNotWithinLeaf() {
        MessageChunk x = fields(Map.of("x", "1"));
        MessageChunk y = fields(Map.of("y", "2"));
        assertThat(x.concat(y).plainFields()).isEqualTo(y.concat(x).plainFields());

        MessageChunk first = fields(Map.of("s", "ab"));
        MessageChunk second = fields(Map.of("s", "cd"));
        assertThat(first.concat(second).plainFields()).isEqualTo(Map.of("s", "abcd"));
        assertThat(second.concat(first).plainFields()).isEqualTo(Map.of("s", "cdab"));
    }
}
