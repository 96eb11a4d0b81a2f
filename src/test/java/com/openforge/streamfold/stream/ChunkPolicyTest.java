package com.openforge.streamfold.stream;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkPolicyTest {

    @Test
    void shouldKeepEveryWhitespaceCharacterAsItsOwnPiece() {
        assertThat(ChunkPolicy.whitespace().split("hello goodbye"))
                .containsExactly("hello", " ", "goodbye");
        assertThat(ChunkPolicy.whitespace().split("a  b\n"))
                .containsExactly("a", " ", " ", "b", "\n");
    }

    @Test
    void shouldSplitArgumentsOnCommas() {
        assertThat(ChunkPolicy.commas().split("{\"a\": 1, \"b\": 2}"))
                .containsExactly("{\"a\": 1", ",", " \"b\": 2}");
    }

    @Test
    void shouldReturnNoPiecesForEmptyInput() {
        assertThat(ChunkPolicy.whitespace().split("")).isEmpty();
        assertThat(ChunkPolicy.whole().split("")).isEmpty();
        assertThat(ChunkPolicy.fixedSize(3).split("")).isEmpty();
    }

    @Test
    void shouldCutFixedSizePiecesWithShortTail() {
        assertThat(ChunkPolicy.fixedSize(3).split("abcdefg")).containsExactly("abc", "def", "g");
        assertThatThrownBy(() -> ChunkPolicy.fixedSize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReassembleInputExactly() {
        String input = " leading, and trailing ,";
        for (ChunkPolicy policy : new ChunkPolicy[]{
                ChunkPolicy.whitespace(), ChunkPolicy.commas(), ChunkPolicy.whole(),
                ChunkPolicy.fixedSize(4), ChunkPolicy.keepingDelimiters(Pattern.compile("an"))}) {
            assertThat(String.join("", policy.split(input))).isEqualTo(input);
        }
    }
}
