package com.openforge.streamfold.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides how one string is cut into emission-ordered pieces.
 *
 * Contract: concatenating the returned pieces in order must give back the
 * input exactly.  Empty pieces are never returned.
 */
@FunctionalInterface
public interface ChunkPolicy {

    List<String> split(String value);

    /** Every whitespace character becomes its own piece: "a b" → ["a", " ", "b"]. */
    static ChunkPolicy whitespace() {
        return keepingDelimiters(Pattern.compile("\\s"));
    }

    /** Every comma becomes its own piece; used for JSON-encoded argument strings. */
    static ChunkPolicy commas() {
        return keepingDelimiters(Pattern.compile(","));
    }

    /** Emits the value unsplit. */
    static ChunkPolicy whole() {
        return value -> value.isEmpty() ? List.of() : List.of(value);
    }

    static ChunkPolicy fixedSize(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + size);
        }
        return value -> {
            List<String> pieces = new ArrayList<>();
            for (int start = 0; start < value.length(); start += size) {
                pieces.add(value.substring(start, Math.min(value.length(), start + size)));
            }
            return pieces;
        };
    }

    /**
     * Splits on {@code delimiter}, emitting each match as a separate piece
     * between the surrounding text.
     */
    static ChunkPolicy keepingDelimiters(Pattern delimiter) {
        return value -> {
            List<String> pieces = new ArrayList<>();
            Matcher matcher = delimiter.matcher(value);
            int last = 0;
            while (matcher.find()) {
                if (matcher.start() > last) pieces.add(value.substring(last, matcher.start()));
                if (matcher.end() > matcher.start()) pieces.add(matcher.group());
                last = matcher.end();
            }
            if (last < value.length()) pieces.add(value.substring(last));
            return pieces;
        };
    }
}
