package com.openforge.streamfold.stream;

import lombok.Getter;

/**
 * The same field key holds structurally different values on both sides,
 * e.g. a string leaf on the left and a nested mapping on the right.
 */
@Getter
public class IncompatibleMergeException extends MergeException {

    /** Dotted path of the offending key, e.g. {@code function_call.arguments}. */
    private final String fieldPath;

    public IncompatibleMergeException(String fieldPath, String leftType, String rightType) {
        super("Cannot merge field '%s': %s on the left, %s on the right"
                .formatted(fieldPath, leftType, rightType));
        this.fieldPath = fieldPath;
    }
}
