package com.openforge.streamfold.stream;

import com.openforge.streamfold.message.Role;

public class RoleConflictException extends MergeException {

    public RoleConflictException(Role left, Role right) {
        super("Cannot merge a %s chunk with a %s chunk".formatted(left, right));
    }
}
