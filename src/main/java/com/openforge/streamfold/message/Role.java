package com.openforge.streamfold.message;

import java.util.Locale;

/**
 * Who authored a message.
 *
 * Aliases accepted by {@link #fromAlias(String)}:
 *   "human" / "user"      → HUMAN
 *   "ai"    / "assistant" → AI
 *   "system", "tool", "function", "chat" map to themselves
 */
public enum Role {

    HUMAN,
    AI,
    SYSTEM,
    TOOL,
    FUNCTION,

    /** Generic role for messages that do not fit the others. */
    CHAT;

    public static Role fromAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Role alias must not be blank");
        }
        return switch (alias.trim().toLowerCase(Locale.ROOT)) {
            case "human", "user"    -> HUMAN;
            case "ai", "assistant"  -> AI;
            case "system"           -> SYSTEM;
            case "tool"             -> TOOL;
            case "function"         -> FUNCTION;
            case "chat"             -> CHAT;
            default -> throw new IllegalArgumentException("Unknown message role: " + alias);
        };
    }
}
