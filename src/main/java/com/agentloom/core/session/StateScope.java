package com.agentloom.core.session;

/**
 * Storage partition of a state key, selected by the key's prefix.
 * <p>
 * Agent code reads and writes one flat namespace; the prefix alone decides where a key
 * lives and how long it survives:
 * <ul>
 *     <li>{@link #SESSION} (no prefix): lifetime of the session</li>
 *     <li>{@link #USER} ({@code user:}): shared by all sessions of one (app, user)</li>
 *     <li>{@link #APP} ({@code app:}): shared by all sessions of one app</li>
 *     <li>{@link #TEMP} ({@code temp:}): never persisted, lives for the current invocation only</li>
 * </ul>
 * Keys of the form {@code something:rest} whose prefix is not one of the above are rejected.
 */
public enum StateScope {

    APP("app:", true),
    USER("user:", true),
    TEMP("temp:", false),
    SESSION("", true);

    private final String prefix;
    private final boolean durable;

    StateScope(String prefix, boolean durable) {
        this.prefix = prefix;
        this.durable = durable;
    }

    public String prefix() {
        return prefix;
    }

    public boolean isDurable() {
        return durable;
    }

    /**
     * Classifies a key.
     *
     * @throws SessionValidationException for blank keys, bare prefixes and unknown prefixes
     */
    public static StateScope of(String key) {
        if (key == null || key.isBlank()) {
            throw new SessionValidationException("State key must not be blank");
        }
        int colon = key.indexOf(':');
        if (colon < 0) {
            return SESSION;
        }
        for (StateScope scope : values()) {
            if (scope != SESSION && key.startsWith(scope.prefix)) {
                if (key.length() == scope.prefix.length()) {
                    throw new SessionValidationException("State key '" + key + "' has a scope prefix but no name");
                }
                return scope;
            }
        }
        throw new SessionValidationException("Unknown scope prefix in state key '" + key
                + "' (expected one of app:, user:, temp: or no prefix)");
    }

    /**
     * Returns the key without this scope's prefix, as stored in the scope's partition.
     */
    public String strip(String key) {
        return key.substring(prefix.length());
    }

    public String qualify(String name) {
        return prefix + name;
    }
}
