package io.latmon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ComponentClass {
    EDITOR("editor", "Editor"),
    EXTENSION_HOST("extension-host", "Extension Host"),
    AI_MODEL_LOCAL("ai-model-local", "Local Model"),
    AI_MODEL_REMOTE("ai-model-remote", "Remote Model"),
    TERMINAL("terminal", "Terminal"),
    FILESYSTEM("filesystem", "File System"),
    NETWORK("network", "Network"),
    SYSTEM("system", "System");

    private final String wireName;
    private final String displayName;

    ComponentClass(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    @JsonCreator
    public static ComponentClass fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("component class must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ComponentClass value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown component class: " + raw);
    }
}
