package io.latmon.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum SourceKind {
    PROCESS_SCAN("process-scan"),
    COMMAND_EXECUTION("command-execution"),
    FILE_OP("file-op"),
    NETWORK_REQUEST("network-request"),
    SYNTHETIC_TEST("synthetic-test"),
    USER_INTERACTION("user-interaction");

    private final String wireName;

    SourceKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SourceKind fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("source kind must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (SourceKind value : values()) {
            if (value.wireName.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown source kind: " + raw);
    }
}
