package com.echoboard.realtime.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

// Board member role, ordered by privilege.
public enum Role {
    VIEWER,
    MEMBER,
    MODERATOR,
    OWNER;

    public boolean atLeast(Role minimum) {
        return ordinal() >= minimum.ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWire(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }

    public static Optional<Role> parse(String value) {
        if (value == null) return Optional.empty();
        for (Role r : values()) {
            if (r.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }
}
