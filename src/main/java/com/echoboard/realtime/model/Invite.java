package com.echoboard.realtime.model;

import java.time.Instant;

public record Invite(
    String token,
    long boardId,
    String boardCode,
    String createdBy,
    Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
