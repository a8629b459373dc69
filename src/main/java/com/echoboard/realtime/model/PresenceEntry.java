package com.echoboard.realtime.model;

import java.time.Instant;

public record PresenceEntry(
    long id,
    long boardId,
    String userId,
    String username,
    String action,      // "join" or "leave"
    String details,
    Instant createdAt
) {}
