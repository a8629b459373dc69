package com.echoboard.realtime.model;

import java.time.Instant;
import java.util.Map;

public record ActivityEntry(
    long id,
    long boardId,
    String userId,
    String username,
    String kind,
    Map<String, Object> payload,
    Instant createdAt
) {}
