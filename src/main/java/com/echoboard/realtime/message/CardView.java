package com.echoboard.realtime.message;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CardView(
    long id,
    long boardId,
    String author,
    String text,
    String tag,
    int votes,
    Integer orderIndex,
    String attachmentUrl,
    Instant createdAt
) {}
