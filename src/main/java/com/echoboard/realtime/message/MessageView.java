package com.echoboard.realtime.message;

import com.echoboard.realtime.model.ReactionCount;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Client view of a chat message with resolved file URLs and its reaction tally.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageView(
    long id,
    String room,
    String authorId,
    String author,
    String recipientId,
    String text,
    String channel,
    Long replyTo,
    boolean pinned,
    List<AttachmentView> attachments,
    String voiceUrl,
    List<ReactionCount> reactions,
    Instant createdAt,
    Instant editedAt,
    Instant readAt
) {
    public record AttachmentView(String name, String url, String mime) {}
}
