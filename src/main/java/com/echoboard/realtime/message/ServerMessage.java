package com.echoboard.realtime.message;

import com.echoboard.realtime.model.BoardMember;
import com.echoboard.realtime.model.ReactionCount;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Outbound realtime event: {@code {"type": ..., "data": ...}}.
 */
public record ServerMessage(
    String type,
    Object data
) {
    public record PresenceUpdate(int count, List<String> names) {}

    public record TypingUpdate(String code, List<String> authors) {}

    public record DirectPresence(String username, boolean online) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ReactionUpdate(long messageId, List<ReactionCount> reactions) {}

    public record MessageRef(long id) {}

    public record PinnedMessage(MessageView message) {}

    public record ThemeChange(String theme) {}

    public record TitleChange(String title) {}

    public record CardOrder(List<Long> order) {}

    public record BoardCreated(String code, String title) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record InviteCreated(String token, String code, Instant expiresAt) {}

    public record InviteRedeemed(String code) {}

    public record MembersUpdate(List<BoardMember> members) {}

    public record ErrorPayload(String kind, String message) {}

    public static ServerMessage of(String type, Object data) {
        return new ServerMessage(type, data);
    }

    public static ServerMessage error(String kind, String message) {
        return new ServerMessage("error", new ErrorPayload(kind, message));
    }
}
