package com.echoboard.realtime.model;

import com.echoboard.realtime.room.RoomKind;

import java.time.Instant;
import java.util.List;

/**
 * A durable chat message in any kind of room.
 *
 * <p>{@code roomId} is the room key id: the board code, the sorted DM pair, or the group slug.
 * {@code authorId} is null for anonymous board posts. {@code recipientId} and {@code readAt}
 * are only used by direct messages.
 */
public record ChatMessage(
    long id,
    RoomKind kind,
    String roomId,
    String authorId,
    String author,
    String recipientId,
    String text,
    String channel,
    Long replyTo,
    boolean pinned,
    List<Attachment> attachments,
    String voicePath,
    Instant createdAt,
    Instant editedAt,
    Instant deletedAt,
    Instant readAt
) {
    public ChatMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isAuthoredBy(String userId) {
        return authorId != null && authorId.equals(userId);
    }

    public ChatMessage withText(String newText, Instant editedAt) {
        return new ChatMessage(id, kind, roomId, authorId, author, recipientId, newText, channel, replyTo,
            pinned, attachments, voicePath, createdAt, editedAt, deletedAt, readAt);
    }

    public ChatMessage withDeletedAt(Instant at) {
        return new ChatMessage(id, kind, roomId, authorId, author, recipientId, text, channel, replyTo,
            pinned, attachments, voicePath, createdAt, editedAt, at, readAt);
    }

    public ChatMessage withPinned(boolean value) {
        return new ChatMessage(id, kind, roomId, authorId, author, recipientId, text, channel, replyTo,
            value, attachments, voicePath, createdAt, editedAt, deletedAt, readAt);
    }

    public ChatMessage withReadAt(Instant at) {
        return new ChatMessage(id, kind, roomId, authorId, author, recipientId, text, channel, replyTo,
            pinned, attachments, voicePath, createdAt, editedAt, deletedAt, at);
    }
}
