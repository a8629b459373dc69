package com.echoboard.realtime.model;

import com.echoboard.realtime.room.RoomKey;

import java.util.List;

public record NewMessage(
    RoomKey room,
    String authorId,
    String author,
    String recipientId,
    String text,
    String channel,
    Long replyTo,
    List<Attachment> attachments,
    String voicePath
) {
    public NewMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
