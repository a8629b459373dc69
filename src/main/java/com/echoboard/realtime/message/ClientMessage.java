package com.echoboard.realtime.message;

import com.echoboard.realtime.model.Attachment;

import java.util.List;

/**
 * Inbound realtime event. Fields are flat; which ones are read depends on {@code type}.
 */
public record ClientMessage(
    String type,            // "join_board", "send_chat", "dm_send", "group_join", ...
    String code,            // board code
    String clientName,
    String author,
    String text,
    String tag,
    String attachment,      // stored file name of a card attachment
    Long cardId,
    List<Long> order,
    String channel,
    Long replyTo,
    List<Attachment> attachments,
    String voice,           // stored file name of a voice note
    Long messageId,
    String emoji,
    Position pos,
    String color,
    String theme,
    String title,
    String to,              // DM peer username
    String other,           // DM peer username on dm_join
    String slug,
    String token,
    String username,
    String role
) {
    public record Position(Double x, Double y) {}
}
