package com.echoboard.realtime.snapshot;

import com.echoboard.realtime.message.MessageView;

import java.util.List;

public record GroupHistory(
    String slug,
    String title,
    List<MessageView> messages
) implements RoomState {}
