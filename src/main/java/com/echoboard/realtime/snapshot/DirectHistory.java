package com.echoboard.realtime.snapshot;

import com.echoboard.realtime.message.MessageView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DirectHistory(
    String other,
    boolean otherOnline,
    List<MessageView> messages
) implements RoomState {}
