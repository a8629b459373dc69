package com.echoboard.realtime.snapshot;

import com.echoboard.realtime.message.CardView;
import com.echoboard.realtime.message.MessageView;
import com.echoboard.realtime.model.ActivityEntry;
import com.echoboard.realtime.model.BoardMember;
import com.echoboard.realtime.model.PresenceEntry;
import com.echoboard.realtime.model.Role;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BoardState(
    BoardInfo board,
    String theme,
    String title,
    List<CardView> cards,
    List<MessageView> messages,
    List<String> channels,
    List<BoardMember> members,
    List<ActivityEntry> activity,
    List<PresenceEntry> presenceHistory,
    Role role
) implements RoomState {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record BoardInfo(String code, String accentColor, String backgroundAnim) {}
}
