package com.echoboard.realtime.room;

/**
 * The three kinds of broadcast scope. Each kind carries the wire names of the events its chat
 * operations produce and its maximum message length, so one set of handlers serves all of them.
 */
public enum RoomKind {
    BOARD("board", 500, "board_state", "chat_added", "chat_reactions", "chat_updated", "chat_deleted",
        "typing", "presence"),
    DIRECT("dm", 1000, "dm_history", "dm_new", "dm_reactions", "dm_updated", "dm_deleted",
        "dm_typing", "dm_presence"),
    GROUP("group", 800, "group_history", "group_new", "group_reactions", "group_updated", "group_deleted",
        "group_typing", "group_presence");

    private final String wireName;
    private final int textLimit;
    private final String snapshotEvent;
    private final String addedEvent;
    private final String reactionsEvent;
    private final String updatedEvent;
    private final String deletedEvent;
    private final String typingEvent;
    private final String presenceEvent;

    RoomKind(String wireName, int textLimit, String snapshotEvent, String addedEvent, String reactionsEvent,
             String updatedEvent, String deletedEvent, String typingEvent, String presenceEvent) {
        this.wireName = wireName;
        this.textLimit = textLimit;
        this.snapshotEvent = snapshotEvent;
        this.addedEvent = addedEvent;
        this.reactionsEvent = reactionsEvent;
        this.updatedEvent = updatedEvent;
        this.deletedEvent = deletedEvent;
        this.typingEvent = typingEvent;
        this.presenceEvent = presenceEvent;
    }

    public String wireName() { return wireName; }
    public int textLimit() { return textLimit; }
    public String snapshotEvent() { return snapshotEvent; }
    public String addedEvent() { return addedEvent; }
    public String reactionsEvent() { return reactionsEvent; }
    public String updatedEvent() { return updatedEvent; }
    public String deletedEvent() { return deletedEvent; }
    public String typingEvent() { return typingEvent; }
    public String presenceEvent() { return presenceEvent; }
}
