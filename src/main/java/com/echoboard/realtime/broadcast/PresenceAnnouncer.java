package com.echoboard.realtime.broadcast;

import com.echoboard.realtime.message.ServerMessage.DirectPresence;
import com.echoboard.realtime.message.ServerMessage.PresenceUpdate;
import com.echoboard.realtime.message.ServerMessage.TypingUpdate;
import com.echoboard.realtime.room.Room;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.security.Identity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Broadcasts of ephemeral room state. Callers hold the room's lock.
 */
@ApplicationScoped
public class PresenceAnnouncer {

    private final BroadcastRouter router;

    @Inject
    public PresenceAnnouncer(BroadcastRouter router) {
        this.router = router;
    }

    public void presence(Room room) {
        router.deliver(room, room.key().kind().presenceEvent(),
            new PresenceUpdate(room.memberCount(), room.memberNames()), null);
    }

    public void typing(Room room, String excludeConnectionId) {
        RoomKind kind = room.key().kind();
        String code = kind == RoomKind.DIRECT ? null : room.key().id();
        router.deliver(room, kind.typingEvent(), new TypingUpdate(code, room.typingAuthors()), excludeConnectionId);
    }

    public void cursors(Room room, String excludeConnectionId) {
        router.deliver(room, "cursors", room.cursors(), excludeConnectionId);
    }

    public void directPresence(Room room, String username, boolean online, String excludeConnectionId) {
        router.deliver(room, RoomKind.DIRECT.presenceEvent(), new DirectPresence(username, online),
            excludeConnectionId);
    }

    /** Announces that a member left {@code room}; {@code stillOnline} is whether the user has other connections. */
    public void departure(Room room, Identity identity, boolean stillOnline) {
        switch (room.key().kind()) {
            case BOARD -> {
                presence(room);
                typing(room, null);
                cursors(room, null);
            }
            case GROUP -> {
                presence(room);
                typing(room, null);
            }
            case DIRECT -> {
                if (identity != null) {
                    directPresence(room, identity.username(), stillOnline, null);
                }
                typing(room, null);
            }
        }
    }
}
