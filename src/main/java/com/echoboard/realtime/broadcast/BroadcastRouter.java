package com.echoboard.realtime.broadcast;

import com.echoboard.realtime.error.RealtimeException;
import com.echoboard.realtime.message.MessageCodec;
import com.echoboard.realtime.message.ServerMessage;
import com.echoboard.realtime.room.Room;
import com.echoboard.realtime.room.RoomConnection;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Fans events out to room members. Delivery is best effort: a failed send to one member is logged
 * and the remaining members still receive the event.
 */
@ApplicationScoped
public class BroadcastRouter {

    private static final Logger LOG = Logger.getLogger(BroadcastRouter.class);

    private final RoomRegistry registry;

    @Inject
    public BroadcastRouter(RoomRegistry registry) {
        this.registry = registry;
    }

    /**
     * Publishes to the current members of {@code key}. Returns how many members the event reached;
     * zero when the room has no live members.
     */
    int publish(RoomKey key, String event, Object payload, String excludeConnectionId) {
        return registry.withExistingRoom(key, room -> deliver(room, event, payload, excludeConnectionId))
            .orElse(0);
    }

    /**
     * Sends to every member of a room whose lock the caller already holds, skipping
     * {@code excludeConnectionId}. Returns how many members the event reached.
     */
    public int deliver(Room room, String event, Object payload, String excludeConnectionId) {
        String json = MessageCodec.encode(ServerMessage.of(event, payload));
        int delivered = 0;
        for (RoomConnection connection : room.connections()) {
            if (connection.id().equals(excludeConnectionId)) continue;
            if (send(connection, json)) delivered++;
        }
        LOG.debugf("%s -> %s delivered to %d", event, room.key(), delivered);
        return delivered;
    }

    public void sendTo(RoomConnection connection, String event, Object payload) {
        send(connection, MessageCodec.encode(ServerMessage.of(event, payload)));
    }

    public void sendError(RoomConnection connection, RealtimeException error) {
        sendError(connection, error.kind(), error.getMessage());
    }

    public void sendError(RoomConnection connection, String kind, String message) {
        send(connection, MessageCodec.encode(ServerMessage.error(kind, message)));
    }

    private boolean send(RoomConnection connection, String json) {
        try {
            connection.send(json);
            return true;
        } catch (RuntimeException e) {
            LOG.warnf("Send to connection %s failed: %s", connection.id(), e.getMessage());
            return false;
        }
    }
}
