package com.echoboard.realtime.room;

import com.echoboard.realtime.security.Identity;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Process-local registry of live rooms.
 *
 * <p>All access to a room goes through {@link #withRoom} or {@link #withExistingRoom}, which run the
 * given action while holding that room's lock. Actions for different rooms run in parallel; actions
 * for the same room are serialised, which is what keeps broadcasts in mutation order. Rooms left
 * without members are dropped from the registry.
 */
@ApplicationScoped
public class RoomRegistry {

    private static final Logger LOG = Logger.getLogger(RoomRegistry.class);

    private final ConcurrentHashMap<RoomKey, Room> rooms = new ConcurrentHashMap<>();
    private final Clock clock;

    @Inject
    public RoomRegistry(Clock clock) {
        this.clock = clock;
    }

    /** Runs {@code action} under the room's lock, creating the room if needed. */
    public <T> T withRoom(RoomKey key, Function<Room, T> action) {
        while (true) {
            Room room = rooms.computeIfAbsent(key, Room::new);
            room.lock().lock();
            try {
                if (room.isRetired()) continue;
                return action.apply(room);
            } finally {
                retireIfEmpty(room);
                room.lock().unlock();
            }
        }
    }

    /** Runs {@code action} under the room's lock if the room is live; empty otherwise. */
    public <T> Optional<T> withExistingRoom(RoomKey key, Function<Room, T> action) {
        while (true) {
            Room room = rooms.get(key);
            if (room == null) return Optional.empty();
            room.lock().lock();
            try {
                if (room.isRetired()) continue;
                return Optional.ofNullable(action.apply(room));
            } finally {
                retireIfEmpty(room);
                room.lock().unlock();
            }
        }
    }

    // Single-step helpers over withRoom, used where no broadcast is involved.

    int join(RoomKey key, RoomConnection connection, String displayName, Identity identity) {
        return withRoom(key, room -> room.admit(connection, displayName, identity));
    }

    boolean leave(RoomKey key, String connectionId) {
        return withExistingRoom(key, room -> room.remove(connectionId)).orElse(false);
    }

    boolean setTyping(RoomKey key, String connectionId, String name) {
        Instant now = now();
        return withExistingRoom(key, room -> room.setTyping(connectionId, name, now)).orElse(false);
    }

    boolean setCursor(RoomKey key, String connectionId, CursorPosition position) {
        return withExistingRoom(key, room -> room.setCursor(connectionId, position)).orElse(false);
    }

    public Set<RoomKey> roomKeys() {
        return Set.copyOf(rooms.keySet());
    }

    public Instant now() {
        return clock.instant();
    }

    @PreDestroy
    public void clear() {
        LOG.infof("Clearing %d live rooms", rooms.size());
        for (RoomKey key : roomKeys()) {
            Room room = rooms.get(key);
            if (room == null) continue;
            room.lock().lock();
            try {
                room.retire();
                rooms.remove(key, room);
            } finally {
                room.lock().unlock();
            }
        }
    }

    // Only the outermost holder may retire, a nested call may still be about to admit a member.
    private void retireIfEmpty(Room room) {
        if (room.isRetired() || room.lock().getHoldCount() != 1) return;
        if (room.isEmpty()) {
            room.retire();
            rooms.remove(room.key(), room);
            LOG.debugf("Room %s retired", room.key());
        }
    }
}
