package com.echoboard.realtime.session;

import com.echoboard.realtime.error.ForbiddenException;
import com.echoboard.realtime.room.RoomConnection;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.security.Identity;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * One open connection: its identity (if any) and the rooms it has joined.
 *
 * <p>{@link #track} and {@link #close} share the session monitor, so a join racing a disconnect
 * either gets tracked before the disconnect collects the room set or is refused.
 */
public class ClientSession {

    private final RoomConnection connection;
    private final Identity identity;
    private final Set<RoomKey> rooms = new LinkedHashSet<>();
    private boolean closed;

    public ClientSession(RoomConnection connection, Identity identity) {
        this.connection = connection;
        this.identity = identity;
    }

    public RoomConnection connection() {
        return connection;
    }

    public String id() {
        return connection.id();
    }

    public Optional<Identity> identity() {
        return Optional.ofNullable(identity);
    }

    public Identity requireIdentity() {
        if (identity == null) {
            throw ForbiddenException.authRequired();
        }
        return identity;
    }

    /** Records that the connection joined {@code key}. Returns false once the session is closed. */
    public synchronized boolean track(RoomKey key) {
        if (closed) return false;
        rooms.add(key);
        return true;
    }

    public synchronized void untrack(RoomKey key) {
        rooms.remove(key);
    }

    public synchronized Set<RoomKey> rooms() {
        return Set.copyOf(rooms);
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Closes the session and hands back the rooms it was in. */
    synchronized Set<RoomKey> close() {
        closed = true;
        Set<RoomKey> joined = Set.copyOf(rooms);
        rooms.clear();
        return joined;
    }
}
