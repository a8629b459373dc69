package com.echoboard.realtime.session;

import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import com.echoboard.realtime.error.StorageException;
import com.echoboard.realtime.room.RoomConnection;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.room.RoomRegistry;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open connections and cleans up every room a connection was in when it goes away.
 */
@ApplicationScoped
public class SessionManager {

    private static final Logger LOG = Logger.getLogger(SessionManager.class);

    private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();

    private final RoomRegistry registry;
    private final PresenceAnnouncer announcer;
    private final StorageGateway storage;

    @Inject
    public SessionManager(RoomRegistry registry, PresenceAnnouncer announcer, StorageGateway storage) {
        this.registry = registry;
        this.announcer = announcer;
        this.storage = storage;
    }

    public ClientSession onConnect(RoomConnection connection, Identity identity) {
        var session = new ClientSession(connection, identity);
        sessions.put(connection.id(), session);
        if (identity != null) {
            recordUser(identity);
            connectionsByUser.compute(identity.userId(), (userId, ids) -> {
                Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
                set.add(connection.id());
                return set;
            });
        }
        return session;
    }

    public Optional<ClientSession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public boolean isOnline(String userId) {
        return connectionsByUser.containsKey(userId);
    }

    int connectionCount() {
        return sessions.size();
    }

    /**
     * Removes the connection from every room it joined and announces the departure in each.
     * Unknown connection ids are ignored.
     */
    public void onDisconnect(String connectionId) {
        ClientSession session = sessions.remove(connectionId);
        if (session == null) {
            LOG.debugf("Disconnect for unknown connection %s", connectionId);
            return;
        }
        Set<RoomKey> rooms = session.close();
        Identity identity = session.identity().orElse(null);
        if (identity != null) {
            connectionsByUser.computeIfPresent(identity.userId(), (userId, ids) -> {
                ids.remove(connectionId);
                return ids.isEmpty() ? null : ids;
            });
        }
        for (RoomKey key : rooms) {
            try {
                depart(session, key);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Cleanup of %s for connection %s failed", key, connectionId);
            }
        }
    }

    /** Explicit leave of one room by a connection that stays open. */
    public boolean leave(ClientSession session, RoomKey key) {
        session.untrack(key);
        return depart(session, key);
    }

    private boolean depart(ClientSession session, RoomKey key) {
        Identity identity = session.identity().orElse(null);
        boolean stillOnline = identity != null && isOnline(identity.userId());
        boolean removed = registry.withExistingRoom(key, room -> {
            if (!room.remove(session.id())) return false;
            announcer.departure(room, identity, stillOnline);
            return true;
        }).orElse(false);

        if (removed && identity != null && key.kind() == RoomKind.BOARD) {
            recordLeave(key.id(), identity);
        }
        return removed;
    }

    private void recordUser(Identity identity) {
        try {
            storage.ensureUser(identity.userId(), identity.username());
        } catch (StorageException e) {
            LOG.warnf("Account %s not recorded: %s", identity.userId(), e.getMessage());
        }
    }

    private void recordLeave(String code, Identity identity) {
        try {
            storage.findBoardByCode(code)
                .ifPresent(board -> storage.recordPresence(board.id(), identity.userId(), "leave", null));
        } catch (StorageException e) {
            LOG.warnf("Presence history for %s on board %s not recorded: %s", identity.userId(), code,
                e.getMessage());
        }
    }
}
