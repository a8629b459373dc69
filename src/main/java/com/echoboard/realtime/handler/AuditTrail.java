package com.echoboard.realtime.handler;

import com.echoboard.realtime.error.StorageException;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Activity log and presence history writes. They happen after the change was committed and
 * broadcast, so a failure here is logged rather than reported to the client.
 */
@ApplicationScoped
public class AuditTrail {

    private static final Logger LOG = Logger.getLogger(AuditTrail.class);

    private final StorageGateway storage;

    @Inject
    public AuditTrail(StorageGateway storage) {
        this.storage = storage;
    }

    public void activity(Board board, Identity actor, String kind, Map<String, Object> payload) {
        String userId = actor != null ? actor.userId() : null;
        try {
            storage.logActivity(board.id(), userId, kind, payload);
        } catch (StorageException e) {
            LOG.warnf("Activity %s on board %s not logged: %s", kind, board.code(), e.getMessage());
        }
    }

    public void presence(Board board, Identity actor, String action, String details) {
        try {
            storage.recordPresence(board.id(), actor.userId(), action, details);
        } catch (StorageException e) {
            LOG.warnf("Presence %s on board %s not recorded: %s", action, board.code(), e.getMessage());
        }
    }
}
