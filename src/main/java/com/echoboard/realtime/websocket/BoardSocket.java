package com.echoboard.realtime.websocket;

import com.echoboard.realtime.handler.EventDispatcher;
import com.echoboard.realtime.security.AuthService;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.ClientSession;
import com.echoboard.realtime.session.SessionManager;
import io.quarkus.websockets.next.*;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * WebSocket endpoint for boards, direct messages and group rooms.
 * A bearer token is optional; without one the connection is anonymous and limited to board events.
 */
@WebSocket(path = "/ws/boards")
public class BoardSocket {

    private static final Logger LOG = Logger.getLogger(BoardSocket.class);

    @Inject
    SessionManager sessionManager;

    @Inject
    AuthService authService;

    @Inject
    EventDispatcher dispatcher;

    @OnOpen
    public void onOpen(WebSocketConnection connection) {
        Identity identity = authService.currentIdentity().orElse(null);
        sessionManager.onConnect(new WebSocketRoomConnection(connection), identity);
        LOG.infof("WebSocket opened: %s (user: %s)", connection.id(),
            identity != null ? identity.userId() : "anonymous");
    }

    @OnTextMessage
    public void onMessage(String messageJson, WebSocketConnection connection) {
        ClientSession session = sessionManager.find(connection.id()).orElse(null);
        if (session == null) {
            LOG.warnf("Frame on unregistered connection %s dropped", connection.id());
            return;
        }
        dispatcher.dispatch(session, messageJson);
    }

    @OnClose
    public void onClose(WebSocketConnection connection) {
        LOG.infof("WebSocket closed: %s", connection.id());
        sessionManager.onDisconnect(connection.id());
    }

    @OnError
    public void onError(WebSocketConnection connection, Throwable t) {
        failed(connection.id(), t);
    }

    // A failed connection may never see @OnClose; disconnect is idempotent so both paths clean up.
    void failed(String connectionId, Throwable t) {
        LOG.errorf(t, "WebSocket error on %s", connectionId);
        sessionManager.onDisconnect(connectionId);
    }
}
