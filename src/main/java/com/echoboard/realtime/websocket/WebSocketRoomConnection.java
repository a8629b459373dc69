package com.echoboard.realtime.websocket;

import com.echoboard.realtime.room.RoomConnection;
import io.quarkus.websockets.next.WebSocketConnection;

final class WebSocketRoomConnection implements RoomConnection {

    private final WebSocketConnection connection;

    WebSocketRoomConnection(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public void send(String text) {
        connection.sendTextAndAwait(text);
    }
}
