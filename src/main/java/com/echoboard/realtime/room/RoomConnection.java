package com.echoboard.realtime.room;

// Transport handle for one client connection.
public interface RoomConnection {

    String id();

    void send(String text);
}
