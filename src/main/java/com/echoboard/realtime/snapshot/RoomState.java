package com.echoboard.realtime.snapshot;

// Snapshot delivered privately to a joining connection.
public interface RoomState {
}
