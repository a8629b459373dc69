package com.echoboard.realtime.testing;

import com.echoboard.realtime.message.MessageCodec;
import com.echoboard.realtime.room.RoomConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connection double that keeps every frame sent to it.
 */
public class RecordingConnection implements RoomConnection {

    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) {
        if (failing) {
            throw new IllegalStateException("connection " + id + " is broken");
        }
        frames.add(text);
    }

    public void failSends() {
        failing = true;
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    public List<String> types() {
        return frames.stream().map(f -> parse(f).path("type").asText()).toList();
    }

    /** Payloads of every frame of the given type, oldest first. */
    public List<JsonNode> events(String type) {
        var result = new ArrayList<JsonNode>();
        for (String frame : frames) {
            JsonNode node = parse(frame);
            if (type.equals(node.path("type").asText())) result.add(node.path("data"));
        }
        return result;
    }

    public JsonNode last(String type) {
        List<JsonNode> events = events(type);
        if (events.isEmpty()) {
            throw new AssertionError("no " + type + " frame on " + id + ", got " + types());
        }
        return events.get(events.size() - 1);
    }

    public void clear() {
        frames.clear();
    }

    private static JsonNode parse(String frame) {
        try {
            return MessageCodec.mapper().readTree(frame);
        } catch (JsonProcessingException e) {
            throw new AssertionError("unparseable frame " + frame, e);
        }
    }
}
