package com.echoboard.realtime.room;

public record CursorPosition(
    String author,
    Double x,
    Double y,
    String color
) {}
