package com.echoboard.realtime.model;

public record ReactionCount(String emoji, int count) {}
