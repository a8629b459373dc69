package com.echoboard.realtime.store.client;

public record ReactionRequest(
    String userId,
    String emoji
) {}
