package com.echoboard.realtime.store.client;

public record PresenceRequest(
    String userId,
    String action,
    String details
) {}
