package com.echoboard.realtime.store.client;

public record InviteRequest(
    String createdBy,
    long ttlSeconds
) {}
