package com.echoboard.realtime.store.client;

public record ReadRequest(
    String readerId,
    String senderId
) {}
