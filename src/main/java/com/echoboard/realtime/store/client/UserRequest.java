package com.echoboard.realtime.store.client;

public record UserRequest(
    String username
) {}
