package com.echoboard.realtime.security;

// Authenticated user behind a connection.
public record Identity(
    String userId,
    String username
) {}
