package com.echoboard.realtime.model;

public record BoardMember(
    String userId,
    String username,
    Role role
) {}
