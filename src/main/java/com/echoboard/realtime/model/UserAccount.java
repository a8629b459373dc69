package com.echoboard.realtime.model;

public record UserAccount(
    String id,
    String username
) {}
