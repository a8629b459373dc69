package com.echoboard.realtime.store.client;

// Partial board update; null fields are left unchanged.
public record BoardPatch(
    String title,
    String theme
) {}
