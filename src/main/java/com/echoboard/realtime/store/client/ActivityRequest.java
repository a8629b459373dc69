package com.echoboard.realtime.store.client;

import java.util.Map;

public record ActivityRequest(
    String userId,
    String kind,
    Map<String, Object> payload
) {}
