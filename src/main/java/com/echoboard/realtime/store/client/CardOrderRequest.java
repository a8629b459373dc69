package com.echoboard.realtime.store.client;

import java.util.List;

public record CardOrderRequest(List<Long> order) {}
