package com.echoboard.realtime.store.client;

public record CreateBoardRequest(
    String ownerId,
    String title,
    String theme
) {}
