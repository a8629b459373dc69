package com.echoboard.realtime.model;

import java.time.Instant;

public record Board(
    long id,
    String code,
    String title,
    String theme,
    String accentColor,
    String backgroundAnim,
    String ownerId,
    Instant createdAt
) {
    public Board withTheme(String newTheme) {
        return new Board(id, code, title, newTheme, accentColor, backgroundAnim, ownerId, createdAt);
    }

    public Board withTitle(String newTitle) {
        return new Board(id, code, newTitle, theme, accentColor, backgroundAnim, ownerId, createdAt);
    }
}
