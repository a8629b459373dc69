package com.echoboard.realtime.model;

import java.time.Instant;

public record Card(
    long id,
    long boardId,
    String author,
    String text,
    String tag,
    int votes,
    Integer orderIndex,     // null for cards created before ordering existed
    String attachmentPath,
    Instant createdAt
) {
    public Card withVotes(int newVotes) {
        return new Card(id, boardId, author, text, tag, newVotes, orderIndex, attachmentPath, createdAt);
    }

    public Card withOrderIndex(int newIndex) {
        return new Card(id, boardId, author, text, tag, votes, newIndex, attachmentPath, createdAt);
    }

    /** Sort key: the explicit order index, or the id when none was ever assigned. */
    public long sortKey() {
        return orderIndex != null ? orderIndex : id;
    }
}
