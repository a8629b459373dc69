package com.echoboard.realtime.room;

import java.util.List;
import java.util.Objects;

/**
 * Identifies a room. Board rooms are keyed by board code, group rooms by slug and direct rooms by
 * the two user ids in sorted order, so both participants resolve to the same key.
 *
 * <p>In a direct room id the ids are joined by {@code :}; a {@code :} or {@code %} inside a user id is
 * percent-encoded so any JWT subject can take part.
 */
public record RoomKey(RoomKind kind, String id) {

    private static final String PAIR_SEPARATOR = ":";

    public RoomKey {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("room id required");
        }
    }

    public static RoomKey board(String code) {
        return new RoomKey(RoomKind.BOARD, code);
    }

    public static RoomKey group(String slug) {
        return new RoomKey(RoomKind.GROUP, slug);
    }

    public static RoomKey direct(String userA, String userB) {
        String lo = userA.compareTo(userB) <= 0 ? userA : userB;
        String hi = lo.equals(userA) ? userB : userA;
        return new RoomKey(RoomKind.DIRECT, escape(lo) + PAIR_SEPARATOR + escape(hi));
    }

    public static RoomKey of(RoomKind kind, String id) {
        return new RoomKey(kind, id);
    }

    /** The two user ids of a direct room; empty for other kinds. */
    public List<String> participants() {
        if (kind != RoomKind.DIRECT) return List.of();
        int split = id.indexOf(PAIR_SEPARATOR);
        if (split < 0) return List.of();
        return List.of(unescape(id.substring(0, split)), unescape(id.substring(split + 1)));
    }

    public boolean hasParticipant(String userId) {
        return participants().contains(userId);
    }

    private static String escape(String userId) {
        return userId.replace("%", "%25").replace(PAIR_SEPARATOR, "%3A");
    }

    private static String unescape(String part) {
        return part.replace("%3A", PAIR_SEPARATOR).replace("%25", "%");
    }

    @Override
    public String toString() {
        return kind.wireName() + "/" + id;
    }
}
