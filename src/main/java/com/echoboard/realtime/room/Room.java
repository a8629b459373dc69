package com.echoboard.realtime.room;

import com.echoboard.realtime.security.Identity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of one room: who is connected, who is typing and where their cursors are.
 *
 * <p>A room is only touched through {@link RoomRegistry}, which holds the room's lock for the whole
 * read-mutate-broadcast step. Every accessor checks that the calling thread holds it.
 */
public final class Room {

    private final RoomKey key;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Member> members = new LinkedHashMap<>();
    private final Map<String, TypingEntry> typing = new LinkedHashMap<>();
    private final Map<String, CursorPosition> cursors = new LinkedHashMap<>();

    // set once the registry dropped this instance; callers holding a stale reference must retry
    private boolean retired;

    public record Member(RoomConnection connection, String displayName, Identity identity) {}

    record TypingEntry(String name, Instant since) {}

    Room(RoomKey key) {
        this.key = key;
    }

    public RoomKey key() {
        return key;
    }

    ReentrantLock lock() {
        return lock;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
        members.clear();
        typing.clear();
        cursors.clear();
    }

    /** Adds or refreshes a member. Returns the member count after the call. */
    public int admit(RoomConnection connection, String displayName, Identity identity) {
        assertHeld();
        members.put(connection.id(), new Member(connection, displayName, identity));
        return members.size();
    }

    /** Removes a member together with its typing and cursor entries. */
    public boolean remove(String connectionId) {
        assertHeld();
        typing.remove(connectionId);
        cursors.remove(connectionId);
        return members.remove(connectionId) != null;
    }

    public boolean isMember(String connectionId) {
        assertHeld();
        return members.containsKey(connectionId);
    }

    /**
     * Marks the connection as typing under {@code name}, or clears it when {@code name} is null.
     * Connections that are not members are ignored and {@code false} is returned.
     */
    public boolean setTyping(String connectionId, String name, Instant now) {
        assertHeld();
        if (!members.containsKey(connectionId)) return false;
        if (name == null) {
            typing.remove(connectionId);
        } else {
            typing.put(connectionId, new TypingEntry(name, now));
        }
        return true;
    }

    public boolean setCursor(String connectionId, CursorPosition position) {
        assertHeld();
        if (!members.containsKey(connectionId)) return false;
        if (position == null) {
            cursors.remove(connectionId);
        } else {
            cursors.put(connectionId, position);
        }
        return true;
    }

    /** Drops typing entries older than {@code cutoff}. Returns whether anything changed. */
    public boolean expireTyping(Instant cutoff) {
        assertHeld();
        boolean changed = false;
        for (Iterator<TypingEntry> it = typing.values().iterator(); it.hasNext(); ) {
            if (it.next().since().isBefore(cutoff)) {
                it.remove();
                changed = true;
            }
        }
        return changed;
    }

    public List<String> typingAuthors() {
        assertHeld();
        var names = new LinkedHashSet<String>();
        typing.values().forEach(t -> {
            if (t.name() != null && !t.name().isBlank()) names.add(t.name());
        });
        return List.copyOf(names);
    }

    public List<CursorPosition> cursors() {
        assertHeld();
        return List.copyOf(cursors.values());
    }

    public List<RoomConnection> connections() {
        assertHeld();
        return members.values().stream().map(Member::connection).toList();
    }

    public List<Member> members() {
        assertHeld();
        return List.copyOf(members.values());
    }

    public List<String> memberNames() {
        assertHeld();
        var names = new ArrayList<String>();
        members.values().forEach(m -> {
            if (m.displayName() != null && !m.displayName().isBlank()) names.add(m.displayName());
        });
        names.sort(null);
        return names;
    }

    public int memberCount() {
        assertHeld();
        return members.size();
    }

    public boolean isEmpty() {
        assertHeld();
        return members.isEmpty();
    }

    private void assertHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("room " + key + " accessed outside its lock");
        }
    }
}
