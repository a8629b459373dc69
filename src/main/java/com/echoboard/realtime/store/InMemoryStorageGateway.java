package com.echoboard.realtime.store;

import com.echoboard.realtime.model.ActivityEntry;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.BoardMember;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.GroupRoom;
import com.echoboard.realtime.model.Invite;
import com.echoboard.realtime.model.NewCard;
import com.echoboard.realtime.model.NewMessage;
import com.echoboard.realtime.model.PresenceEntry;
import com.echoboard.realtime.model.ReactionCount;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.model.UserAccount;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local store used for development and tests. Each method is synchronized, which gives
 * the single-call atomicity the gateway contract asks for.
 */
public class InMemoryStorageGateway implements StorageGateway {

    private static final Logger LOG = Logger.getLogger(InMemoryStorageGateway.class);

    static final String DEFAULT_ACCENT = "#6366f1";
    static final String DEFAULT_BACKGROUND = "aurora";

    private record ReactionRow(long messageId, String userId, String emoji) {}

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private long boardSeq;
    private long cardSeq;
    private long activitySeq;
    private long presenceSeq;
    private long groupSeq;
    private final Map<RoomKind, Long> messageSeq = new EnumMap<>(RoomKind.class);

    private final Map<Long, Board> boards = new LinkedHashMap<>();
    private final Map<String, Long> boardIdsByCode = new HashMap<>();
    private final Map<Long, Card> cards = new LinkedHashMap<>();
    private final Map<RoomKind, Map<Long, ChatMessage>> messages = new EnumMap<>(RoomKind.class);
    private final Map<RoomKind, Set<ReactionRow>> reactions = new EnumMap<>(RoomKind.class);
    private final Map<Long, Map<String, Role>> members = new HashMap<>();
    private final List<ActivityEntry> activity = new ArrayList<>();
    private final List<PresenceEntry> presence = new ArrayList<>();
    private final Map<String, UserAccount> users = new LinkedHashMap<>();
    private final Map<String, GroupRoom> groups = new LinkedHashMap<>();
    private final Map<String, Invite> invites = new HashMap<>();

    public InMemoryStorageGateway(Clock clock) {
        this.clock = clock;
        for (RoomKind kind : RoomKind.values()) {
            messages.put(kind, new LinkedHashMap<>());
            reactions.put(kind, new LinkedHashSet<>());
            messageSeq.put(kind, 0L);
        }
        createGroup("lobby", "Community Lounge");
    }

    // seeding

    public synchronized UserAccount registerUser(String id, String username) {
        UserAccount user = new UserAccount(id, username.toLowerCase(Locale.ROOT));
        users.put(id, user);
        return user;
    }

    public synchronized GroupRoom createGroup(String slug, String title) {
        GroupRoom group = new GroupRoom(++groupSeq, slug, title);
        groups.put(slug, group);
        return group;
    }

    // boards

    @Override
    public synchronized Optional<Board> findBoardByCode(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(boardIdsByCode.get(code)).map(boards::get);
    }

    @Override
    public synchronized Board createBoard(String ownerId, String title, String theme) {
        String code;
        do {
            byte[] bytes = new byte[3];
            random.nextBytes(bytes);
            code = HexFormat.of().formatHex(bytes);
        } while (boardIdsByCode.containsKey(code));

        Board board = new Board(++boardSeq, code, title, theme, DEFAULT_ACCENT, DEFAULT_BACKGROUND, ownerId,
            clock.instant());
        boards.put(board.id(), board);
        boardIdsByCode.put(code, board.id());
        if (ownerId != null) {
            members.computeIfAbsent(board.id(), id -> new LinkedHashMap<>()).put(ownerId, Role.OWNER);
        }
        LOG.debugf("Created board %s (%d)", code, board.id());
        return board;
    }

    @Override
    public synchronized Optional<Board> updateBoardTheme(long boardId, String theme) {
        return Optional.ofNullable(boards.computeIfPresent(boardId, (id, b) -> b.withTheme(theme)));
    }

    @Override
    public synchronized Optional<Board> updateBoardTitle(long boardId, String title) {
        return Optional.ofNullable(boards.computeIfPresent(boardId, (id, b) -> b.withTitle(title)));
    }

    // cards

    @Override
    public synchronized List<Card> listCards(long boardId) {
        return cards.values().stream().filter(c -> c.boardId() == boardId).toList();
    }

    @Override
    public synchronized Card insertCard(long boardId, NewCard card) {
        int next = cards.values().stream()
            .filter(c -> c.boardId() == boardId && c.orderIndex() != null)
            .mapToInt(Card::orderIndex)
            .max()
            .orElse(-1) + 1;
        Card created = new Card(++cardSeq, boardId, card.author(), card.text(), card.tag(), 0, next,
            card.attachmentPath(), clock.instant());
        cards.put(created.id(), created);
        return created;
    }

    @Override
    public synchronized Optional<Card> incrementCardVotes(long boardId, long cardId) {
        Card card = cards.get(cardId);
        if (card == null || card.boardId() != boardId) return Optional.empty();
        Card voted = card.withVotes(card.votes() + 1);
        cards.put(cardId, voted);
        return Optional.of(voted);
    }

    @Override
    public synchronized void updateCardOrder(long boardId, List<Long> order) {
        for (int i = 0; i < order.size(); i++) {
            Card card = cards.get(order.get(i));
            if (card != null && card.boardId() == boardId) {
                cards.put(card.id(), card.withOrderIndex(i));
            }
        }
    }

    // messages

    @Override
    public synchronized ChatMessage insertMessage(NewMessage message) {
        RoomKind kind = message.room().kind();
        long id = messageSeq.merge(kind, 1L, Long::sum);
        ChatMessage created = new ChatMessage(id, kind, message.room().id(), message.authorId(), message.author(),
            message.recipientId(), message.text(), message.channel(), message.replyTo(), false,
            message.attachments(), message.voicePath(), clock.instant(), null, null, null);
        messages.get(kind).put(id, created);
        return created;
    }

    @Override
    public synchronized Optional<ChatMessage> findMessage(RoomKind kind, long messageId) {
        return Optional.ofNullable(messages.get(kind).get(messageId));
    }

    @Override
    public synchronized List<ChatMessage> listMessages(RoomKey room, int limit) {
        return messages.get(room.kind()).values().stream()
            .filter(m -> m.roomId().equals(room.id()))
            .sorted(Comparator.comparingLong(ChatMessage::id).reversed())
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized Map<Long, List<ReactionCount>> listReactions(RoomKind kind, Collection<Long> messageIds) {
        Map<Long, List<ReactionCount>> result = new HashMap<>();
        for (Long id : messageIds) {
            List<ReactionCount> tally = tally(kind, id);
            if (!tally.isEmpty()) result.put(id, tally);
        }
        return result;
    }

    @Override
    public synchronized List<ReactionCount> toggleReaction(RoomKind kind, long messageId, String userId, String emoji) {
        ReactionRow row = new ReactionRow(messageId, userId, emoji);
        Set<ReactionRow> rows = reactions.get(kind);
        if (!rows.remove(row)) {
            rows.add(row);
        }
        return tally(kind, messageId);
    }

    private List<ReactionCount> tally(RoomKind kind, long messageId) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ReactionRow row : reactions.get(kind)) {
            if (row.messageId() == messageId) counts.merge(row.emoji(), 1, Integer::sum);
        }
        return counts.entrySet().stream().map(e -> new ReactionCount(e.getKey(), e.getValue())).toList();
    }

    @Override
    public synchronized Optional<ChatMessage> setMessageEdited(RoomKind kind, long messageId, String text) {
        Instant now = clock.instant();
        return Optional.ofNullable(messages.get(kind).computeIfPresent(messageId, (id, m) -> m.withText(text, now)));
    }

    @Override
    public synchronized Optional<ChatMessage> setMessageDeleted(RoomKind kind, long messageId) {
        Instant now = clock.instant();
        return Optional.ofNullable(messages.get(kind).computeIfPresent(messageId, (id, m) -> m.withDeletedAt(now)));
    }

    @Override
    public synchronized Optional<ChatMessage> toggleMessagePinned(long messageId) {
        return Optional.ofNullable(messages.get(RoomKind.BOARD)
            .computeIfPresent(messageId, (id, m) -> m.withPinned(!m.pinned())));
    }

    @Override
    public synchronized Optional<ChatMessage> markDirectMessageRead(long messageId, String readerId) {
        ChatMessage message = messages.get(RoomKind.DIRECT).get(messageId);
        if (message == null || !readerId.equals(message.recipientId())) return Optional.empty();
        if (message.readAt() == null) {
            message = message.withReadAt(clock.instant());
            messages.get(RoomKind.DIRECT).put(messageId, message);
        }
        return Optional.of(message);
    }

    @Override
    public synchronized List<Long> markConversationRead(String readerId, String senderId) {
        Instant now = clock.instant();
        List<Long> marked = new ArrayList<>();
        Map<Long, ChatMessage> direct = messages.get(RoomKind.DIRECT);
        for (ChatMessage m : List.copyOf(direct.values())) {
            if (readerId.equals(m.recipientId()) && senderId.equals(m.authorId())
                && m.readAt() == null && !m.isDeleted()) {
                direct.put(m.id(), m.withReadAt(now));
                marked.add(m.id());
            }
        }
        return marked;
    }

    // membership and audit

    @Override
    public synchronized Optional<Role> getMemberRole(long boardId, String userId) {
        return Optional.ofNullable(members.getOrDefault(boardId, Map.of()).get(userId));
    }

    @Override
    public synchronized Role ensureMember(long boardId, String userId, Role role) {
        return members.computeIfAbsent(boardId, id -> new LinkedHashMap<>()).computeIfAbsent(userId, u -> role);
    }

    @Override
    public synchronized void setMemberRole(long boardId, String userId, Role role) {
        members.computeIfAbsent(boardId, id -> new LinkedHashMap<>()).put(userId, role);
    }

    @Override
    public synchronized List<BoardMember> listMembers(long boardId) {
        return members.getOrDefault(boardId, Map.of()).entrySet().stream()
            .map(e -> new BoardMember(e.getKey(), usernameOf(e.getKey()), e.getValue()))
            .toList();
    }

    @Override
    public synchronized void logActivity(long boardId, String userId, String kind, Map<String, Object> payload) {
        activity.add(new ActivityEntry(++activitySeq, boardId, userId, usernameOf(userId), kind,
            payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload)), clock.instant()));
    }

    @Override
    public synchronized List<ActivityEntry> listActivity(long boardId, int limit) {
        return activity.stream()
            .filter(a -> a.boardId() == boardId)
            .sorted(Comparator.comparingLong(ActivityEntry::id).reversed())
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized void recordPresence(long boardId, String userId, String action, String details) {
        presence.add(new PresenceEntry(++presenceSeq, boardId, userId, usernameOf(userId), action, details,
            clock.instant()));
    }

    @Override
    public synchronized List<PresenceEntry> listPresenceHistory(long boardId, int limit) {
        return presence.stream()
            .filter(p -> p.boardId() == boardId)
            .sorted(Comparator.comparingLong(PresenceEntry::id).reversed())
            .limit(limit)
            .toList();
    }

    // users, groups, invites

    @Override
    public synchronized UserAccount ensureUser(String userId, String username) {
        UserAccount existing = users.get(userId);
        if (existing != null && existing.username().equals(username.toLowerCase(Locale.ROOT))) {
            return existing;
        }
        return registerUser(userId, username);
    }

    @Override
    public synchronized Optional<UserAccount> findUserByUsername(String username) {
        if (username == null) return Optional.empty();
        String wanted = username.trim().toLowerCase(Locale.ROOT);
        return users.values().stream().filter(u -> u.username().equals(wanted)).findFirst();
    }

    @Override
    public synchronized Optional<UserAccount> findUserById(String userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public synchronized Optional<GroupRoom> findGroupBySlug(String slug) {
        return Optional.ofNullable(groups.get(slug));
    }

    @Override
    public synchronized Invite createInvite(long boardId, String createdBy, Duration ttl) {
        Board board = boards.get(boardId);
        if (board == null) {
            throw new IllegalArgumentException("Unknown board " + boardId);
        }
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        Invite invite = new Invite(token, boardId, board.code(), createdBy, clock.instant().plus(ttl));
        invites.put(token, invite);
        return invite;
    }

    @Override
    public synchronized Optional<Invite> findInvite(String token) {
        return Optional.ofNullable(invites.get(token));
    }

    private String usernameOf(String userId) {
        if (userId == null) return null;
        UserAccount user = users.get(userId);
        return user != null ? user.username() : userId;
    }
}
