package com.echoboard.realtime.snapshot;

import com.echoboard.realtime.error.ForbiddenException;
import com.echoboard.realtime.error.NotFoundException;
import com.echoboard.realtime.message.CardView;
import com.echoboard.realtime.message.MessageView;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.GroupRoom;
import com.echoboard.realtime.model.ReactionCount;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.model.UserAccount;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.SessionManager;
import com.echoboard.realtime.snapshot.BoardState.BoardInfo;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the state a joining connection starts from.
 *
 * <p>Callers run this under the room's lock and send the result before admitting the joiner, so
 * the snapshot is one consistent read with respect to the room's writers.
 */
@ApplicationScoped
public class RoomStateSynthesizer {

    static final String DEFAULT_CHANNEL = "general";

    private final StorageGateway storage;
    private final MessageFormatter formatter;
    private final SessionManager sessions;
    private final int boardMessageLimit;
    private final int activityLimit;
    private final int presenceLimit;
    private final int directMessageLimit;
    private final int groupMessageLimit;

    @Inject
    public RoomStateSynthesizer(
        StorageGateway storage,
        MessageFormatter formatter,
        SessionManager sessions,
        @ConfigProperty(name = "echoboard.snapshot.message-limit", defaultValue = "200") int boardMessageLimit,
        @ConfigProperty(name = "echoboard.snapshot.activity-limit", defaultValue = "25") int activityLimit,
        @ConfigProperty(name = "echoboard.snapshot.presence-limit", defaultValue = "25") int presenceLimit,
        @ConfigProperty(name = "echoboard.snapshot.direct-limit", defaultValue = "100") int directMessageLimit,
        @ConfigProperty(name = "echoboard.snapshot.group-limit", defaultValue = "120") int groupMessageLimit) {
        this.storage = storage;
        this.formatter = formatter;
        this.sessions = sessions;
        this.boardMessageLimit = boardMessageLimit;
        this.activityLimit = activityLimit;
        this.presenceLimit = presenceLimit;
        this.directMessageLimit = directMessageLimit;
        this.groupMessageLimit = groupMessageLimit;
    }

    /**
     * @param requester the joining user, or null for an anonymous board visitor
     */
    public RoomState snapshot(RoomKey key, Identity requester) {
        return switch (key.kind()) {
            case BOARD -> board(key, requester);
            case DIRECT -> direct(key, requester);
            case GROUP -> group(key);
        };
    }

    private BoardState board(RoomKey key, Identity requester) {
        Board board = storage.findBoardByCode(key.id())
            .orElseThrow(() -> new NotFoundException("board not found"));

        List<CardView> cards = storage.listCards(board.id()).stream()
            .sorted(Comparator.comparingLong(Card::sortKey).thenComparingLong(Card::id))
            .map(formatter::card)
            .toList();

        List<ChatMessage> messages = visibleOldestFirst(storage.listMessages(key, boardMessageLimit));
        var channels = new TreeSet<String>();
        messages.forEach(m -> {
            if (m.channel() != null && !m.channel().isBlank()) channels.add(m.channel());
        });
        if (channels.isEmpty()) channels.add(DEFAULT_CHANNEL);

        Role role = requester == null
            ? Role.VIEWER
            : storage.getMemberRole(board.id(), requester.userId()).orElse(Role.VIEWER);

        return new BoardState(
            new BoardInfo(board.code(), board.accentColor(), board.backgroundAnim()),
            board.theme(),
            board.title(),
            cards,
            views(key, messages),
            List.copyOf(channels),
            storage.listMembers(board.id()),
            storage.listActivity(board.id(), activityLimit),
            storage.listPresenceHistory(board.id(), presenceLimit),
            role);
    }

    private DirectHistory direct(RoomKey key, Identity requester) {
        if (requester == null) throw ForbiddenException.authRequired();
        if (!key.hasParticipant(requester.userId())) throw ForbiddenException.noPermission();

        List<String> pair = key.participants();
        String otherId = pair.get(0).equals(requester.userId()) ? pair.get(1) : pair.get(0);
        String otherName = storage.findUserById(otherId).map(UserAccount::username).orElse(otherId);

        List<ChatMessage> messages = visibleOldestFirst(storage.listMessages(key, directMessageLimit));
        return new DirectHistory(otherName, sessions.isOnline(otherId), views(key, messages));
    }

    private GroupHistory group(RoomKey key) {
        GroupRoom group = storage.findGroupBySlug(key.id())
            .orElseThrow(() -> new NotFoundException("group not found"));
        List<ChatMessage> messages = visibleOldestFirst(storage.listMessages(key, groupMessageLimit));
        return new GroupHistory(group.slug(), group.title(), views(key, messages));
    }

    private List<MessageView> views(RoomKey key, List<ChatMessage> messages) {
        if (messages.isEmpty()) return List.of();
        Map<Long, List<ReactionCount>> reactions =
            storage.listReactions(key.kind(), messages.stream().map(ChatMessage::id).toList());
        return formatter.messages(messages, reactions);
    }

    // storage returns newest first
    private static List<ChatMessage> visibleOldestFirst(List<ChatMessage> newestFirst) {
        var result = new ArrayList<ChatMessage>(newestFirst.size());
        for (ChatMessage m : newestFirst) {
            if (!m.isDeleted()) result.add(m);
        }
        Collections.reverse(result);
        return result;
    }
}
