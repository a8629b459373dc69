package com.echoboard.realtime.store;

import com.echoboard.realtime.error.StorageException;
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
import com.echoboard.realtime.store.client.ActivityRequest;
import com.echoboard.realtime.store.client.BoardPatch;
import com.echoboard.realtime.store.client.BoardStoreClient;
import com.echoboard.realtime.store.client.CardOrderRequest;
import com.echoboard.realtime.store.client.CreateBoardRequest;
import com.echoboard.realtime.store.client.InviteRequest;
import com.echoboard.realtime.store.client.MemberRequest;
import com.echoboard.realtime.store.client.MessagePatch;
import com.echoboard.realtime.store.client.PresenceRequest;
import com.echoboard.realtime.store.client.ReactionRequest;
import com.echoboard.realtime.store.client.ReadRequest;
import com.echoboard.realtime.store.client.UserRequest;
import jakarta.ws.rs.WebApplicationException;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Gateway backed by the board-store service. A 404 answer is an absent row; every other failure
 * becomes a {@link StorageException}.
 */
public class RestStorageGateway implements StorageGateway {

    private static final Logger LOG = Logger.getLogger(RestStorageGateway.class);

    private final BoardStoreClient client;

    public RestStorageGateway(BoardStoreClient client) {
        this.client = client;
    }

    @Override
    public Optional<Board> findBoardByCode(String code) {
        return find("board " + code, () -> client.getBoard(code));
    }

    @Override
    public Board createBoard(String ownerId, String title, String theme) {
        return call("create board", () -> client.createBoard(new CreateBoardRequest(ownerId, title, theme)));
    }

    @Override
    public Optional<Board> updateBoardTheme(long boardId, String theme) {
        return find("board " + boardId, () -> client.updateBoard(boardId, new BoardPatch(null, theme)));
    }

    @Override
    public Optional<Board> updateBoardTitle(long boardId, String title) {
        return find("board " + boardId, () -> client.updateBoard(boardId, new BoardPatch(title, null)));
    }

    @Override
    public List<Card> listCards(long boardId) {
        return call("cards of board " + boardId, () -> client.listCards(boardId));
    }

    @Override
    public Card insertCard(long boardId, NewCard card) {
        return call("insert card", () -> client.insertCard(boardId, card));
    }

    @Override
    public Optional<Card> incrementCardVotes(long boardId, long cardId) {
        return find("card " + cardId, () -> client.voteCard(boardId, cardId));
    }

    @Override
    public void updateCardOrder(long boardId, List<Long> order) {
        call("reorder cards", () -> {
            client.updateCardOrder(boardId, new CardOrderRequest(order));
            return null;
        });
    }

    @Override
    public ChatMessage insertMessage(NewMessage message) {
        return call("insert message", () -> client.insertMessage(message));
    }

    @Override
    public Optional<ChatMessage> findMessage(RoomKind kind, long messageId) {
        return find("message " + messageId, () -> client.getMessage(kind.wireName(), messageId));
    }

    @Override
    public List<ChatMessage> listMessages(RoomKey room, int limit) {
        return call("messages of " + room, () -> client.listMessages(room.kind().wireName(), room.id(), limit));
    }

    @Override
    public Map<Long, List<ReactionCount>> listReactions(RoomKind kind, Collection<Long> messageIds) {
        if (messageIds.isEmpty()) return Map.of();
        return call("reactions", () -> client.listReactions(kind.wireName(), List.copyOf(messageIds)));
    }

    @Override
    public List<ReactionCount> toggleReaction(RoomKind kind, long messageId, String userId, String emoji) {
        return call("toggle reaction",
            () -> client.toggleReaction(kind.wireName(), messageId, new ReactionRequest(userId, emoji)));
    }

    @Override
    public Optional<ChatMessage> setMessageEdited(RoomKind kind, long messageId, String text) {
        return find("message " + messageId,
            () -> client.patchMessage(kind.wireName(), messageId, MessagePatch.edit(text)));
    }

    @Override
    public Optional<ChatMessage> setMessageDeleted(RoomKind kind, long messageId) {
        return find("message " + messageId,
            () -> client.patchMessage(kind.wireName(), messageId, MessagePatch.delete()));
    }

    @Override
    public Optional<ChatMessage> toggleMessagePinned(long messageId) {
        return find("message " + messageId, () -> client.togglePin(messageId));
    }

    @Override
    public Optional<ChatMessage> markDirectMessageRead(long messageId, String readerId) {
        return find("message " + messageId, () -> client.markRead(messageId, new ReadRequest(readerId, null)));
    }

    @Override
    public List<Long> markConversationRead(String readerId, String senderId) {
        return call("mark conversation read", () -> client.markConversationRead(new ReadRequest(readerId, senderId)));
    }

    @Override
    public Optional<Role> getMemberRole(long boardId, String userId) {
        return find("member " + userId, () -> client.getMember(boardId, userId)).map(BoardMember::role);
    }

    @Override
    public Role ensureMember(long boardId, String userId, Role role) {
        return call("ensure member",
            () -> client.putMember(boardId, userId, new MemberRequest(userId, role, true))).role();
    }

    @Override
    public void setMemberRole(long boardId, String userId, Role role) {
        call("set member role", () -> client.putMember(boardId, userId, new MemberRequest(userId, role, false)));
    }

    @Override
    public List<BoardMember> listMembers(long boardId) {
        return call("members of board " + boardId, () -> client.listMembers(boardId));
    }

    @Override
    public void logActivity(long boardId, String userId, String kind, Map<String, Object> payload) {
        call("log activity", () -> {
            client.logActivity(boardId, new ActivityRequest(userId, kind, payload));
            return null;
        });
    }

    @Override
    public List<ActivityEntry> listActivity(long boardId, int limit) {
        return call("activity of board " + boardId, () -> client.listActivity(boardId, limit));
    }

    @Override
    public void recordPresence(long boardId, String userId, String action, String details) {
        call("record presence", () -> {
            client.recordPresence(boardId, new PresenceRequest(userId, action, details));
            return null;
        });
    }

    @Override
    public List<PresenceEntry> listPresenceHistory(long boardId, int limit) {
        return call("presence of board " + boardId, () -> client.listPresence(boardId, limit));
    }

    @Override
    public UserAccount ensureUser(String userId, String username) {
        return call("ensure user " + userId, () -> client.putUser(userId, new UserRequest(username)));
    }

    @Override
    public Optional<UserAccount> findUserByUsername(String username) {
        return find("user " + username, () -> client.getUserByUsername(username));
    }

    @Override
    public Optional<UserAccount> findUserById(String userId) {
        return find("user " + userId, () -> client.getUser(userId));
    }

    @Override
    public Optional<GroupRoom> findGroupBySlug(String slug) {
        return find("group " + slug, () -> client.getGroup(slug));
    }

    @Override
    public Invite createInvite(long boardId, String createdBy, Duration ttl) {
        return call("create invite", () -> client.createInvite(boardId, new InviteRequest(createdBy, ttl.toSeconds())));
    }

    @Override
    public Optional<Invite> findInvite(String token) {
        return find("invite", () -> client.getInvite(token));
    }

    private <T> Optional<T> find(String what, Supplier<T> request) {
        try {
            return Optional.ofNullable(request.get());
        } catch (WebApplicationException e) {
            if (e.getResponse() != null && e.getResponse().getStatus() == 404) {
                return Optional.empty();
            }
            throw failure(what, e);
        } catch (RuntimeException e) {
            throw failure(what, e);
        }
    }

    private <T> T call(String what, Supplier<T> request) {
        try {
            return request.get();
        } catch (RuntimeException e) {
            throw failure(what, e);
        }
    }

    private StorageException failure(String what, RuntimeException cause) {
        LOG.warnf("Board store call failed (%s): %s", what, cause.getMessage());
        return new StorageException("storage unavailable", cause);
    }
}
