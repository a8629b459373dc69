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

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable state of boards, cards, messages, reactions and memberships.
 *
 * <p>Every call is atomic on its own and may block. Implementations report failures as
 * {@link com.echoboard.realtime.error.StorageException}; a missing row is an empty result, not an error.
 */
public interface StorageGateway {

    // boards

    Optional<Board> findBoardByCode(String code);

    /** Creates a board with a fresh unique code. A non-null owner becomes its {@link Role#OWNER}. */
    Board createBoard(String ownerId, String title, String theme);

    Optional<Board> updateBoardTheme(long boardId, String theme);

    Optional<Board> updateBoardTitle(long boardId, String title);

    // cards

    List<Card> listCards(long boardId);

    /** Inserts a card with zero votes and order index one past the board's current maximum. */
    Card insertCard(long boardId, NewCard card);

    Optional<Card> incrementCardVotes(long boardId, long cardId);

    /** Sets each listed card's order index to its position in {@code order}; unknown ids are skipped. */
    void updateCardOrder(long boardId, List<Long> order);

    // messages

    ChatMessage insertMessage(NewMessage message);

    Optional<ChatMessage> findMessage(RoomKind kind, long messageId);

    /** The newest {@code limit} messages of the room, newest first, deleted ones included. */
    List<ChatMessage> listMessages(RoomKey room, int limit);

    Map<Long, List<ReactionCount>> listReactions(RoomKind kind, Collection<Long> messageIds);

    /** Adds the reaction, or removes it when the same user already reacted with the same emoji. */
    List<ReactionCount> toggleReaction(RoomKind kind, long messageId, String userId, String emoji);

    Optional<ChatMessage> setMessageEdited(RoomKind kind, long messageId, String text);

    Optional<ChatMessage> setMessageDeleted(RoomKind kind, long messageId);

    Optional<ChatMessage> toggleMessagePinned(long messageId);

    Optional<ChatMessage> markDirectMessageRead(long messageId, String readerId);

    /** Marks every unread message from {@code senderId} to {@code readerId} read; returns their ids. */
    List<Long> markConversationRead(String readerId, String senderId);

    // membership and audit

    Optional<Role> getMemberRole(long boardId, String userId);

    /** Adds the user with {@code role} unless they are already a member; returns the effective role. */
    Role ensureMember(long boardId, String userId, Role role);

    void setMemberRole(long boardId, String userId, Role role);

    List<BoardMember> listMembers(long boardId);

    void logActivity(long boardId, String userId, String kind, Map<String, Object> payload);

    List<ActivityEntry> listActivity(long boardId, int limit);

    void recordPresence(long boardId, String userId, String action, String details);

    List<PresenceEntry> listPresenceHistory(long boardId, int limit);

    // users, groups, invites

    /** Records the account behind an authenticated connection, updating its username if it changed. */
    UserAccount ensureUser(String userId, String username);

    Optional<UserAccount> findUserByUsername(String username);

    Optional<UserAccount> findUserById(String userId);

    Optional<GroupRoom> findGroupBySlug(String slug);

    Invite createInvite(long boardId, String createdBy, Duration ttl);

    Optional<Invite> findInvite(String token);
}
