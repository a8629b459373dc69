package com.echoboard.realtime.handler;

import com.echoboard.realtime.broadcast.BroadcastRouter;
import com.echoboard.realtime.error.RealtimeException;
import com.echoboard.realtime.error.ValidationException;
import com.echoboard.realtime.message.ClientMessage;
import com.echoboard.realtime.message.MessageCodec;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.session.ClientSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Decodes an inbound frame and routes it to its handler. Failures are reported to the sending
 * connection only; the connection stays open.
 */
@ApplicationScoped
public class EventDispatcher {

    private static final Logger LOG = Logger.getLogger(EventDispatcher.class);

    private final BoardHandler boards;
    private final ChatHandler chat;
    private final DirectMessageHandler directMessages;
    private final GroupHandler groups;
    private final BroadcastRouter router;

    @Inject
    public EventDispatcher(BoardHandler boards, ChatHandler chat, DirectMessageHandler directMessages,
                           GroupHandler groups, BroadcastRouter router) {
        this.boards = boards;
        this.chat = chat;
        this.directMessages = directMessages;
        this.groups = groups;
        this.router = router;
    }

    public void dispatch(ClientSession session, String frame) {
        ClientMessage msg;
        try {
            msg = MessageCodec.decode(frame);
        } catch (JsonProcessingException e) {
            LOG.debugf("Malformed frame from %s: %s", session.id(), e.getOriginalMessage());
            router.sendError(session.connection(), new ValidationException("malformed message"));
            return;
        }

        try {
            handle(session, msg);
        } catch (RealtimeException e) {
            LOG.debugf("%s from %s rejected: %s", msg.type(), session.id(), e.getMessage());
            router.sendError(session.connection(), e);
        } catch (RuntimeException e) {
            LOG.errorf(e, "%s from %s failed", msg.type(), session.id());
            router.sendError(session.connection(), "internal", "internal error");
        }
    }

    void handle(ClientSession session, ClientMessage msg) {
        String type = msg.type() == null ? "" : msg.type();
        switch (type) {
            case "create_board" -> boards.createBoard(session, msg);
            case "join_board" -> boards.join(session, msg);
            case "leave" -> boards.leave(session, msg);
            case "create_card" -> boards.createCard(session, msg);
            case "vote_card" -> boards.vote(session, msg);
            case "reorder_cards" -> boards.reorder(session, msg);
            case "set_theme" -> boards.setTheme(session, msg);
            case "set_title" -> boards.setTitle(session, msg);
            case "cursor_move" -> boards.moveCursor(session, msg);
            case "create_invite" -> boards.createInvite(session, msg);
            case "redeem_invite" -> boards.redeemInvite(session, msg);
            case "set_role" -> boards.setRole(session, msg);

            case "send_chat" -> chat.send(RoomKind.BOARD, session, msg);
            case "chat_react" -> chat.react(RoomKind.BOARD, session, msg);
            case "chat_pin" -> chat.pin(session, msg);
            case "chat_edit" -> chat.edit(RoomKind.BOARD, session, msg);
            case "chat_delete" -> chat.delete(RoomKind.BOARD, session, msg);
            case "typing" -> chat.typing(RoomKind.BOARD, session, msg, true);
            case "stop_typing" -> chat.typing(RoomKind.BOARD, session, msg, false);

            case "dm_join" -> directMessages.join(session, msg);
            case "dm_send" -> chat.send(RoomKind.DIRECT, session, msg);
            case "dm_react" -> chat.react(RoomKind.DIRECT, session, msg);
            case "dm_edit" -> chat.edit(RoomKind.DIRECT, session, msg);
            case "dm_delete" -> chat.delete(RoomKind.DIRECT, session, msg);
            case "dm_read" -> directMessages.markRead(session, msg);
            case "dm_typing" -> chat.typing(RoomKind.DIRECT, session, msg, true);
            case "dm_stop_typing" -> chat.typing(RoomKind.DIRECT, session, msg, false);

            case "group_join" -> groups.join(session, msg);
            case "group_send" -> chat.send(RoomKind.GROUP, session, msg);
            case "group_react" -> chat.react(RoomKind.GROUP, session, msg);
            case "group_edit" -> chat.edit(RoomKind.GROUP, session, msg);
            case "group_delete" -> chat.delete(RoomKind.GROUP, session, msg);
            case "group_typing" -> chat.typing(RoomKind.GROUP, session, msg, true);
            case "group_stop_typing" -> chat.typing(RoomKind.GROUP, session, msg, false);

            default -> throw new ValidationException("unknown event: " + type);
        }
    }
}
