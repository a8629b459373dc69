package com.echoboard.realtime.handler;

import com.echoboard.realtime.broadcast.BroadcastRouter;
import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import com.echoboard.realtime.error.ForbiddenException;
import com.echoboard.realtime.error.NotFoundException;
import com.echoboard.realtime.error.ValidationException;
import com.echoboard.realtime.message.ClientMessage;
import com.echoboard.realtime.message.MessageView;
import com.echoboard.realtime.message.ServerMessage.MessageRef;
import com.echoboard.realtime.message.ServerMessage.PinnedMessage;
import com.echoboard.realtime.message.ServerMessage.ReactionUpdate;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.NewMessage;
import com.echoboard.realtime.model.ReactionCount;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.model.UserAccount;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.room.RoomRegistry;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.ClientSession;
import com.echoboard.realtime.snapshot.MessageFormatter;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Chat operations shared by board chat, direct messages and group rooms. The {@link RoomKind}
 * picks the text limit, the outbound event names and the authorisation rule.
 *
 * <p>Every mutation is committed and broadcast while the room's lock is held.
 */
@ApplicationScoped
public class ChatHandler {

    private static final Logger LOG = Logger.getLogger(ChatHandler.class);

    static final String DEFAULT_CHANNEL = "general";

    private final StorageGateway storage;
    private final RoomResolver resolver;
    private final RoomRegistry registry;
    private final BroadcastRouter router;
    private final PresenceAnnouncer announcer;
    private final MessageFormatter formatter;
    private final AuditTrail audit;

    @Inject
    public ChatHandler(StorageGateway storage, RoomResolver resolver, RoomRegistry registry, BroadcastRouter router,
                       PresenceAnnouncer announcer, MessageFormatter formatter, AuditTrail audit) {
        this.storage = storage;
        this.resolver = resolver;
        this.registry = registry;
        this.router = router;
        this.announcer = announcer;
        this.formatter = formatter;
        this.audit = audit;
    }

    public void send(RoomKind kind, ClientSession session, ClientMessage msg) {
        Board board = kind == RoomKind.BOARD ? resolver.board(msg.code()) : null;
        NewMessage draft = switch (kind) {
            case BOARD -> boardDraft(board, session, msg);
            case DIRECT -> directDraft(session, msg);
            case GROUP -> groupDraft(session, msg);
        };

        ChatMessage created = registry.withRoom(draft.room(), room -> {
            ChatMessage inserted = storage.insertMessage(draft);
            router.deliver(room, kind.addedEvent(), formatter.message(inserted, List.of()), null);
            return inserted;
        });
        LOG.debugf("Message %d posted to %s", created.id(), draft.room());

        if (board != null) {
            audit.activity(board, session.identity().orElse(null), "message_posted",
                Map.of("message_id", created.id(), "channel", created.channel()));
        }
    }

    private NewMessage boardDraft(Board board, ClientSession session, ClientMessage msg) {
        Identity me = session.identity().orElse(null);
        String text = Inputs.clip(Inputs.required(msg.text(), "text"), RoomKind.BOARD.textLimit());
        String author = Inputs.clipOr(msg.author(), Inputs.NAME, me != null ? me.username() : BoardHandler.ANONYMOUS);
        return new NewMessage(RoomKey.board(board.code()), me != null ? me.userId() : null, author, null, text,
            Inputs.clipOr(msg.channel(), Inputs.CHANNEL, DEFAULT_CHANNEL), msg.replyTo(), msg.attachments(),
            Inputs.blankToNull(msg.voice()));
    }

    private NewMessage directDraft(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        String text = Inputs.clip(msg.text(), RoomKind.DIRECT.textLimit());
        String voice = Inputs.blankToNull(msg.voice());
        if (text.isEmpty() && voice == null) {
            throw new ValidationException("missing text");
        }
        UserAccount other = resolver.user(msg.to());
        return new NewMessage(RoomKey.direct(me.userId(), other.id()), me.userId(), me.username(), other.id(), text,
            null, msg.replyTo(), List.of(), voice);
    }

    private NewMessage groupDraft(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        String text = Inputs.clip(Inputs.required(msg.text(), "text"), RoomKind.GROUP.textLimit());
        var group = resolver.group(msg.slug());
        return new NewMessage(RoomKey.group(group.slug()), me.userId(), me.username(), null, text, null,
            msg.replyTo(), List.of(), null);
    }

    /** Toggles the caller's reaction and broadcasts the message's full tally. */
    public void react(RoomKind kind, ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        ChatMessage target = resolver.message(kind, msg.messageId());
        String emoji = Inputs.clip(Inputs.required(msg.emoji(), "emoji"), Inputs.EMOJI);
        Board board = kind == RoomKind.BOARD ? boardOf(target, msg) : null;
        if (kind == RoomKind.DIRECT && !RoomKey.of(kind, target.roomId()).hasParticipant(me.userId())) {
            throw ForbiddenException.noPermission();
        }

        registry.withRoom(RoomKey.of(kind, target.roomId()), room -> {
            resolver.message(kind, target.id());
            List<ReactionCount> tally = storage.toggleReaction(kind, target.id(), me.userId(), emoji);
            return router.deliver(room, kind.reactionsEvent(), new ReactionUpdate(target.id(), tally), null);
        });

        if (board != null) {
            audit.activity(board, me, "message_reaction", Map.of("message_id", target.id(), "emoji", emoji));
        }
    }

    public void edit(RoomKind kind, ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        ChatMessage target = resolver.message(kind, msg.messageId());
        String text = Inputs.clip(Inputs.required(msg.text(), "text"), kind.textLimit());
        Board board = kind == RoomKind.BOARD ? boardOf(target, msg) : null;
        authorizeAuthor(board, target, me);

        registry.withRoom(RoomKey.of(kind, target.roomId()), room -> {
            resolver.message(kind, target.id());
            ChatMessage edited = storage.setMessageEdited(kind, target.id(), text)
                .orElseThrow(() -> new NotFoundException("message not found"));
            return router.deliver(room, kind.updatedEvent(), view(kind, edited), null);
        });

        if (board != null) {
            audit.activity(board, me, "message_edit", Map.of("message_id", target.id()));
        }
    }

    public void delete(RoomKind kind, ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        ChatMessage target = resolver.message(kind, msg.messageId());
        Board board = kind == RoomKind.BOARD ? boardOf(target, msg) : null;
        authorizeAuthor(board, target, me);

        registry.withRoom(RoomKey.of(kind, target.roomId()), room -> {
            resolver.message(kind, target.id());
            storage.setMessageDeleted(kind, target.id())
                .orElseThrow(() -> new NotFoundException("message not found"));
            return router.deliver(room, kind.deletedEvent(), new MessageRef(target.id()), null);
        });

        if (board != null) {
            audit.activity(board, me, "message_delete", Map.of("message_id", target.id()));
        }
    }

    /** Board chat only: moderators and owners toggle the pinned flag. */
    public void pin(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        ChatMessage target = resolver.message(RoomKind.BOARD, msg.messageId());
        Board board = boardOf(target, msg);
        if (!resolver.role(board, me).atLeast(Role.MODERATOR)) {
            throw ForbiddenException.noPermission();
        }

        ChatMessage pinned = registry.withRoom(RoomKey.board(board.code()), room -> {
            resolver.message(RoomKind.BOARD, target.id());
            ChatMessage toggled = storage.toggleMessagePinned(target.id())
                .orElseThrow(() -> new NotFoundException("message not found"));
            router.deliver(room, "chat_pinned", new PinnedMessage(view(RoomKind.BOARD, toggled)), null);
            return toggled;
        });
        audit.activity(board, me, "message_pin", Map.of("message_id", pinned.id(), "pinned", pinned.pinned()));
    }

    /**
     * Sets or clears the caller's typing flag and sends the room's author list to everyone else.
     * Connections that have not joined the room are ignored.
     */
    public void typing(RoomKind kind, ClientSession session, ClientMessage msg, boolean active) {
        RoomKey key;
        String name;
        switch (kind) {
            case BOARD -> {
                Identity me = session.identity().orElse(null);
                key = RoomKey.board(Inputs.required(msg.code(), "code"));
                name = Inputs.clipOr(msg.author(), Inputs.NAME, me != null ? me.username() : BoardHandler.ANONYMOUS);
            }
            case DIRECT -> {
                Identity me = session.requireIdentity();
                UserAccount other = resolver.user(msg.to());
                key = RoomKey.direct(me.userId(), other.id());
                name = me.username();
            }
            case GROUP -> {
                Identity me = session.requireIdentity();
                key = RoomKey.group(Inputs.required(msg.slug(), "slug"));
                name = me.username();
            }
            default -> throw new IllegalArgumentException("Unknown room kind " + kind);
        }

        Instant now = registry.now();
        String typingName = active ? name : null;
        registry.withExistingRoom(key, room -> {
            if (room.setTyping(session.id(), typingName, now)) {
                announcer.typing(room, session.id());
            }
            return null;
        });
    }

    private Board boardOf(ChatMessage message, ClientMessage msg) {
        if (msg.code() != null && !msg.code().isBlank() && !msg.code().strip().equals(message.roomId())) {
            throw new NotFoundException("message not found");
        }
        return resolver.board(message.roomId());
    }

    // Board chat: author or moderator+. Direct and group: author only.
    private void authorizeAuthor(Board board, ChatMessage message, Identity me) {
        if (message.isAuthoredBy(me.userId())) return;
        if (board != null && resolver.role(board, me).atLeast(Role.MODERATOR)) return;
        throw ForbiddenException.noPermission();
    }

    private MessageView view(RoomKind kind, ChatMessage message) {
        List<ReactionCount> reactions = storage.listReactions(kind, List.of(message.id()))
            .getOrDefault(message.id(), List.of());
        return formatter.message(message, reactions);
    }
}
