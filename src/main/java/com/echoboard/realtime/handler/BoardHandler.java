package com.echoboard.realtime.handler;

import com.echoboard.realtime.broadcast.BroadcastRouter;
import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import com.echoboard.realtime.error.ForbiddenException;
import com.echoboard.realtime.error.NotFoundException;
import com.echoboard.realtime.error.ValidationException;
import com.echoboard.realtime.message.ClientMessage;
import com.echoboard.realtime.message.ServerMessage.BoardCreated;
import com.echoboard.realtime.message.ServerMessage.CardOrder;
import com.echoboard.realtime.message.ServerMessage.InviteCreated;
import com.echoboard.realtime.message.ServerMessage.InviteRedeemed;
import com.echoboard.realtime.message.ServerMessage.MembersUpdate;
import com.echoboard.realtime.message.ServerMessage.ThemeChange;
import com.echoboard.realtime.message.ServerMessage.TitleChange;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.Invite;
import com.echoboard.realtime.model.NewCard;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.model.UserAccount;
import com.echoboard.realtime.room.CursorPosition;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.room.RoomRegistry;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.ClientSession;
import com.echoboard.realtime.session.SessionManager;
import com.echoboard.realtime.snapshot.MessageFormatter;
import com.echoboard.realtime.snapshot.RoomState;
import com.echoboard.realtime.snapshot.RoomStateSynthesizer;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Board events: joining and leaving, cards, theme and title, cursors, invites and roles.
 */
@ApplicationScoped
public class BoardHandler {

    private static final Logger LOG = Logger.getLogger(BoardHandler.class);

    static final Set<String> THEMES = Set.of("ocean", "mint", "sunset", "violet", "slate");
    static final String DEFAULT_THEME = "ocean";
    static final String DEFAULT_TITLE = "Team Board";
    static final String ANONYMOUS = "Anon";

    private final StorageGateway storage;
    private final RoomResolver resolver;
    private final RoomRegistry registry;
    private final BroadcastRouter router;
    private final PresenceAnnouncer announcer;
    private final RoomStateSynthesizer synthesizer;
    private final SessionManager sessions;
    private final MessageFormatter formatter;
    private final AuditTrail audit;
    private final Duration inviteTtl;

    @Inject
    public BoardHandler(StorageGateway storage, RoomResolver resolver, RoomRegistry registry, BroadcastRouter router,
                        PresenceAnnouncer announcer, RoomStateSynthesizer synthesizer, SessionManager sessions,
                        MessageFormatter formatter, AuditTrail audit,
                        @ConfigProperty(name = "echoboard.invite.ttl", defaultValue = "P7D") Duration inviteTtl) {
        this.storage = storage;
        this.resolver = resolver;
        this.registry = registry;
        this.router = router;
        this.announcer = announcer;
        this.synthesizer = synthesizer;
        this.sessions = sessions;
        this.formatter = formatter;
        this.audit = audit;
        this.inviteTtl = inviteTtl;
    }

    public void createBoard(ClientSession session, ClientMessage msg) {
        Identity me = session.identity().orElse(null);
        String title = Inputs.clipOr(msg.title(), Inputs.TITLE, DEFAULT_TITLE);
        Board board = storage.createBoard(me != null ? me.userId() : null, title, theme(msg.theme()));
        LOG.infof("Board %s created by %s", board.code(), me != null ? me.userId() : "anonymous");
        router.sendTo(session.connection(), "board_created", new BoardCreated(board.code(), board.title()));
    }

    /**
     * Sends the board snapshot privately, then admits the connection and announces presence, all
     * under the room's lock so the joiner sees no broadcast that predates its snapshot.
     */
    public void join(ClientSession session, ClientMessage msg) {
        Board board = resolver.board(msg.code());
        Identity me = session.identity().orElse(null);
        String name = Inputs.clipOr(msg.clientName(), Inputs.NAME, ANONYMOUS);
        if (me != null) {
            storage.ensureMember(board.id(), me.userId(), Role.MEMBER);
        }

        RoomKey key = RoomKey.board(board.code());
        int members = registry.withRoom(key, room -> {
            RoomState state = synthesizer.snapshot(key, me);
            router.sendTo(session.connection(), RoomKind.BOARD.snapshotEvent(), state);
            if (!session.track(key)) return 0;
            int count = room.admit(session.connection(), name, me);
            announcer.presence(room);
            return count;
        });
        LOG.debugf("%s joined %s (%d members)", session.id(), key, members);

        if (me != null) {
            audit.presence(board, me, "join", name);
        }
    }

    public void leave(ClientSession session, ClientMessage msg) {
        RoomKey key = RoomKey.board(Inputs.required(msg.code(), "code"));
        sessions.leave(session, key);
    }

    public void createCard(ClientSession session, ClientMessage msg) {
        Board board = resolver.board(msg.code());
        Identity me = session.identity().orElse(null);
        String text = Inputs.clip(Inputs.required(msg.text(), "text"), Inputs.CARD_TEXT);
        String author = Inputs.clipOr(msg.author(), Inputs.NAME, me != null ? me.username() : ANONYMOUS);
        var draft = new NewCard(author, text, Inputs.clip(msg.tag(), Inputs.TAG), Inputs.blankToNull(msg.attachment()));

        Card card = registry.withRoom(RoomKey.board(board.code()), room -> {
            Card created = storage.insertCard(board.id(), draft);
            router.deliver(room, "card_added", formatter.card(created), null);
            return created;
        });
        audit.activity(board, me, "card_created", Map.of("card_id", card.id(), "text", card.text()));
    }

    public void vote(ClientSession session, ClientMessage msg) {
        Board board = resolver.board(msg.code());
        long cardId = Inputs.required(msg.cardId(), "cardId");

        registry.withRoom(RoomKey.board(board.code()), room -> {
            Card voted = storage.incrementCardVotes(board.id(), cardId)
                .orElseThrow(() -> new NotFoundException("card not found"));
            router.deliver(room, "card_updated", formatter.card(voted), null);
            return voted;
        });
        audit.activity(board, session.identity().orElse(null), "card_voted", Map.of("card_id", cardId));
    }

    public void reorder(ClientSession session, ClientMessage msg) {
        Board board = resolver.board(msg.code());
        if (msg.order() == null || msg.order().isEmpty()) {
            throw new ValidationException("missing order");
        }
        List<Long> order = msg.order().stream().filter(id -> id != null).toList();

        registry.withRoom(RoomKey.board(board.code()), room -> {
            storage.updateCardOrder(board.id(), order);
            return router.deliver(room, "cards_reordered", new CardOrder(order), null);
        });
    }

    public void setTheme(ClientSession session, ClientMessage msg) {
        String theme = theme(msg.theme());
        Board board = resolver.board(msg.code());

        registry.withRoom(RoomKey.board(board.code()), room -> {
            storage.updateBoardTheme(board.id(), theme).orElseThrow(() -> new NotFoundException("board not found"));
            return router.deliver(room, "theme_changed", new ThemeChange(theme), null);
        });
        audit.activity(board, session.identity().orElse(null), "theme_changed", Map.of("theme", theme));
    }

    public void setTitle(ClientSession session, ClientMessage msg) {
        Board board = resolver.board(msg.code());
        String title = Inputs.clipOr(msg.title(), Inputs.TITLE, DEFAULT_TITLE);

        registry.withRoom(RoomKey.board(board.code()), room -> {
            storage.updateBoardTitle(board.id(), title).orElseThrow(() -> new NotFoundException("board not found"));
            return router.deliver(room, "title_changed", new TitleChange(title), null);
        });
        audit.activity(board, session.identity().orElse(null), "title_changed", Map.of("title", title));
    }

    public void moveCursor(ClientSession session, ClientMessage msg) {
        RoomKey key = RoomKey.board(Inputs.required(msg.code(), "code"));
        if (msg.pos() == null) {
            throw new ValidationException("missing pos");
        }
        var position = new CursorPosition(Inputs.clipOr(msg.author(), Inputs.NAME, ANONYMOUS),
            msg.pos().x(), msg.pos().y(), Inputs.blankToNull(msg.color()));

        registry.withExistingRoom(key, room -> {
            if (room.setCursor(session.id(), position)) {
                announcer.cursors(room, session.id());
            }
            return null;
        });
    }

    public void createInvite(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        Board board = resolver.board(msg.code());
        if (!resolver.role(board, me).atLeast(Role.MODERATOR)) {
            throw ForbiddenException.noPermission();
        }
        Invite invite = storage.createInvite(board.id(), me.userId(), inviteTtl);
        router.sendTo(session.connection(), "invite_created",
            new InviteCreated(invite.token(), board.code(), invite.expiresAt()));
    }

    public void redeemInvite(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        Invite invite = storage.findInvite(Inputs.required(msg.token(), "token"))
            .orElseThrow(() -> new NotFoundException("invite not found"));
        if (invite.isExpired(registry.now())) {
            throw new ValidationException("invite expired");
        }
        storage.ensureMember(invite.boardId(), me.userId(), Role.MEMBER);
        router.sendTo(session.connection(), "invite_redeemed", new InviteRedeemed(invite.boardCode()));

        registry.withExistingRoom(RoomKey.board(invite.boardCode()), room ->
            router.deliver(room, "members_updated", new MembersUpdate(storage.listMembers(invite.boardId())), null));
    }

    public void setRole(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        Board board = resolver.board(msg.code());
        if (resolver.role(board, me) != Role.OWNER) {
            throw ForbiddenException.noPermission();
        }
        Role role = Role.parse(msg.role())
            .filter(r -> r != Role.OWNER)
            .orElseThrow(() -> new ValidationException("invalid role"));
        UserAccount target = resolver.user(msg.username());
        if (target.id().equals(me.userId())) {
            throw new ValidationException("cannot change own role");
        }

        registry.withRoom(RoomKey.board(board.code()), room -> {
            storage.setMemberRole(board.id(), target.id(), role);
            return router.deliver(room, "members_updated", new MembersUpdate(storage.listMembers(board.id())), null);
        });
        LOG.infof("%s set role of %s on %s to %s", me.userId(), target.id(), board.code(), role.wireName());
    }

    private static String theme(String requested) {
        String theme = requested == null || requested.isBlank()
            ? DEFAULT_THEME
            : requested.strip().toLowerCase(Locale.ROOT);
        if (!THEMES.contains(theme)) {
            throw new ValidationException("invalid theme");
        }
        return theme;
    }
}
