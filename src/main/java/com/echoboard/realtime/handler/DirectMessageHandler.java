package com.echoboard.realtime.handler;

import com.echoboard.realtime.broadcast.BroadcastRouter;
import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import com.echoboard.realtime.error.ForbiddenException;
import com.echoboard.realtime.error.NotFoundException;
import com.echoboard.realtime.message.ClientMessage;
import com.echoboard.realtime.message.ServerMessage.DirectPresence;
import com.echoboard.realtime.message.ServerMessage.MessageRef;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.UserAccount;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.room.RoomRegistry;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.ClientSession;
import com.echoboard.realtime.session.SessionManager;
import com.echoboard.realtime.snapshot.RoomState;
import com.echoboard.realtime.snapshot.RoomStateSynthesizer;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

@ApplicationScoped
public class DirectMessageHandler {

    private static final Logger LOG = Logger.getLogger(DirectMessageHandler.class);

    private final StorageGateway storage;
    private final RoomResolver resolver;
    private final RoomRegistry registry;
    private final BroadcastRouter router;
    private final PresenceAnnouncer announcer;
    private final RoomStateSynthesizer synthesizer;
    private final SessionManager sessions;

    @Inject
    public DirectMessageHandler(StorageGateway storage, RoomResolver resolver, RoomRegistry registry,
                                BroadcastRouter router, PresenceAnnouncer announcer,
                                RoomStateSynthesizer synthesizer, SessionManager sessions) {
        this.storage = storage;
        this.resolver = resolver;
        this.registry = registry;
        this.router = router;
        this.announcer = announcer;
        this.synthesizer = synthesizer;
        this.sessions = sessions;
    }

    /**
     * Opens the conversation with {@code other}: marks the caller's unread inbound messages read,
     * sends the history and the peer's online flag, then admits the caller and tells the peer.
     */
    public void join(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        UserAccount other = resolver.user(msg.other());
        RoomKey key = RoomKey.direct(me.userId(), other.id());

        registry.withRoom(key, room -> {
            List<Long> read = storage.markConversationRead(me.userId(), other.id());
            RoomState state = synthesizer.snapshot(key, me);
            router.sendTo(session.connection(), RoomKind.DIRECT.snapshotEvent(), state);
            router.sendTo(session.connection(), RoomKind.DIRECT.presenceEvent(),
                new DirectPresence(other.username(), sessions.isOnline(other.id())));
            if (!session.track(key)) return null;

            room.admit(session.connection(), me.username(), me);
            for (Long id : read) {
                router.deliver(room, "dm_read", new MessageRef(id), session.id());
            }
            announcer.directPresence(room, me.username(), true, session.id());
            return null;
        });
        LOG.debugf("%s opened %s", session.id(), key);
    }

    /** Read receipt for one message; only its receiver may send it. */
    public void markRead(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        ChatMessage target = resolver.message(RoomKind.DIRECT, msg.messageId());
        if (!me.userId().equals(target.recipientId())) {
            throw ForbiddenException.noPermission();
        }

        registry.withRoom(RoomKey.of(RoomKind.DIRECT, target.roomId()), room -> {
            ChatMessage read = storage.markDirectMessageRead(target.id(), me.userId())
                .orElseThrow(() -> new NotFoundException("message not found"));
            return router.deliver(room, "dm_read", new MessageRef(read.id()), null);
        });
    }
}
