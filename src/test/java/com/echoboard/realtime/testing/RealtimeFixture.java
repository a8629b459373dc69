package com.echoboard.realtime.testing;

import com.echoboard.realtime.broadcast.BroadcastRouter;
import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import com.echoboard.realtime.handler.AuditTrail;
import com.echoboard.realtime.handler.BoardHandler;
import com.echoboard.realtime.handler.ChatHandler;
import com.echoboard.realtime.handler.DirectMessageHandler;
import com.echoboard.realtime.handler.EventDispatcher;
import com.echoboard.realtime.handler.GroupHandler;
import com.echoboard.realtime.handler.RoomResolver;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.room.RoomRegistry;
import com.echoboard.realtime.room.TypingSweeper;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.ClientSession;
import com.echoboard.realtime.session.SessionManager;
import com.echoboard.realtime.snapshot.MessageFormatter;
import com.echoboard.realtime.snapshot.RoomStateSynthesizer;
import com.echoboard.realtime.store.InMemoryStorageGateway;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The realtime layer wired by hand over the in-memory store.
 */
public class RealtimeFixture {

    public final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
    public final InMemoryStorageGateway storage = new InMemoryStorageGateway(clock);
    public final RoomRegistry registry = new RoomRegistry(clock);
    public final BroadcastRouter router = new BroadcastRouter(registry);
    public final PresenceAnnouncer announcer = new PresenceAnnouncer(router);
    public final SessionManager sessions = new SessionManager(registry, announcer, storage);
    public final MessageFormatter formatter = new MessageFormatter("/files/board/", "/files/voice/");
    public final RoomStateSynthesizer synthesizer =
        new RoomStateSynthesizer(storage, formatter, sessions, 200, 25, 25, 100, 120);
    public final RoomResolver resolver = new RoomResolver(storage);
    public final AuditTrail audit = new AuditTrail(storage);
    public final BoardHandler boards = new BoardHandler(storage, resolver, registry, router, announcer, synthesizer,
        sessions, formatter, audit, Duration.ofDays(7));
    public final ChatHandler chat = new ChatHandler(storage, resolver, registry, router, announcer, formatter, audit);
    public final DirectMessageHandler directMessages =
        new DirectMessageHandler(storage, resolver, registry, router, announcer, synthesizer, sessions);
    public final GroupHandler groups = new GroupHandler(resolver, registry, router, announcer, synthesizer);
    public final EventDispatcher dispatcher = new EventDispatcher(boards, chat, directMessages, groups, router);
    public final TypingSweeper sweeper = new TypingSweeper(registry, announcer, Duration.ofSeconds(8));

    private final AtomicInteger connectionSeq = new AtomicInteger();

    public Identity user(String id, String username) {
        storage.registerUser(id, username);
        return new Identity(id, username);
    }

    public TestClient connect(Identity identity) {
        var connection = new RecordingConnection("conn-" + connectionSeq.incrementAndGet());
        ClientSession session = sessions.onConnect(connection, identity);
        return new TestClient(session, connection, dispatcher);
    }

    public TestClient anonymous() {
        return connect(null);
    }

    public Board board(String ownerId) {
        return storage.createBoard(ownerId, "Retro", "ocean");
    }
}
