package com.echoboard.realtime.handler;

import com.echoboard.realtime.broadcast.BroadcastRouter;
import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import com.echoboard.realtime.message.ClientMessage;
import com.echoboard.realtime.model.GroupRoom;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.room.RoomRegistry;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.session.ClientSession;
import com.echoboard.realtime.snapshot.RoomState;
import com.echoboard.realtime.snapshot.RoomStateSynthesizer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

@ApplicationScoped
public class GroupHandler {

    private final RoomResolver resolver;
    private final RoomRegistry registry;
    private final BroadcastRouter router;
    private final PresenceAnnouncer announcer;
    private final RoomStateSynthesizer synthesizer;

    @Inject
    public GroupHandler(RoomResolver resolver, RoomRegistry registry, BroadcastRouter router,
                        PresenceAnnouncer announcer, RoomStateSynthesizer synthesizer) {
        this.resolver = resolver;
        this.registry = registry;
        this.router = router;
        this.announcer = announcer;
        this.synthesizer = synthesizer;
    }

    public void join(ClientSession session, ClientMessage msg) {
        Identity me = session.requireIdentity();
        GroupRoom group = resolver.group(msg.slug());
        RoomKey key = RoomKey.group(group.slug());

        registry.withRoom(key, room -> {
            RoomState state = synthesizer.snapshot(key, me);
            router.sendTo(session.connection(), RoomKind.GROUP.snapshotEvent(), state);
            if (!session.track(key)) return 0;
            int count = room.admit(session.connection(), me.username(), me);
            announcer.presence(room);
            return count;
        });
    }
}
