package com.echoboard.realtime.room;

import com.echoboard.realtime.broadcast.PresenceAnnouncer;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;

/**
 * Clears typing flags whose client never sent a stop, and re-broadcasts the author list of
 * every room that changed.
 */
@ApplicationScoped
public class TypingSweeper {

    private static final Logger LOG = Logger.getLogger(TypingSweeper.class);

    private final RoomRegistry registry;
    private final PresenceAnnouncer announcer;
    private final Duration timeout;

    @Inject
    public TypingSweeper(RoomRegistry registry, PresenceAnnouncer announcer,
                         @ConfigProperty(name = "echoboard.typing.timeout", defaultValue = "PT8S") Duration timeout) {
        this.registry = registry;
        this.announcer = announcer;
        this.timeout = timeout;
    }

    @Scheduled(every = "${echoboard.typing.sweep-interval:2s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledSweep() {
        sweep();
    }

    /** Returns the number of rooms whose typing state changed. */
    public int sweep() {
        Instant cutoff = registry.now().minus(timeout);
        int changed = 0;
        for (RoomKey key : registry.roomKeys()) {
            boolean expired = registry.withExistingRoom(key, room -> {
                if (!room.expireTyping(cutoff)) return false;
                announcer.typing(room, null);
                return true;
            }).orElse(false);
            if (expired) changed++;
        }
        if (changed > 0) {
            LOG.debugf("Expired typing state in %d rooms", changed);
        }
        return changed;
    }
}
