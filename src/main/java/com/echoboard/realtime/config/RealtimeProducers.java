package com.echoboard.realtime.config;

import com.echoboard.realtime.store.InMemoryStorageGateway;
import com.echoboard.realtime.store.RestStorageGateway;
import com.echoboard.realtime.store.StorageGateway;
import com.echoboard.realtime.store.client.BoardStoreClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.Locale;

@ApplicationScoped
public class RealtimeProducers {

    private static final Logger LOG = Logger.getLogger(RealtimeProducers.class);

    @ConfigProperty(name = "echoboard.storage.provider", defaultValue = "memory")
    String provider;

    @Inject
    @RestClient
    Instance<BoardStoreClient> boardStore;

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Storage backend, selected by {@code echoboard.storage.provider}: {@code memory} or {@code rest}.
     */
    @Produces
    @ApplicationScoped
    StorageGateway storageGateway(Clock clock) {
        LOG.infof("Using %s storage", provider);
        return switch (provider.toLowerCase(Locale.ROOT)) {
            case "memory" -> new InMemoryStorageGateway(clock);
            case "rest" -> new RestStorageGateway(boardStore.get());
            default -> throw new IllegalStateException("Unknown storage provider: " + provider);
        };
    }
}
