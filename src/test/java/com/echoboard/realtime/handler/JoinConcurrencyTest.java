package com.echoboard.realtime.handler;

import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.room.Room;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.testing.RealtimeFixture;
import com.echoboard.realtime.testing.TestClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JoinConcurrencyTest {

    private static final int ROUNDS = 30;
    private static final int JOINERS = 3;
    private static final int SENDS = 100;

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(JOINERS + 1);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void joinRacingChatSeesEachMessageExactlyOnce() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            var fx = new RealtimeFixture();
            Board board = fx.board(null);
            TestClient sender = fx.anonymous();
            List<TestClient> joiners = new ArrayList<>();
            for (int i = 0; i < JOINERS; i++) {
                joiners.add(fx.anonymous());
            }

            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < SENDS; i++) {
                    sender.send("send_chat", "code", board.code(), "author", "Sam", "text", "m" + i);
                }
                return null;
            }));
            for (TestClient joiner : joiners) {
                futures.add(pool.submit(() -> {
                    start.await();
                    joiner.send("join_board", "code", board.code(), "clientName", "J");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }

            for (TestClient joiner : joiners) {
                assertThat(joiner.events("error")).isEmpty();
                assertThat(joiner.types().get(0)).isEqualTo("board_state");

                List<Long> snapshotIds = new ArrayList<>();
                for (JsonNode message : joiner.last("board_state").path("messages")) {
                    snapshotIds.add(message.path("id").asLong());
                }
                List<Long> liveIds = new ArrayList<>();
                for (JsonNode added : joiner.events("chat_added")) {
                    liveIds.add(added.path("id").asLong());
                }
                if (!snapshotIds.isEmpty() && !liveIds.isEmpty()) {
                    assertThat(liveIds.get(0)).isGreaterThan(snapshotIds.get(snapshotIds.size() - 1));
                }
                assertThat(liveIds).isSorted();

                List<Long> seen = new ArrayList<>(snapshotIds);
                seen.addAll(liveIds);
                assertThat(seen).hasSize(SENDS).doesNotHaveDuplicates();
            }
        }
    }

    @Test
    void disconnectRacingJoinLeavesNoMember() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            var fx = new RealtimeFixture();
            Board board = fx.board(null);
            RoomKey key = RoomKey.board(board.code());
            TestClient observer = fx.anonymous();
            observer.send("join_board", "code", board.code(), "clientName", "Obs");
            TestClient leaver = fx.anonymous();

            CountDownLatch start = new CountDownLatch(1);
            Future<?> join = pool.submit(() -> {
                start.await();
                leaver.send("join_board", "code", board.code(), "clientName", "Gone");
                return null;
            });
            Future<?> disconnect = pool.submit(() -> {
                start.await();
                fx.sessions.onDisconnect(leaver.id());
                return null;
            });
            start.countDown();
            join.get(10, TimeUnit.SECONDS);
            disconnect.get(10, TimeUnit.SECONDS);

            assertThat(leaver.session().rooms()).isEmpty();
            assertThat(fx.registry.withExistingRoom(key, room -> room.isMember(leaver.id()))).contains(false);
            assertThat(fx.registry.withExistingRoom(key, Room::memberCount)).contains(1);
            assertThat(observer.last("presence").path("count").asInt()).isEqualTo(1);
        }
    }
}
