package com.echoboard.realtime.room;

import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.testing.RealtimeFixture;
import com.echoboard.realtime.testing.TestClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TypingSweeperTest {

    private final RealtimeFixture fx = new RealtimeFixture();

    @Test
    void staleTypingIsClearedAndRebroadcast() {
        Board board = fx.board(null);
        TestClient alice = fx.anonymous();
        TestClient bob = fx.anonymous();
        alice.send("join_board", "code", board.code(), "clientName", "Alice");
        bob.send("join_board", "code", board.code(), "clientName", "Bob");
        alice.send("typing", "code", board.code(), "author", "Alice");
        assertThat(bob.last("typing").path("authors")).hasSize(1);
        bob.clear();

        fx.clock.advance(Duration.ofSeconds(5));
        assertThat(fx.sweeper.sweep()).isZero();
        assertThat(bob.events("typing")).isEmpty();

        fx.clock.advance(Duration.ofSeconds(5));
        assertThat(fx.sweeper.sweep()).isEqualTo(1);
        assertThat(bob.last("typing").path("authors")).isEmpty();
    }

    @Test
    void sweepWithoutRoomsDoesNothing() {
        assertThat(fx.sweeper.sweep()).isZero();
    }
}
