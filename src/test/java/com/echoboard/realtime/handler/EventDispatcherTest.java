package com.echoboard.realtime.handler;

import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.testing.RealtimeFixture;
import com.echoboard.realtime.testing.TestClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventDispatcherTest {

    private final RealtimeFixture fx = new RealtimeFixture();

    @Test
    void malformedFrameIsValidationError() {
        TestClient client = fx.anonymous();

        client.sendRaw("{\"type\":");

        assertThat(client.lastError().path("kind").asText()).isEqualTo("validation");
        assertThat(client.lastError().path("message").asText()).isEqualTo("malformed message");
    }

    @Test
    void unknownEventIsValidationError() {
        TestClient client = fx.anonymous();

        client.send("teleport");

        assertThat(client.lastError().path("message").asText()).isEqualTo("unknown event: teleport");
    }

    @Test
    void missingTypeIsRejected() {
        TestClient client = fx.anonymous();

        client.sendRaw("{\"code\":\"abc\"}");

        assertThat(client.lastError().path("kind").asText()).isEqualTo("validation");
    }

    @Test
    void errorsGoOnlyToTheSender() {
        Board board = fx.board(null);
        TestClient alice = fx.anonymous();
        TestClient bob = fx.anonymous();
        alice.send("join_board", "code", board.code(), "clientName", "Alice");
        bob.send("join_board", "code", board.code(), "clientName", "Bob");
        bob.clear();

        alice.send("vote_card", "code", board.code());

        assertThat(alice.lastError().path("message").asText()).isEqualTo("missing cardId");
        assertThat(bob.types()).isEmpty();
    }

    @Test
    void connectionSurvivesErrors() {
        Board board = fx.board(null);
        TestClient alice = fx.anonymous();

        alice.send("join_board", "code", "zzzzzz");
        alice.send("join_board", "code", board.code(), "clientName", "Alice");

        assertThat(alice.types()).containsExactly("error", "board_state", "presence");
    }
}
