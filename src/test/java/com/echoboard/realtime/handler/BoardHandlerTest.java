package com.echoboard.realtime.handler;

import com.echoboard.realtime.model.ActivityEntry;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.NewCard;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.testing.RealtimeFixture;
import com.echoboard.realtime.testing.TestClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BoardHandlerTest {

    private RealtimeFixture fx;
    private Board board;
    private TestClient alice;
    private TestClient bob;

    @BeforeEach
    void setUp() {
        fx = new RealtimeFixture();
        board = fx.board(null);
        alice = fx.anonymous();
        bob = fx.anonymous();
        alice.send("join_board", "code", board.code(), "clientName", "Alice");
        bob.send("join_board", "code", board.code(), "clientName", "Bob");
        alice.clear();
        bob.clear();
    }

    @Test
    void firstCardStartsAtZeroAndVotesAccumulate() {
        alice.send("create_card", "code", board.code(), "author", "Alice", "text", "Ship it", "tag", "idea");

        JsonNode added = bob.last("card_added");
        assertThat(added.path("votes").asInt()).isZero();
        assertThat(added.path("order_index").asInt()).isZero();
        long cardId = added.path("id").asLong();

        alice.send("vote_card", "code", board.code(), "cardId", cardId);
        bob.send("vote_card", "code", board.code(), "cardId", cardId);

        assertThat(alice.events("card_updated")).extracting(n -> n.path("votes").asInt()).containsExactly(1, 2);
        assertThat(fx.storage.listCards(board.id()).get(0).votes()).isEqualTo(2);
    }

    @Test
    void reorderWritesListPositions() {
        Card c1 = fx.storage.insertCard(board.id(), new NewCard("A", "one", "", null));
        Card c2 = fx.storage.insertCard(board.id(), new NewCard("A", "two", "", null));
        Card c3 = fx.storage.insertCard(board.id(), new NewCard("A", "three", "", null));

        alice.send("reorder_cards", "code", board.code(), "order", List.of(c3.id(), c1.id(), c2.id()));

        Map<Long, Integer> indexById = new HashMap<>();
        fx.storage.listCards(board.id()).forEach(c -> indexById.put(c.id(), c.orderIndex()));
        assertThat(indexById).containsEntry(c3.id(), 0).containsEntry(c1.id(), 1).containsEntry(c2.id(), 2);
        assertThat(bob.last("cards_reordered").path("order"))
            .extracting(JsonNode::asLong).containsExactly(c3.id(), c1.id(), c2.id());
    }

    @Test
    void cardTextIsTruncatedNotRejected() {
        alice.send("create_card", "code", board.code(), "author", "A".repeat(40), "text", "x".repeat(400),
            "tag", "t".repeat(30));

        JsonNode added = bob.last("card_added");
        assertThat(added.path("text").asText()).hasSize(280);
        assertThat(added.path("author").asText()).hasSize(32);
        assertThat(added.path("tag").asText()).hasSize(16);
    }

    @Test
    void cardWithoutTextIsRejectedPrivately() {
        alice.send("create_card", "code", board.code(), "author", "Alice", "text", "  ");

        assertThat(alice.lastError().path("kind").asText()).isEqualTo("validation");
        assertThat(bob.types()).isEmpty();
    }

    @Test
    void unknownBoardIsNotFound() {
        alice.send("create_card", "code", "nope00", "text", "hi");

        assertThat(alice.lastError().path("kind").asText()).isEqualTo("not_found");
    }

    @Test
    void voteOnUnknownCardIsNotFound() {
        alice.send("vote_card", "code", board.code(), "cardId", 404);

        assertThat(alice.lastError().path("kind").asText()).isEqualTo("not_found");
        assertThat(bob.events("card_updated")).isEmpty();
    }

    @Test
    void themeChangesAreValidated() {
        alice.send("set_theme", "code", board.code(), "theme", " Sunset ");
        assertThat(bob.last("theme_changed").path("theme").asText()).isEqualTo("sunset");

        alice.send("set_theme", "code", board.code(), "theme", "neon");
        assertThat(alice.lastError().path("kind").asText()).isEqualTo("validation");
        assertThat(fx.storage.findBoardByCode(board.code()).orElseThrow().theme()).isEqualTo("sunset");

        alice.send("set_theme", "code", board.code());
        assertThat(bob.last("theme_changed").path("theme").asText()).isEqualTo("ocean");
    }

    @Test
    void blankTitleFallsBack() {
        alice.send("set_title", "code", board.code(), "title", "   ");

        assertThat(bob.last("title_changed").path("title").asText()).isEqualTo("Team Board");
        assertThat(fx.storage.findBoardByCode(board.code()).orElseThrow().title()).isEqualTo("Team Board");
    }

    @Test
    void cursorGoesToOthersOnly() {
        alice.send("cursor_move", "code", board.code(), "author", "Alice", "pos", Map.of("x", 0.4, "y", 0.6),
            "color", "#0af");

        JsonNode cursors = bob.last("cursors");
        assertThat(cursors).hasSize(1);
        assertThat(cursors.get(0).path("x").asDouble()).isEqualTo(0.4);
        assertThat(alice.events("cursors")).isEmpty();
    }

    @Test
    void cursorFromNonMemberIsIgnored() {
        TestClient outsider = fx.anonymous();

        outsider.send("cursor_move", "code", board.code(), "author", "Eve", "pos", Map.of("x", 0.1, "y", 0.1));

        assertThat(bob.events("cursors")).isEmpty();
        assertThat(outsider.types()).isEmpty();
    }

    @Test
    void identifiedJoinAddsMemberAndPresenceHistory() {
        Identity carol = fx.user("u3", "carol");
        TestClient client = fx.connect(carol);

        client.send("join_board", "code", board.code(), "clientName", "Carol");

        assertThat(fx.storage.getMemberRole(board.id(), "u3")).contains(Role.MEMBER);
        assertThat(client.last("board_state").path("role").asText()).isEqualTo("member");
        assertThat(fx.storage.listPresenceHistory(board.id(), 5).get(0).details()).isEqualTo("Carol");
        assertThat(bob.last("presence").path("count").asInt()).isEqualTo(3);
    }

    @Test
    void createBoardMakesCreatorOwner() {
        Identity dana = fx.user("u4", "dana");
        TestClient client = fx.connect(dana);

        client.send("create_board", "title", "Planning", "theme", "mint");

        String code = client.last("board_created").path("code").asText();
        Board created = fx.storage.findBoardByCode(code).orElseThrow();
        assertThat(created.title()).isEqualTo("Planning");
        assertThat(created.theme()).isEqualTo("mint");
        assertThat(fx.storage.getMemberRole(created.id(), "u4")).contains(Role.OWNER);
    }

    @Test
    void invitesNeedModeratorAndExpire() {
        Identity owner = fx.user("u1", "olga");
        Board owned = fx.board("u1");
        Identity member = fx.user("u2", "max");
        fx.storage.ensureMember(owned.id(), "u2", Role.MEMBER);
        TestClient ownerClient = fx.connect(owner);
        TestClient memberClient = fx.connect(member);

        memberClient.send("create_invite", "code", owned.code());
        assertThat(memberClient.lastError().path("message").asText()).isEqualTo("no permission");

        ownerClient.send("create_invite", "code", owned.code());
        String token = ownerClient.last("invite_created").path("token").asText();

        TestClient guest = fx.connect(fx.user("u5", "gus"));
        guest.send("redeem_invite", "token", token);
        assertThat(guest.last("invite_redeemed").path("code").asText()).isEqualTo(owned.code());
        assertThat(fx.storage.getMemberRole(owned.id(), "u5")).contains(Role.MEMBER);

        ownerClient.send("create_invite", "code", owned.code());
        String late = ownerClient.last("invite_created").path("token").asText();
        fx.clock.advance(Duration.ofDays(8));
        TestClient tardy = fx.connect(fx.user("u6", "tara"));
        tardy.send("redeem_invite", "token", late);
        assertThat(tardy.lastError().path("message").asText()).isEqualTo("invite expired");
        assertThat(fx.storage.getMemberRole(owned.id(), "u6")).isEmpty();
    }

    @Test
    void anonymousCannotRedeemInvites() {
        alice.send("redeem_invite", "token", "whatever");

        assertThat(alice.lastError().path("message").asText()).isEqualTo("auth required");
    }

    @Test
    void onlyOwnerChangesRoles() {
        Identity owner = fx.user("u1", "olga");
        Board owned = fx.board("u1");
        Identity mod = fx.user("u2", "mia");
        fx.user("u3", "ned");
        fx.storage.setMemberRole(owned.id(), "u2", Role.MODERATOR);
        fx.storage.ensureMember(owned.id(), "u3", Role.MEMBER);
        TestClient ownerClient = fx.connect(owner);
        TestClient modClient = fx.connect(mod);
        modClient.send("join_board", "code", owned.code(), "clientName", "Mia");

        modClient.send("set_role", "code", owned.code(), "username", "ned", "role", "moderator");
        assertThat(modClient.lastError().path("kind").asText()).isEqualTo("forbidden");

        ownerClient.send("set_role", "code", owned.code(), "username", "ned", "role", "moderator");
        assertThat(fx.storage.getMemberRole(owned.id(), "u3")).contains(Role.MODERATOR);
        assertThat(modClient.last("members_updated").path("members")).hasSize(3);

        ownerClient.send("set_role", "code", owned.code(), "username", "ned", "role", "owner");
        assertThat(ownerClient.lastError().path("message").asText()).isEqualTo("invalid role");
    }

    @Test
    void boardActivityIsLogged() {
        alice.send("create_card", "code", board.code(), "author", "Alice", "text", "note");
        alice.send("set_title", "code", board.code(), "title", "Sprint 9");

        assertThat(fx.storage.listActivity(board.id(), 25)).extracting(ActivityEntry::kind)
            .containsExactly("title_changed", "card_created");
    }
}
