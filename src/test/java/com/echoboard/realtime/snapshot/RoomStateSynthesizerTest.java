package com.echoboard.realtime.snapshot;

import com.echoboard.realtime.error.ForbiddenException;
import com.echoboard.realtime.error.NotFoundException;
import com.echoboard.realtime.message.CardView;
import com.echoboard.realtime.message.MessageView;
import com.echoboard.realtime.model.Attachment;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.NewCard;
import com.echoboard.realtime.model.NewMessage;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.room.RoomKey;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.testing.RealtimeFixture;
import com.echoboard.realtime.testing.TestClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomStateSynthesizerTest {

    private RealtimeFixture fx;
    private Identity owner;
    private Board board;
    private RoomKey key;

    @BeforeEach
    void setUp() {
        fx = new RealtimeFixture();
        owner = fx.user("u1", "alice");
        board = fx.board("u1");
        key = RoomKey.board(board.code());
    }

    @Test
    void twoJoinersWithNoInterveningWritesGetIdenticalSnapshots() {
        fx.storage.insertCard(board.id(), new NewCard("A", "first", "", null));
        post("hello", "general");
        TestClient first = fx.anonymous();
        TestClient second = fx.anonymous();

        first.send("join_board", "code", board.code(), "clientName", "One");
        second.send("join_board", "code", board.code(), "clientName", "Two");

        assertThat(second.last("board_state")).isEqualTo(first.last("board_state"));
    }

    @Test
    void joinerGetsSnapshotBeforeAnyRoomBroadcast() {
        TestClient joiner = fx.anonymous();

        joiner.send("join_board", "code", board.code(), "clientName", "One");

        assertThat(joiner.types()).containsExactly("board_state", "presence");
    }

    @Test
    void cardsOrderedByIndexThenId() {
        Card a = fx.storage.insertCard(board.id(), new NewCard("A", "a", "", null));
        Card b = fx.storage.insertCard(board.id(), new NewCard("A", "b", "", null));
        Card c = fx.storage.insertCard(board.id(), new NewCard("A", "c", "", null));
        fx.storage.updateCardOrder(board.id(), List.of(c.id(), a.id(), b.id()));

        BoardState state = boardState(null);

        assertThat(state.cards()).extracting(CardView::text).containsExactly("c", "a", "b");
    }

    @Test
    void messagesOldestFirstWithoutDeleted() {
        ChatMessage one = post("one", "general");
        ChatMessage two = post("two", "general");
        post("three", "general");
        fx.storage.setMessageDeleted(RoomKind.BOARD, two.id());
        fx.storage.toggleReaction(RoomKind.BOARD, one.id(), "u1", "👍");

        BoardState state = boardState(null);

        assertThat(state.messages()).extracting(MessageView::text).containsExactly("one", "three");
        assertThat(state.messages().get(0).reactions()).hasSize(1);
    }

    @Test
    void boardMessageWindowKeepsNewest() {
        var small = new RoomStateSynthesizer(fx.storage, fx.formatter, fx.sessions, 2, 25, 25, 100, 120);
        post("m1", "general");
        post("m2", "general");
        post("m3", "general");

        BoardState state = (BoardState) small.snapshot(key, null);

        assertThat(state.messages()).extracting(MessageView::text).containsExactly("m2", "m3");
    }

    @Test
    void channelsDefaultToGeneral() {
        assertThat(boardState(null).channels()).containsExactly("general");

        post("x", "random");
        post("y", "design");

        assertThat(boardState(null).channels()).containsExactly("design", "random");
    }

    @Test
    void roleIsViewerForAnonymousAndNonMembers() {
        Identity stranger = fx.user("u9", "zed");

        assertThat(boardState(null).role()).isEqualTo(Role.VIEWER);
        assertThat(boardState(stranger).role()).isEqualTo(Role.VIEWER);
        assertThat(boardState(owner).role()).isEqualTo(Role.OWNER);
    }

    @Test
    void fileUrlsAreResolved() {
        fx.storage.insertCard(board.id(), new NewCard("A", "pic", "", "card 1.png"));
        fx.storage.insertMessage(new NewMessage(key, null, "Anon", null, "see", "general", null,
            List.of(new Attachment("plan.pdf", "f9.pdf", "application/pdf")), "v1.webm"));

        BoardState state = boardState(null);

        assertThat(state.cards().get(0).attachmentUrl()).isEqualTo("/files/board/card%201.png");
        assertThat(state.messages().get(0).attachments().get(0).url()).isEqualTo("/files/board/f9.pdf");
        assertThat(state.messages().get(0).voiceUrl()).isEqualTo("/files/board/v1.webm");
    }

    @Test
    void boardInfoCarriesCodeAndAppearance() {
        BoardState state = boardState(null);

        assertThat(state.board().code()).isEqualTo(board.code());
        assertThat(state.theme()).isEqualTo("ocean");
        assertThat(state.title()).isEqualTo("Retro");
        assertThat(state.members()).extracting(m -> m.userId()).containsExactly("u1");
    }

    @Test
    void unknownBoardIsNotFound() {
        assertThatThrownBy(() -> fx.synthesizer.snapshot(RoomKey.board("ffffff"), null))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void directSnapshotRequiresParticipant() {
        fx.user("u2", "bob");
        Identity carol = fx.user("u3", "carol");
        RoomKey dm = RoomKey.direct("u1", "u2");

        assertThatThrownBy(() -> fx.synthesizer.snapshot(dm, carol)).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> fx.synthesizer.snapshot(dm, null)).isInstanceOf(ForbiddenException.class);

        DirectHistory history = (DirectHistory) fx.synthesizer.snapshot(dm, owner);
        assertThat(history.other()).isEqualTo("bob");
        assertThat(history.otherOnline()).isFalse();
    }

    @Test
    void groupSnapshotUsesSlugAndTitle() {
        fx.storage.insertMessage(new NewMessage(RoomKey.group("lobby"), "u1", "alice", null, "hi all", null, null,
            null, null));

        GroupHistory history = (GroupHistory) fx.synthesizer.snapshot(RoomKey.group("lobby"), owner);

        assertThat(history.title()).isEqualTo("Community Lounge");
        assertThat(history.messages()).extracting(MessageView::text).containsExactly("hi all");
    }

    private BoardState boardState(Identity requester) {
        return (BoardState) fx.synthesizer.snapshot(key, requester);
    }

    private ChatMessage post(String text, String channel) {
        return fx.storage.insertMessage(new NewMessage(key, "u1", "alice", null, text, channel, null, null, null));
    }
}
