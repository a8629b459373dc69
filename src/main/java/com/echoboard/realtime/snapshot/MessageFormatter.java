package com.echoboard.realtime.snapshot;

import com.echoboard.realtime.message.CardView;
import com.echoboard.realtime.message.MessageView;
import com.echoboard.realtime.message.MessageView.AttachmentView;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.ReactionCount;
import com.echoboard.realtime.room.RoomKind;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Turns stored cards and messages into client views, resolving stored file names to URLs.
 */
@ApplicationScoped
public class MessageFormatter {

    private final String boardFilesPrefix;
    private final String voiceFilesPrefix;

    @Inject
    public MessageFormatter(
        @ConfigProperty(name = "echoboard.files.board-url-prefix", defaultValue = "/files/board/") String boardFilesPrefix,
        @ConfigProperty(name = "echoboard.files.voice-url-prefix", defaultValue = "/files/voice/") String voiceFilesPrefix) {
        this.boardFilesPrefix = boardFilesPrefix;
        this.voiceFilesPrefix = voiceFilesPrefix;
    }

    public CardView card(Card card) {
        return new CardView(card.id(), card.boardId(), card.author(), card.text(), card.tag(), card.votes(),
            card.orderIndex(), fileUrl(boardFilesPrefix, card.attachmentPath()), card.createdAt());
    }

    public MessageView message(ChatMessage message, List<ReactionCount> reactions) {
        String voicePrefix = message.kind() == RoomKind.DIRECT ? voiceFilesPrefix : boardFilesPrefix;
        List<AttachmentView> attachments = message.attachments().stream()
            .map(a -> new AttachmentView(a.name(), fileUrl(boardFilesPrefix, a.stored()), a.mime()))
            .toList();
        return new MessageView(message.id(), message.roomId(), message.authorId(), message.author(),
            message.recipientId(), message.text(), message.channel(), message.replyTo(), message.pinned(),
            attachments, fileUrl(voicePrefix, message.voicePath()),
            reactions == null ? List.of() : reactions,
            message.createdAt(), message.editedAt(), message.readAt());
    }

    public List<MessageView> messages(List<ChatMessage> messages, Map<Long, List<ReactionCount>> reactions) {
        return messages.stream().map(m -> message(m, reactions.get(m.id()))).toList();
    }

    private static String fileUrl(String prefix, String stored) {
        if (stored == null || stored.isBlank()) return null;
        return prefix + URLEncoder.encode(stored, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
