package com.echoboard.realtime.handler;

import com.echoboard.realtime.error.NotFoundException;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.GroupRoom;
import com.echoboard.realtime.model.Role;
import com.echoboard.realtime.model.UserAccount;
import com.echoboard.realtime.room.RoomKind;
import com.echoboard.realtime.security.Identity;
import com.echoboard.realtime.store.StorageGateway;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Look-ups that turn inbound codes, slugs, usernames and ids into stored rows.
 */
@ApplicationScoped
public class RoomResolver {

    private final StorageGateway storage;

    @Inject
    public RoomResolver(StorageGateway storage) {
        this.storage = storage;
    }

    public Board board(String code) {
        return storage.findBoardByCode(Inputs.required(code, "code"))
            .orElseThrow(() -> new NotFoundException("board not found"));
    }

    public GroupRoom group(String slug) {
        return storage.findGroupBySlug(Inputs.required(slug, "slug"))
            .orElseThrow(() -> new NotFoundException("group not found"));
    }

    public UserAccount user(String username) {
        return storage.findUserByUsername(Inputs.required(username, "username"))
            .orElseThrow(() -> new NotFoundException("user not found"));
    }

    /** A live message; deleted messages count as missing. */
    public ChatMessage message(RoomKind kind, Long messageId) {
        long id = Inputs.required(messageId, "messageId");
        return storage.findMessage(kind, id)
            .filter(m -> !m.isDeleted())
            .orElseThrow(() -> new NotFoundException("message not found"));
    }

    public Role role(Board board, Identity identity) {
        if (identity == null) return Role.VIEWER;
        return storage.getMemberRole(board.id(), identity.userId()).orElse(Role.VIEWER);
    }
}
