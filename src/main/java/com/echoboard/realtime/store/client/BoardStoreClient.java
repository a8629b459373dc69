package com.echoboard.realtime.store.client;

import com.echoboard.realtime.model.ActivityEntry;
import com.echoboard.realtime.model.Board;
import com.echoboard.realtime.model.BoardMember;
import com.echoboard.realtime.model.Card;
import com.echoboard.realtime.model.ChatMessage;
import com.echoboard.realtime.model.GroupRoom;
import com.echoboard.realtime.model.Invite;
import com.echoboard.realtime.model.NewCard;
import com.echoboard.realtime.model.NewMessage;
import com.echoboard.realtime.model.PresenceEntry;
import com.echoboard.realtime.model.ReactionCount;
import com.echoboard.realtime.model.UserAccount;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;
import java.util.Map;

/**
 * Board-store service API. Rooms and messages are addressed by the room kind's wire name
 * ({@code board}, {@code dm}, {@code group}).
 */
@RegisterRestClient(configKey = "board-store")
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface BoardStoreClient {

    @GET
    @Path("/boards/by-code/{code}")
    Board getBoard(@PathParam("code") String code);

    @POST
    @Path("/boards")
    Board createBoard(CreateBoardRequest req);

    @PATCH
    @Path("/boards/{id}")
    Board updateBoard(@PathParam("id") long boardId, BoardPatch patch);

    @GET
    @Path("/boards/{id}/cards")
    List<Card> listCards(@PathParam("id") long boardId);

    @POST
    @Path("/boards/{id}/cards")
    Card insertCard(@PathParam("id") long boardId, NewCard card);

    @POST
    @Path("/boards/{id}/cards/{cardId}/votes")
    Card voteCard(@PathParam("id") long boardId, @PathParam("cardId") long cardId);

    @PUT
    @Path("/boards/{id}/cards/order")
    void updateCardOrder(@PathParam("id") long boardId, CardOrderRequest req);

    @POST
    @Path("/messages")
    ChatMessage insertMessage(NewMessage message);

    @GET
    @Path("/messages/{kind}/{id}")
    ChatMessage getMessage(@PathParam("kind") String kind, @PathParam("id") long messageId);

    @GET
    @Path("/rooms/{kind}/{roomId}/messages")
    List<ChatMessage> listMessages(@PathParam("kind") String kind, @PathParam("roomId") String roomId,
                                   @QueryParam("limit") int limit);

    @GET
    @Path("/messages/{kind}/reactions")
    Map<Long, List<ReactionCount>> listReactions(@PathParam("kind") String kind, @QueryParam("id") List<Long> ids);

    @POST
    @Path("/messages/{kind}/{id}/reactions")
    List<ReactionCount> toggleReaction(@PathParam("kind") String kind, @PathParam("id") long messageId,
                                       ReactionRequest req);

    @PATCH
    @Path("/messages/{kind}/{id}")
    ChatMessage patchMessage(@PathParam("kind") String kind, @PathParam("id") long messageId, MessagePatch patch);

    @POST
    @Path("/messages/board/{id}/pin")
    ChatMessage togglePin(@PathParam("id") long messageId);

    @POST
    @Path("/messages/dm/{id}/read")
    ChatMessage markRead(@PathParam("id") long messageId, ReadRequest req);

    @POST
    @Path("/conversations/read")
    List<Long> markConversationRead(ReadRequest req);

    @GET
    @Path("/boards/{id}/members/{userId}")
    BoardMember getMember(@PathParam("id") long boardId, @PathParam("userId") String userId);

    @PUT
    @Path("/boards/{id}/members/{userId}")
    BoardMember putMember(@PathParam("id") long boardId, @PathParam("userId") String userId, MemberRequest req);

    @GET
    @Path("/boards/{id}/members")
    List<BoardMember> listMembers(@PathParam("id") long boardId);

    @POST
    @Path("/boards/{id}/activity")
    void logActivity(@PathParam("id") long boardId, ActivityRequest req);

    @GET
    @Path("/boards/{id}/activity")
    List<ActivityEntry> listActivity(@PathParam("id") long boardId, @QueryParam("limit") int limit);

    @POST
    @Path("/boards/{id}/presence")
    void recordPresence(@PathParam("id") long boardId, PresenceRequest req);

    @GET
    @Path("/boards/{id}/presence")
    List<PresenceEntry> listPresence(@PathParam("id") long boardId, @QueryParam("limit") int limit);

    @PUT
    @Path("/users/{id}")
    UserAccount putUser(@PathParam("id") String userId, UserRequest req);

    @GET
    @Path("/users/by-username/{username}")
    UserAccount getUserByUsername(@PathParam("username") String username);

    @GET
    @Path("/users/{id}")
    UserAccount getUser(@PathParam("id") String userId);

    @GET
    @Path("/groups/{slug}")
    GroupRoom getGroup(@PathParam("slug") String slug);

    @POST
    @Path("/boards/{id}/invites")
    Invite createInvite(@PathParam("id") long boardId, InviteRequest req);

    @GET
    @Path("/invites/{token}")
    Invite getInvite(@PathParam("token") String token);
}
