package com.libragraph.chatvault.api;

import com.libragraph.chatvault.core.chat.ArchiveStats;
import com.libragraph.chatvault.core.chat.ChatStore;
import com.libragraph.chatvault.core.chat.ChatSummary;
import com.libragraph.chatvault.core.chat.ExportedMessage;
import com.libragraph.chatvault.core.chat.MessageRecord;
import com.libragraph.chatvault.core.chat.SearchHit;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.Map;

@Path("/api/chats")
@Produces(MediaType.APPLICATION_JSON)
public class ChatResource {

    @Inject
    ChatStore store;

    @GET
    @Path("/recent")
    public List<ChatSummary> recent(@QueryParam("limit") @DefaultValue("20") int limit) {
        return store.recentChats(limit);
    }

    @GET
    @Path("/find")
    public List<ChatSummary> find(@QueryParam("q") @DefaultValue("") String query) {
        return store.findChats(query);
    }

    /**
     * Resolves a peer id, phone number or name; 404 when nothing matches.
     */
    @GET
    @Path("/resolve")
    public Map<String, Long> resolve(@QueryParam("identifier") @DefaultValue("") String identifier) {
        return store.resolveIdentifier(identifier)
                .map(peerId -> Map.of("peerId", peerId))
                .orElseThrow(() -> new NotFoundException("No chat matches '" + identifier + "'"));
    }

    @GET
    @Path("/{peerId}/messages")
    public List<MessageRecord> messages(@PathParam("peerId") long peerId,
                                        @QueryParam("limit") @DefaultValue("20") int limit) {
        return store.readMessages(peerId, limit);
    }

    @GET
    @Path("/search")
    public List<SearchHit> search(@QueryParam("q") @DefaultValue("") String query,
                                  @QueryParam("limit") @DefaultValue("50") int limit) {
        return store.searchMessages(query, limit);
    }

    @GET
    @Path("/export")
    public List<ExportedMessage> export(@QueryParam("since") @DefaultValue("0") long since) {
        return store.exportMessages(since);
    }

    @GET
    @Path("/stats")
    public ArchiveStats stats() {
        return store.stats();
    }
}
