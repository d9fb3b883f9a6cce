package com.libragraph.chatvault.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.List;
import java.util.stream.Stream;

/**
 * Message table {@code t7}: {@code key} is the 20-byte big-endian message key,
 * {@code value} the message blob. Streams hold a cursor and must be closed.
 */
@RegisterConstructorMapper(MessageRow.class)
public interface MessageDao {

    @SqlQuery("SELECT key FROM t7")
    Stream<byte[]> streamKeys();

    /**
     * Newest messages of one peer, matched on the first 8 key bytes.
     */
    @SqlQuery("SELECT key, value FROM t7 WHERE substr(key, 1, 8) = :prefix ORDER BY key DESC LIMIT :limit")
    List<MessageRow> findByPeerPrefix(@Bind("prefix") byte[] prefix, @Bind("limit") int limit);

    @SqlQuery("SELECT key, value FROM t7 ORDER BY key DESC")
    Stream<MessageRow> streamNewestFirst();

    @SqlQuery("SELECT key, value FROM t7 ORDER BY key ASC")
    Stream<MessageRow> streamOldestFirst();

    @SqlQuery("SELECT COUNT(*) FROM t7")
    long count();
}
