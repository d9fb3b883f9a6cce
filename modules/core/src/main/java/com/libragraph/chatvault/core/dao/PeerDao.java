package com.libragraph.chatvault.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Peer table {@code t2}: {@code key} is the int64 peer id, {@code value} a tagged-stream blob.
 */
@RegisterConstructorMapper(PeerRow.class)
public interface PeerDao {

    @SqlQuery("SELECT value FROM t2 WHERE key = :peerId LIMIT 1")
    Optional<byte[]> findValue(@Bind("peerId") long peerId);

    /** All rows in table order. The stream holds a cursor and must be closed. */
    @SqlQuery("SELECT key, value FROM t2")
    Stream<PeerRow> streamAll();

    @SqlQuery("SELECT COUNT(*) FROM t2")
    long count();
}
