package com.libragraph.chatvault.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record PeerRow(
        @ColumnName("key") long peerId,
        @ColumnName("value") byte[] value
) {}
