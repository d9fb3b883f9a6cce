package com.libragraph.chatvault.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record MessageRow(
        @ColumnName("key") byte[] key,
        @ColumnName("value") byte[] value
) {}
