package com.libragraph.chatvault.core.db;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import java.nio.file.Path;

/**
 * Builds the JDBI instance over a plaintext SQLite copy of the store.
 */
public final class StoreJdbi {

    private StoreJdbi() {
    }

    public static Jdbi create(Path sqliteFile) {
        return Jdbi.create("jdbc:sqlite:" + sqliteFile.toAbsolutePath())
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
