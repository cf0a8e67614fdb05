package com.gpufleet.governor.service;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;

/**
 * Builds a {@link StateStoreService} over a private in-memory H2 database with the production schema.
 */
final class TestStateStores {

    private TestStateStores() {
    }

    static EmbeddedDatabase newDatabase() {
        return new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("schema.sql")
            .build();
    }

    static StateStoreService newStore(EmbeddedDatabase database, Clock clock) {
        return new StateStoreService(new JdbcTemplate(database), new DataSourceTransactionManager(database), clock);
    }
}
