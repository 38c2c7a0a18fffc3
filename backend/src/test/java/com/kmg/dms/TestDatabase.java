package com.kmg.dms;

import com.kmg.dms.config.DatabaseSchema;
import com.kmg.dms.config.PersistenceConfiguration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * A fresh SQLite database file with the application schema.
 */
public final class TestDatabase {
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    private TestDatabase(DataSource dataSource) {
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    public static TestDatabase create(Path dir) {
        TestDatabase database = new TestDatabase(PersistenceConfiguration.sqliteDataSource(dir.resolve("test.db")));
        new DatabaseSchema(database.jdbcTemplate).initialize();
        return database;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public TransactionTemplate transactionTemplate() {
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }
}
