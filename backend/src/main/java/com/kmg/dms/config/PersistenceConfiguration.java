package com.kmg.dms.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
public class PersistenceConfiguration {

    @Bean
    public DataSource dataSource(DmsProperties properties) throws IOException {
        Path dbPath = Path.of(properties.getState().getDbPath()).toAbsolutePath();
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
        HikariConfig config = new HikariConfig();
        config.setDataSource(sqliteDataSource(dbPath));
        config.setPoolName("dms-sqlite");
        config.setMaximumPoolSize(properties.getScan().getMaxWorkers() + 2);
        return new HikariDataSource(config);
    }

    /**
     * Every connection runs in WAL mode with a busy timeout, and write transactions begin IMMEDIATE so
     * that concurrent workers wait for the write lock instead of failing on lock upgrade.
     */
    public static DataSource sqliteDataSource(Path dbPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(30000);
        config.enforceForeignKeys(true);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }
}
