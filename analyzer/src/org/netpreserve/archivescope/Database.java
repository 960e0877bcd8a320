package org.netpreserve.archivescope;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.archivescope.db.CacheEntryDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * SQLite metadata store of the persistent cache tier.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "60000");
        // a single connection keeps in-memory databases alive and serialises writers
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(1);
        config.setMaxLifetime(0);
        config.setPoolName("cache-metadata");
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                Instant started = context.getExecutionMoment();
                Instant completed = context.getCompletionMoment();
                if (started == null || completed == null) return;
                long durationMillis = Duration.between(started, completed).toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {}", durationMillis, sql);
                }
            }
        });
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    default void init() {
        // executeAsSeparateStatements() because the sqlite driver runs only the first statement of a batch
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    CacheEntryDAO cacheEntries();

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
