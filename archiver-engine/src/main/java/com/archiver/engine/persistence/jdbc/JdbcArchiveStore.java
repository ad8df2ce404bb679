package com.archiver.engine.persistence.jdbc;

import com.archiver.core.exception.StoreUnavailableException;
import com.archiver.core.exception.TransientStoreException;
import com.archiver.core.exception.VersionConflictException;
import com.archiver.core.model.ArchiveListing;
import com.archiver.core.model.VersionedArchive;
import com.archiver.core.model.WeekArchive;
import com.archiver.core.model.WeekKey;
import com.archiver.core.store.ArchiveStore;
import com.archiver.engine.codec.ArchiveDocumentCodec;
import com.archiver.engine.persistence.ArchiveKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed implementation of ArchiveStore.
 * One row per week; the version column is the optimistic lock.
 *
 * The document is kept as JSON text rather than jsonb so the stored bytes stay
 * exactly as encoded (jsonb would reorder the ranking keys).
 */
public class JdbcArchiveStore implements ArchiveStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcArchiveStore.class);

    public static final String SCHEMA = """
        CREATE TABLE IF NOT EXISTS week_archives (
            week_key      VARCHAR(8)  PRIMARY KEY,
            document      TEXT        NOT NULL,
            version       BIGINT      NOT NULL,
            last_modified TIMESTAMPTZ NOT NULL
        )
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ArchiveDocumentCodec codec;
    private final Clock clock;
    private final String keyPrefix;

    public JdbcArchiveStore(JdbcTemplate jdbcTemplate, ArchiveDocumentCodec codec, Clock clock, String keyPrefix) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    /**
     * Create the archive table if it does not exist yet.
     */
    public void createSchema() {
        execute("schema", "week_archives", () -> {
            jdbcTemplate.execute(SCHEMA);
            return null;
        });
        log.info("Archive table week_archives ready");
    }

    @Override
    public Optional<VersionedArchive> get(WeekKey week) {
        String sql = """
            SELECT document, version, last_modified
            FROM week_archives
            WHERE week_key = ?
            """;
        List<VersionedArchive> rows = execute("get", storageKey(week), () -> jdbcTemplate.query(sql,
            (rs, rowNum) -> new VersionedArchive(
                ArchiveKeys.checkedWeek(
                    codec.decode(rs.getString("document").getBytes(StandardCharsets.UTF_8)),
                    week,
                    storageKey(week)),
                String.valueOf(rs.getLong("version")),
                rs.getTimestamp("last_modified").toInstant()),
            week.toString()));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public void putIfVersion(WeekKey week, WeekArchive archive, String expectedVersion) {
        ArchiveKeys.checkWrite(week, archive);
        String document = new String(codec.encode(archive), StandardCharsets.UTF_8);
        Timestamp now = Timestamp.from(clock.instant());

        int rows;
        if (expectedVersion == null) {
            String sql = """
                INSERT INTO week_archives (week_key, document, version, last_modified)
                VALUES (?, ?, 1, ?)
                ON CONFLICT (week_key) DO NOTHING
                """;
            rows = execute("put", storageKey(week),
                () -> jdbcTemplate.update(sql, week.toString(), document, now));
        } else {
            long expected;
            try {
                expected = Long.parseLong(expectedVersion);
            } catch (NumberFormatException e) {
                throw new VersionConflictException(storageKey(week), expectedVersion, e);
            }
            String sql = """
                UPDATE week_archives
                SET document = ?, version = version + 1, last_modified = ?
                WHERE week_key = ? AND version = ?
                """;
            rows = execute("put", storageKey(week),
                () -> jdbcTemplate.update(sql, document, now, week.toString(), expected));
        }

        if (rows == 0) {
            throw new VersionConflictException(storageKey(week), expectedVersion, currentVersion(week));
        }
    }

    @Override
    public List<ArchiveListing> list() {
        String sql = """
            SELECT week_key, last_modified, octet_length(document) AS size_bytes
            FROM week_archives
            ORDER BY week_key
            """;
        return execute("list", keyPrefix, () -> jdbcTemplate.query(sql, (rs, rowNum) -> {
            WeekKey week = WeekKey.parse(rs.getString("week_key"));
            return new ArchiveListing(
                week,
                storageKey(week),
                rs.getTimestamp("last_modified").toInstant(),
                rs.getLong("size_bytes"));
        }));
    }

    @Override
    public String storageKey(WeekKey week) {
        return ArchiveKeys.storageKey(keyPrefix, week);
    }

    private String currentVersion(WeekKey week) {
        List<Long> versions = execute("get", storageKey(week), () -> jdbcTemplate.queryForList(
            "SELECT version FROM week_archives WHERE week_key = ?", Long.class, week.toString()));
        return versions.isEmpty() ? null : String.valueOf(versions.get(0));
    }

    private <T> T execute(String operation, String storageKey, Supplier<T> call) {
        try {
            return call.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw new TransientStoreException(operation, storageKey, e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(
                String.format("Database %s of %s failed: %s", operation, storageKey, e.getMessage()), e);
        }
    }
}
