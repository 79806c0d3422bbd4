package me.golemcore.brain.domain.store;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.port.outbound.StoragePort;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Transactional record store backed by one embedded H2 database file per tier.
 *
 * <p>
 * Records are JSON documents kept in the {@code records} table, keyed by
 * (table name, record key) and ordered by insertion. Secondary indexes are
 * declared per logical table on a JSON property and materialized in
 * {@code record_index}, which references its record with a cascading foreign
 * key. Array-valued properties index every element, object-valued properties
 * index their field names. Named counters live in {@code record_sequences} and
 * the schema version in {@code schema_version}.
 *
 * <p>
 * Writers are serialized by a store-wide lock and run inside a Spring JDBC
 * transaction; any exception or rollback request leaves the committed state
 * untouched. Readers use their own pooled connections and only ever see
 * committed data.
 *
 * <p>
 * A database that cannot be opened, or carries a newer schema version, is
 * treated as corrupt: the file is quarantined, the store is rebuilt from the
 * {@code .sql.bak} script written on every clean open and close, or else starts
 * empty, and a {@link RecoveryEvent} is recorded.
 */
@Slf4j
public class RecordStore implements AutoCloseable {

    public static final int SCHEMA_VERSION = 1;

    static final String DATABASE_SUFFIX = ".mv.db";
    static final String BACKUP_FILE_SUFFIX = ".sql" + StoragePort.BACKUP_SUFFIX;

    private static final int MAX_CONNECTIONS = 4;

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS schema_version ("
                    + "version_number INT NOT NULL PRIMARY KEY, "
                    + "applied_at TIMESTAMP NOT NULL)",
            "CREATE SEQUENCE IF NOT EXISTS record_order",
            "CREATE TABLE IF NOT EXISTS records ("
                    + "table_name VARCHAR(64) NOT NULL, "
                    + "record_key VARCHAR NOT NULL, "
                    + "row_order BIGINT NOT NULL, "
                    + "body CLOB NOT NULL, "
                    + "PRIMARY KEY (table_name, record_key))",
            "CREATE INDEX IF NOT EXISTS idx_records_order ON records (table_name, row_order)",
            "CREATE TABLE IF NOT EXISTS record_index ("
                    + "table_name VARCHAR(64) NOT NULL, "
                    + "index_name VARCHAR(64) NOT NULL, "
                    + "index_value VARCHAR NOT NULL, "
                    + "record_key VARCHAR NOT NULL, "
                    + "PRIMARY KEY (table_name, index_name, index_value, record_key), "
                    + "FOREIGN KEY (table_name, record_key) REFERENCES records (table_name, record_key) "
                    + "ON DELETE CASCADE)",
            "CREATE INDEX IF NOT EXISTS idx_record_index_record ON record_index (table_name, record_key)",
            "CREATE TABLE IF NOT EXISTS record_sequences ("
                    + "sequence_name VARCHAR(128) NOT NULL PRIMARY KEY, "
                    + "current_value BIGINT NOT NULL)");

    private static final String SELECT_VERSION = "SELECT MAX(version_number) FROM schema_version";
    private static final String INSERT_VERSION = "INSERT INTO schema_version (version_number, applied_at) VALUES (?, ?)";
    private static final String SELECT_ONE = "SELECT body FROM records WHERE table_name = ? AND record_key = ?";
    private static final String SELECT_TABLE = "SELECT body FROM records WHERE table_name = ? ORDER BY row_order";
    private static final String SELECT_TABLE_KEYED = "SELECT record_key, body FROM records WHERE table_name = ? "
            + "ORDER BY row_order";
    private static final String SELECT_BY_INDEX = "SELECT r.body FROM records r "
            + "JOIN record_index i ON i.table_name = r.table_name AND i.record_key = r.record_key "
            + "WHERE i.table_name = ? AND i.index_name = ? AND i.index_value = ? "
            + "ORDER BY r.row_order";
    private static final String COUNT_TABLE = "SELECT COUNT(*) FROM records WHERE table_name = ?";
    private static final String COUNT_ALL = "SELECT COUNT(*) FROM records";
    private static final String COUNT_ONE = "SELECT COUNT(*) FROM records WHERE table_name = ? AND record_key = ?";
    private static final String INSERT_RECORD = "INSERT INTO records (table_name, record_key, row_order, body) "
            + "VALUES (?, ?, NEXT VALUE FOR record_order, ?)";
    private static final String UPDATE_RECORD = "UPDATE records SET body = ? WHERE table_name = ? AND record_key = ?";
    private static final String DELETE_RECORD = "DELETE FROM records WHERE table_name = ? AND record_key = ?";
    private static final String DELETE_INDEX_ROWS = "DELETE FROM record_index WHERE table_name = ? AND record_key = ?";
    private static final String DELETE_INDEX = "DELETE FROM record_index WHERE table_name = ? AND index_name = ?";
    private static final String INSERT_INDEX_ROW = "INSERT INTO record_index "
            + "(table_name, index_name, index_value, record_key) VALUES (?, ?, ?, ?)";
    private static final String SELECT_SEQUENCE = "SELECT current_value FROM record_sequences WHERE sequence_name = ?";
    private static final String INSERT_SEQUENCE = "INSERT INTO record_sequences (sequence_name, current_value) "
            + "VALUES (?, ?)";
    private static final String UPDATE_SEQUENCE = "UPDATE record_sequences SET current_value = ? "
            + "WHERE sequence_name = ?";

    private final String name;
    private final String directory;
    private final String databaseFile;
    private final String backupFile;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean keepBackups;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final Map<String, Map<String, String>> indexDefinitions = new ConcurrentHashMap<>();
    private final List<RecoveryEvent> recoveryEvents = new CopyOnWriteArrayList<>();

    private volatile HikariDataSource dataSource;
    private volatile JdbcTemplate jdbcTemplate;
    private volatile TransactionTemplate transactionTemplate;
    private volatile boolean opened;
    private volatile boolean closed;

    public RecordStore(String name, String directory, StoragePort storagePort, ObjectMapper objectMapper,
            Clock clock, boolean keepBackups) {
        this.name = name;
        this.directory = directory;
        this.databaseFile = name + DATABASE_SUFFIX;
        this.backupFile = name + BACKUP_FILE_SUFFIX;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keepBackups = keepBackups;
    }

    public String getName() {
        return name;
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public String getBackupFile() {
        return backupFile;
    }

    /**
     * Declare a secondary index on a JSON property of a table's records and
     * rebuild it from the stored records.
     */
    public void registerIndex(String table, String indexName, String property) {
        indexDefinitions.computeIfAbsent(table, t -> new ConcurrentHashMap<>()).put(indexName, property);
        update(tx -> rebuildIndex(table, indexName, property));
    }

    /**
     * Open the database file, recovering it when needed. Safe to call more than
     * once; later calls are no-ops.
     */
    public void open() {
        writeLock.lock();
        try {
            if (opened) {
                return;
            }
            if (closed) {
                throw new RecordStoreException("Store " + name + " is closed", null);
            }
            storagePort.ensureDirectory(directory).join();
            attach(loadWithRecovery());
            opened = true;
            if (keepBackups) {
                backup();
            }
            log.info("[RecordStore] Opened '{}' with {} record(s)", name,
                    jdbcTemplate.queryForObject(COUNT_ALL, Long.class));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Write a final backup and release the database file. A closed store
     * cannot be reopened.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            closed = true;
            if (!opened) {
                return;
            }
            if (keepBackups) {
                backup();
            }
            dataSource.close();
            opened = false;
            log.info("[RecordStore] Closed '{}'", name);
        } finally {
            writeLock.unlock();
        }
    }

    public List<RecoveryEvent> getRecoveryEvents() {
        return List.copyOf(recoveryEvents);
    }

    // ==================== Committed reads ====================

    public <T> Optional<T> get(String table, String key, Class<T> type) {
        ensureOpen();
        return findOne(table, key, type);
    }

    public <T> List<T> scan(String table, Class<T> type) {
        return scan(table, type, record -> true);
    }

    public <T> List<T> scan(String table, Class<T> type, Predicate<T> predicate) {
        ensureOpen();
        return findAll(table, type, predicate);
    }

    public <T> List<T> lookup(String table, String indexName, String value, Class<T> type) {
        ensureOpen();
        return findByIndex(table, indexName, value, type);
    }

    public int count(String table) {
        ensureOpen();
        return countRows(table);
    }

    public long currentSequence(String sequenceName) {
        ensureOpen();
        return query(() -> {
            List<Long> current = jdbcTemplate.queryForList(SELECT_SEQUENCE, Long.class, sequenceName);
            return current.isEmpty() ? 0L : current.get(0);
        });
    }

    /**
     * Put a single record in its own transaction.
     */
    public void put(String table, String key, Object record) {
        update(tx -> tx.put(table, key, record));
    }

    // ==================== Transactions ====================

    /**
     * Run {@code work} as one atomic unit and return its result.
     *
     * @throws RecordStoreException
     *             when the database rejected or failed to commit the work
     */
    public <R> R transaction(Function<Transaction, R> work) {
        ensureOpen();
        writeLock.lock();
        try {
            return transactionTemplate.execute(status -> {
                Transaction tx = new Transaction(this, status);
                R result = work.apply(tx);
                if (tx.isRollbackOnly()) {
                    log.debug("[RecordStore] Transaction on '{}' rolled back on request", name);
                }
                return result;
            });
        } catch (DataAccessException | TransactionException e) {
            log.warn("[RecordStore] Transaction on '{}' failed and was rolled back: {}", name, e.getMessage());
            throw new RecordStoreException("Failed to commit to store " + name, e);
        } finally {
            writeLock.unlock();
        }
    }

    public void update(Consumer<Transaction> work) {
        transaction(tx -> {
            work.accept(tx);
            return null;
        });
    }

    // ==================== Row access shared with Transaction ====================

    <T> Optional<T> findOne(String table, String key, Class<T> type) {
        List<String> bodies = query(() -> jdbcTemplate.queryForList(SELECT_ONE, String.class, table, key));
        return bodies.isEmpty() ? Optional.empty() : Optional.of(convert(bodies.get(0), type));
    }

    <T> List<T> findAll(String table, Class<T> type, Predicate<T> predicate) {
        List<String> bodies = query(() -> jdbcTemplate.queryForList(SELECT_TABLE, String.class, table));
        List<T> result = new ArrayList<>(bodies.size());
        for (String body : bodies) {
            T value = convert(body, type);
            if (predicate.test(value)) {
                result.add(value);
            }
        }
        return result;
    }

    <T> List<T> findByIndex(String table, String indexName, String value, Class<T> type) {
        requireIndex(table, indexName);
        List<String> bodies = query(
                () -> jdbcTemplate.queryForList(SELECT_BY_INDEX, String.class, table, indexName, value));
        List<T> result = new ArrayList<>(bodies.size());
        for (String body : bodies) {
            result.add(convert(body, type));
        }
        return result;
    }

    int countRows(String table) {
        Long count = query(() -> jdbcTemplate.queryForObject(COUNT_TABLE, Long.class, table));
        return count == null ? 0 : count.intValue();
    }

    boolean containsRow(String table, String key) {
        Long count = query(() -> jdbcTemplate.queryForObject(COUNT_ONE, Long.class, table, key));
        return count != null && count > 0;
    }

    void insertRow(String table, String key, Object record) {
        requireKey(key);
        JsonNode node = toNode(record);
        try {
            jdbcTemplate.update(INSERT_RECORD, table, key, serialize(node));
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityViolationException("Duplicate key " + key + " in " + table, e);
        }
        writeIndexRows(table, key, node);
    }

    void putRow(String table, String key, Object record) {
        requireKey(key);
        JsonNode node = toNode(record);
        String body = serialize(node);
        int updated = jdbcTemplate.update(UPDATE_RECORD, body, table, key);
        if (updated == 0) {
            jdbcTemplate.update(INSERT_RECORD, table, key, body);
        } else {
            jdbcTemplate.update(DELETE_INDEX_ROWS, table, key);
        }
        writeIndexRows(table, key, node);
    }

    boolean deleteRow(String table, String key) {
        // index rows go with the record through the cascading foreign key
        return jdbcTemplate.update(DELETE_RECORD, table, key) > 0;
    }

    long nextSequenceValue(String sequenceName) {
        List<Long> current = jdbcTemplate.queryForList(SELECT_SEQUENCE, Long.class, sequenceName);
        long next = (current.isEmpty() ? 0L : current.get(0)) + 1;
        if (current.isEmpty()) {
            jdbcTemplate.update(INSERT_SEQUENCE, sequenceName, next);
        } else {
            jdbcTemplate.update(UPDATE_SEQUENCE, next, sequenceName);
        }
        return next;
    }

    private void writeIndexRows(String table, String key, JsonNode node) {
        Map<String, String> definitions = indexDefinitions.get(table);
        if (definitions == null) {
            return;
        }
        List<Object[]> rows = new ArrayList<>();
        for (Map.Entry<String, String> definition : definitions.entrySet()) {
            for (String value : indexValues(node, definition.getValue())) {
                rows.add(new Object[] { table, definition.getKey(), value, key });
            }
        }
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(INSERT_INDEX_ROW, rows);
        }
    }

    private void rebuildIndex(String table, String indexName, String property) {
        jdbcTemplate.update(DELETE_INDEX, table, indexName);
        List<Object[]> rows = new ArrayList<>();
        jdbcTemplate.query(SELECT_TABLE_KEYED, rs -> {
            JsonNode node = parse(rs.getString("body"));
            for (String value : indexValues(node, property)) {
                rows.add(new Object[] { table, indexName, value, rs.getString("record_key") });
            }
        }, table);
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(INSERT_INDEX_ROW, rows);
        }
        log.debug("[RecordStore] Index {}.{} on '{}' rebuilt with {} entr(ies)", table, indexName, name,
                rows.size());
    }

    void requireIndex(String table, String indexName) {
        Map<String, String> tableIndexes = indexDefinitions.get(table);
        if (tableIndexes == null || !tableIndexes.containsKey(indexName)) {
            throw new IllegalArgumentException("Unknown index " + table + "." + indexName);
        }
    }

    static Set<String> indexValues(JsonNode node, String property) {
        JsonNode field = node.get(property);
        Set<String> values = new LinkedHashSet<>();
        if (field == null || field.isNull()) {
            return values;
        }
        if (field.isArray()) {
            field.forEach(element -> {
                if (!element.isNull()) {
                    values.add(element.asText());
                }
            });
        } else if (field.isObject()) {
            field.fieldNames().forEachRemaining(values::add);
        } else {
            values.add(field.asText());
        }
        return values;
    }

    // ==================== Mapping ====================

    private <T> T convert(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored record does not map to " + type.getSimpleName(), e);
        }
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored record of '" + name + "' is not valid JSON", e);
        }
    }

    private JsonNode toNode(Object record) {
        if (record == null) {
            throw new IllegalArgumentException("Record must not be null");
        }
        return objectMapper.valueToTree(record);
    }

    private String serialize(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Record of '" + name + "' cannot be serialized", e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Record key must not be blank");
        }
    }

    private <T> T query(Supplier<T> read) {
        try {
            return read.get();
        } catch (DataAccessException e) {
            throw new RecordStoreException("Failed to read store " + name, e);
        }
    }

    private void ensureOpen() {
        if (!opened) {
            open();
        }
    }

    // ==================== Database lifecycle ====================

    private void attach(HikariDataSource source) {
        this.dataSource = source;
        this.jdbcTemplate = new JdbcTemplate(source);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(source));
    }

    private HikariDataSource connect() {
        Path database = storagePort.resolve(directory, name);
        HikariConfig config = new HikariConfig();
        config.setPoolName("brain-" + name);
        config.setJdbcUrl("jdbc:h2:file:" + database + ";DB_CLOSE_ON_EXIT=FALSE;WRITE_DELAY=0");
        config.setUsername("sa");
        config.setPassword("");
        config.setMaximumPoolSize(MAX_CONNECTIONS);
        config.setMinimumIdle(1);
        return new HikariDataSource(config);
    }

    /**
     * Create missing tables and check the stored schema version.
     */
    private void prepareSchema(HikariDataSource source) {
        JdbcTemplate jdbc = new JdbcTemplate(source);
        SCHEMA.forEach(jdbc::execute);
        Integer version = jdbc.queryForObject(SELECT_VERSION, Integer.class);
        if (version == null) {
            jdbc.update(INSERT_VERSION, SCHEMA_VERSION, Timestamp.from(clock.instant()));
        } else if (version > SCHEMA_VERSION) {
            throw new CorruptStoreException("unsupported schema version " + version);
        }
    }

    private HikariDataSource openFresh() {
        HikariDataSource source = connect();
        try {
            prepareSchema(source);
            return source;
        } catch (RuntimeException e) {
            source.close();
            throw new RecordStoreException("Failed to initialize store " + name, e);
        }
    }

    private HikariDataSource loadWithRecovery() {
        String primaryProblem;
        if (!fileExists(databaseFile)) {
            if (!fileExists(backupFile)) {
                log.debug("[RecordStore] No database for '{}', starting empty", name);
                return openFresh();
            }
            primaryProblem = "primary file missing";
        } else {
            HikariDataSource candidate = null;
            try {
                candidate = connect();
                prepareSchema(candidate);
                return candidate;
            } catch (RuntimeException e) {
                closeQuietly(candidate);
                primaryProblem = describe(e);
            }
        }

        log.error("[RecordStore] Store '{}' is unreadable ({}), attempting recovery", name, primaryProblem);
        String quarantinedAs = quarantineQuietly();

        if (fileExists(backupFile)) {
            HikariDataSource restored = null;
            try {
                restored = connect();
                Path script = storagePort.resolve(directory, backupFile);
                new JdbcTemplate(restored).execute("RUNSCRIPT FROM '" + sqlLiteral(script) + "'");
                prepareSchema(restored);
                recordRecovery(RecoveryEvent.Outcome.RESTORED_FROM_BACKUP, primaryProblem, quarantinedAs);
                log.warn("[RecordStore] Store '{}' restored from backup", name);
                return restored;
            } catch (RuntimeException e) {
                closeQuietly(restored);
                log.error("[RecordStore] Backup of '{}' is unusable: {}", name, describe(e));
                discardPartialRestore();
            }
        }

        HikariDataSource fresh = openFresh();
        recordRecovery(RecoveryEvent.Outcome.RESET_TO_EMPTY, primaryProblem, quarantinedAs);
        log.warn("[RecordStore] Store '{}' reset to empty state", name);
        return fresh;
    }

    /**
     * Dump the committed state as an SQL script next to the database, replacing
     * the previous backup atomically.
     */
    private void backup() {
        String temporary = backupFile + ".tmp";
        try {
            Path target = storagePort.resolve(directory, temporary);
            jdbcTemplate.execute("SCRIPT TO '" + sqlLiteral(target) + "'");
            storagePort.replaceAtomic(directory, temporary, backupFile).join();
            log.debug("[RecordStore] Backup of '{}' written", name);
        } catch (DataAccessException | CompletionException e) {
            log.warn("[RecordStore] Backup of '{}' failed, previous backup kept: {}", name, describe(e));
        }
    }

    private boolean fileExists(String file) {
        return Boolean.TRUE.equals(storagePort.exists(directory, file).join());
    }

    private String quarantineQuietly() {
        try {
            return storagePort.quarantine(directory, databaseFile).join();
        } catch (CompletionException e) {
            log.warn("[RecordStore] Could not quarantine '{}': {}", name, describe(e));
            return null;
        }
    }

    private void discardPartialRestore() {
        try {
            storagePort.deleteObject(directory, databaseFile).join();
        } catch (CompletionException e) {
            log.warn("[RecordStore] Could not remove partial restore of '{}': {}", name, describe(e));
        }
    }

    private static void closeQuietly(HikariDataSource source) {
        if (source != null) {
            source.close();
        }
    }

    private void recordRecovery(RecoveryEvent.Outcome outcome, String reason, String quarantinedAs) {
        recoveryEvents.add(new RecoveryEvent(name, outcome, reason, quarantinedAs, clock.instant()));
    }

    private static String sqlLiteral(Path path) {
        return path.toString().replace("'", "''");
    }

    private static String describe(RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private static final class CorruptStoreException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        CorruptStoreException(String message) {
            super(message);
        }
    }
}
