package com.marketdw.etl.store;

import com.marketdw.etl.model.WatermarkRecord;
import com.marketdw.etl.model.WatermarkStatus;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional in-memory store: each session works on a private copy that {@code commit} publishes.
 */
public final class InMemoryPipelineStore implements PipelineStore {
    private Map<String, WatermarkRecord> watermarks = new LinkedHashMap<>();
    private Map<String, Map<List<Object>, List<Object>>> tables = new LinkedHashMap<>();
    private List<SqlStatement> executed = new ArrayList<>();
    private int commits;
    private int rollbacks;
    private int sessionsOpened;

    @Override
    public synchronized StoreSession openSession() {
        sessionsOpened++;
        return new Session();
    }

    public synchronized void seedWatermark(String stream, int waterMark, WatermarkStatus status) {
        watermarks.put(stream, new WatermarkRecord(stream, waterMark, status, Instant.EPOCH, null));
    }

    public synchronized Optional<WatermarkRecord> watermark(String stream) {
        return Optional.ofNullable(watermarks.get(stream));
    }

    public synchronized List<List<Object>> rows(String table) {
        Map<List<Object>, List<Object>> rows = tables.get(table);
        return rows == null ? List.of() : new ArrayList<>(rows.values());
    }

    public synchronized List<SqlStatement> executed() {
        return new ArrayList<>(executed);
    }

    public synchronized int commits() {
        return commits;
    }

    public synchronized int rollbacks() {
        return rollbacks;
    }

    public synchronized int sessionsOpened() {
        return sessionsOpened;
    }

    private static Map<String, Map<List<Object>, List<Object>>> copyTables(Map<String, Map<List<Object>, List<Object>>> source) {
        Map<String, Map<List<Object>, List<Object>>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<List<Object>, List<Object>>> e : source.entrySet()) {
            copy.put(e.getKey(), new LinkedHashMap<>(e.getValue()));
        }
        return copy;
    }

    private final class Session implements StoreSession {
        private Map<String, WatermarkRecord> pendingMarks;
        private Map<String, Map<List<Object>, List<Object>>> pendingTables;
        private List<SqlStatement> pendingExecuted;
        private boolean closed;
        private final WatermarkStore watermarkView = new SessionWatermarks();

        Session() {
            reset();
        }

        private void reset() {
            synchronized (InMemoryPipelineStore.this) {
                pendingMarks = new LinkedHashMap<>(watermarks);
                pendingTables = copyTables(tables);
                pendingExecuted = new ArrayList<>(executed);
            }
        }

        private void ensureOpen() throws SQLException {
            if (closed) {
                throw new SQLException("session closed");
            }
        }

        @Override
        public int execute(SqlStatement statement) throws SQLException {
            ensureOpen();
            pendingExecuted.add(statement);
            return 1;
        }

        @Override
        public int upsertRows(String table, List<String> columns, List<String> keyColumns, List<List<Object>> rows)
                throws SQLException {
            ensureOpen();
            Map<List<Object>, List<Object>> target = pendingTables.computeIfAbsent(table, t -> new LinkedHashMap<>());
            for (List<Object> row : rows) {
                List<Object> key = new ArrayList<>();
                for (String keyColumn : keyColumns) {
                    key.add(row.get(columns.indexOf(keyColumn)));
                }
                target.put(key, new ArrayList<>(row));
            }
            return rows.size();
        }

        @Override
        public WatermarkStore watermarks() {
            return watermarkView;
        }

        @Override
        public void commit() throws SQLException {
            ensureOpen();
            synchronized (InMemoryPipelineStore.this) {
                watermarks = new LinkedHashMap<>(pendingMarks);
                tables = copyTables(pendingTables);
                executed = new ArrayList<>(pendingExecuted);
                commits++;
            }
        }

        @Override
        public void rollback() throws SQLException {
            ensureOpen();
            synchronized (InMemoryPipelineStore.this) {
                rollbacks++;
            }
            reset();
        }

        @Override
        public void close() {
            closed = true;
        }

        private final class SessionWatermarks implements WatermarkStore {

            @Override
            public Optional<WatermarkRecord> find(String streamName) {
                return Optional.ofNullable(pendingMarks.get(streamName));
            }

            @Override
            public boolean initialize(String streamName, int waterMark) {
                if (pendingMarks.containsKey(streamName)) {
                    return false;
                }
                pendingMarks.put(streamName, new WatermarkRecord(streamName, waterMark, WatermarkStatus.SUCCESS, Instant.EPOCH, null));
                return true;
            }

            @Override
            public void save(String streamName, int waterMark, WatermarkStatus status, String lastErr) {
                pendingMarks.put(streamName, new WatermarkRecord(streamName, waterMark, status, Instant.EPOCH, lastErr));
            }

            @Override
            public List<WatermarkRecord> listAll() {
                return new ArrayList<>(pendingMarks.values());
            }
        }
    }
}
