package com.marketdw.etl.store;

import com.marketdw.etl.model.WatermarkRecord;
import com.marketdw.etl.model.WatermarkStatus;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public interface WatermarkStore {

    Optional<WatermarkRecord> find(String streamName) throws SQLException;

    /**
     * Creates the stream at {@code waterMark} with SUCCESS unless it already exists.
     *
     * @return true when a new row was written
     */
    boolean initialize(String streamName, int waterMark) throws SQLException;

    /**
     * Upserts the stream; {@code lastErr} is cleared when null.
     */
    void save(String streamName, int waterMark, WatermarkStatus status, String lastErr) throws SQLException;

    List<WatermarkRecord> listAll() throws SQLException;
}
