package com.marketdw.db;

import com.marketdw.db.mybatis.WatermarkMapper;
import com.marketdw.db.mybatis.WatermarkRow;
import com.marketdw.db.mybatis.WatermarkUpsertParam;
import com.marketdw.etl.model.WatermarkRecord;
import com.marketdw.etl.model.WatermarkStatus;
import com.marketdw.etl.store.WatermarkStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Watermark access bound to the mapper of one open store session, and so to its transaction.
 */
final class MyBatisWatermarkStore implements WatermarkStore {
    private final WatermarkMapper mapper;

    MyBatisWatermarkStore(WatermarkMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<WatermarkRecord> find(String streamName) {
        return Optional.ofNullable(mapper.selectByStream(streamName)).map(MyBatisWatermarkStore::toRecord);
    }

    @Override
    public boolean initialize(String streamName, int waterMark) {
        return mapper.insertIfAbsent(streamName, waterMark) > 0;
    }

    @Override
    public void save(String streamName, int waterMark, WatermarkStatus status, String lastErr) {
        mapper.upsert(WatermarkUpsertParam.builder()
                .streamName(streamName)
                .waterMark(waterMark)
                .status(status.name())
                .lastErr(lastErr)
                .build());
    }

    @Override
    public List<WatermarkRecord> listAll() {
        List<WatermarkRecord> out = new ArrayList<>();
        for (WatermarkRow row : mapper.selectAll()) {
            out.add(toRecord(row));
        }
        return out;
    }

    private static WatermarkRecord toRecord(WatermarkRow row) {
        WatermarkStatus status = "FAILED".equals(row.getStatus() == null ? "" : row.getStatus().toUpperCase(Locale.ROOT))
                ? WatermarkStatus.FAILED
                : WatermarkStatus.SUCCESS;
        return new WatermarkRecord(
                row.getStreamName(),
                row.getWaterMark(),
                status,
                row.getLastRunAt() == null ? null : row.getLastRunAt().toInstant(),
                row.getLastErr()
        );
    }
}
