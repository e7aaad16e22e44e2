package com.marketdw.etl.runner;

import com.marketdw.etl.model.UnitRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChunkPlannerTest {

    @Test
    void yearChunksShouldAlignToCalendarYears() {
        List<UnitRange> chunks = ChunkPlanner.plan(20220315, 20240110, ChunkGranularity.YEAR);

        assertEquals(List.of(
                UnitRange.of(20220315, 20221231),
                UnitRange.of(20230101, 20231231),
                UnitRange.of(20240101, 20240110)
        ), chunks);
    }

    @Test
    void monthChunksShouldHandleLeapFebruary() {
        List<UnitRange> chunks = ChunkPlanner.plan(20240115, 20240310, ChunkGranularity.MONTH);

        assertEquals(List.of(
                UnitRange.of(20240115, 20240131),
                UnitRange.of(20240201, 20240229),
                UnitRange.of(20240301, 20240310)
        ), chunks);
    }

    @Test
    void noGranularityShouldGiveOneChunk() {
        assertEquals(List.of(UnitRange.of(20240101, 20241231)), ChunkPlanner.plan(20240101, 20241231, ChunkGranularity.NONE));
        assertEquals(List.of(UnitRange.single(20240105)), ChunkPlanner.plan(20240105, 20240105, ChunkGranularity.MONTH));
    }

    @Test
    void invertedRangeShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChunkPlanner.plan(20240110, 20240101, ChunkGranularity.YEAR));
    }

    @Test
    void granularityShouldParseLeniently() {
        assertEquals(ChunkGranularity.YEAR, ChunkGranularity.fromText(" year "));
        assertEquals(ChunkGranularity.NONE, ChunkGranularity.fromText(null));
        assertThrows(IllegalArgumentException.class, () -> ChunkGranularity.fromText("week"));
    }
}
