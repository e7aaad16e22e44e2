package com.marketdw.etl.runner;

import com.marketdw.etl.model.UnitRange;
import com.marketdw.etl.store.StoreSession;

/**
 * Layer-specific work for one unit or one range of units. Must be safe to rerun for the same range.
 * The runner owns commit and rollback; implementations only write through {@code session}.
 */
@FunctionalInterface
public interface UnitTransformation {
    void apply(StoreSession session, UnitRange range) throws Exception;
}
