package com.marketdw.etl.store;

import java.sql.SQLException;

/**
 * Entry point to the shared relational store. Each session owns one connection and one open transaction.
 */
public interface PipelineStore {
    StoreSession openSession() throws SQLException;
}
