package com.marketdw.etl.health;

import java.util.List;

public final class LayerSpec {
    public final String name;
    public final String watermarkStream;
    public final List<TableSpec> tables;

    public LayerSpec(String name, String watermarkStream, List<TableSpec> tables) {
        this.name = name;
        this.watermarkStream = watermarkStream;
        this.tables = List.copyOf(tables);
    }
}
