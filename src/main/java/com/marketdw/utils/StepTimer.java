package com.marketdw.utils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

public class StepTimer {
    private final LongSupplier clockMs;
    private final Map<String, Long> start = new LinkedHashMap<>();
    private final Map<String, Long> durMs = new LinkedHashMap<>();

    public StepTimer() {
        this(System::currentTimeMillis);
    }

    public StepTimer(LongSupplier clockMs) {
        this.clockMs = clockMs;
    }

    public void start(String step) {
        start.put(step, clockMs.getAsLong());
    }

    public void end(String step) {
        Long s = start.get(step);
        if (s != null) {
            durMs.put(step, clockMs.getAsLong() - s);
        }
    }

    public Map<String, Long> snapshot() {
        return new LinkedHashMap<>(durMs);
    }

    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        sb.append("step timings\n");
        for (Map.Entry<String, Long> e : durMs.entrySet()) {
            sb.append(" - ").append(e.getKey()).append(" = ").append(e.getValue()).append(" ms\n");
        }
        return sb.toString();
    }
}
