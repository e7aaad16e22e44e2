package com.marketdw.etl.error;

import com.marketdw.etl.model.UnitRange;

/**
 * A unit or batch failed and was rolled back. Remaining units of the invocation were abandoned.
 */
public class TransformationException extends RuntimeException {
    private final String streamName;
    private final UnitRange failedRange;
    private final Integer retainedWatermark;

    public TransformationException(String streamName, UnitRange failedRange, Integer retainedWatermark, Throwable cause) {
        super("stream=" + streamName
                + " failed at " + failedRange
                + " (watermark kept at " + retainedWatermark + "): "
                + describe(cause), cause);
        this.streamName = streamName;
        this.failedRange = failedRange;
        this.retainedWatermark = retainedWatermark;
    }

    public String streamName() {
        return streamName;
    }

    public UnitRange failedRange() {
        return failedRange;
    }

    public Integer retainedWatermark() {
        return retainedWatermark;
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        if (message == null || message.trim().isEmpty()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
