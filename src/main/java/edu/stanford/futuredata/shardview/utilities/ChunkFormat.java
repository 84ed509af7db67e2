package edu.stanford.futuredata.shardview.utilities;

import java.util.Locale;

public enum ChunkFormat {
    JSON, CSV;

    // Accepts the enum itself or its name in any case.  Absent means JSON.
    public static ChunkFormat fromOption(Object value) {
        if (value == null) {
            return JSON;
        } else if (value instanceof ChunkFormat) {
            return (ChunkFormat) value;
        }
        return ChunkFormat.valueOf(value.toString().toUpperCase(Locale.ROOT));
    }
}
