package edu.stanford.futuredata.shardview.utilities;

public enum Direction {
    ASCENDING, DESCENDING;

    public boolean isDescending() {
        return this == DESCENDING;
    }
}
