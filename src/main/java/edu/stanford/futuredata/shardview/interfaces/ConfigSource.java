package edu.stanford.futuredata.shardview.interfaces;

public interface ConfigSource {
    // A positive integer setting, or defaultValue if unset or not a positive integer.
    int getPositiveInt(String category, String key, int defaultValue);
}
