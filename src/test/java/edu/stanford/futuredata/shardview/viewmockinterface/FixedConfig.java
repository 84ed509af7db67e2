package edu.stanford.futuredata.shardview.viewmockinterface;

import edu.stanford.futuredata.shardview.interfaces.ConfigSource;

import java.util.HashMap;
import java.util.Map;

public class FixedConfig implements ConfigSource {
    private final Map<String, Integer> values = new HashMap<>();

    public FixedConfig set(String category, String key, int value) {
        values.put(category + "/" + key, value);
        return this;
    }

    @Override
    public int getPositiveInt(String category, String key, int defaultValue) {
        Integer value = values.get(category + "/" + key);
        return value != null && value > 0 ? value : defaultValue;
    }
}
