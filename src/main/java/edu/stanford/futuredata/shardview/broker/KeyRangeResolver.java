package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import edu.stanford.futuredata.shardview.interfaces.ConfigSource;
import edu.stanford.futuredata.shardview.interfaces.KeyMap;
import edu.stanford.futuredata.shardview.interfaces.RangeKeyMap;
import edu.stanford.futuredata.shardview.utilities.*;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Works out where a load starts and ends: direction, start/end keys, and for ranged loads the
 * validated time range.
 */
public class KeyRangeResolver {
    private static final Logger logger = LoggerFactory.getLogger(KeyRangeResolver.class);

    public static final String CONFIG_CATEGORY = "crossbar";
    public static final String MAX_RANGE_KEY = "maximum_range";
    // 31 days and an hour.
    public static final int DEFAULT_MAX_RANGE = 31 * 24 * 3600 + 3600;
    public static final String DEFAULT_RANGE_KEY_NAME = "created";

    private final ConfigSource config;
    private final Clock clock;

    public KeyRangeResolver(ConfigSource config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /*
     * DIRECTION
     */

    // Descending if the options say so, or the request asks for descending (or not ascending).
    public Direction direction(ViewRequest request, ViewOptions options) {
        if (options.isTrue(ViewOptions.DESCENDING)
                || request.reqIsTrue(ViewOptions.DESCENDING)
                || request.reqIsFalse(ViewOptions.ASCENDING)) {
            return Direction.DESCENDING;
        }
        return Direction.ASCENDING;
    }

    /*
     * PLAIN KEYS
     */

    public Pair<JsonNode, JsonNode> startEndKeys(ViewRequest request, ViewOptions options) {
        return startEndKeys(request, options, direction(request, options));
    }

    /**
     * Start/end keys for a plain load.  Request "start_key"/"end_key" win over anything the
     * options compute; computed keys are swapped when descending.
     */
    public Pair<JsonNode, JsonNode> startEndKeys(ViewRequest request, ViewOptions options, Direction direction) {
        Pair<JsonNode, JsonNode> optionKeys = optionStartEndKeys(request, options);
        return pickKeys(direction, request, optionKeys.getValue0(), optionKeys.getValue1());
    }

    private static Pair<JsonNode, JsonNode> optionStartEndKeys(ViewRequest request, ViewOptions options) {
        Object keyMap = options.get(ViewOptions.KEYMAP);
        if (keyMap != null) {
            JsonNode key = mapKey(request, options, keyMap);
            return new Pair<>(key, key);
        }
        JsonNode startKey = mapKey(request, options,
                options.getFirstDefined(ViewOptions.STARTKEY, ViewOptions.START_KEYMAP));
        JsonNode endKey = mapKey(request, options,
                options.getFirstDefined(ViewOptions.ENDKEY, ViewOptions.END_KEYMAP));
        return new Pair<>(startKey, endKey);
    }

    private static JsonNode mapKey(ViewRequest request, ViewOptions options, Object spec) {
        KeyMap keyMap = KeyMap.of(spec);
        return keyMap == null ? null : keyMap.resolve(request, options);
    }

    private static Pair<JsonNode, JsonNode> pickKeys(Direction direction, ViewRequest request,
                                                     JsonNode computedStart, JsonNode computedEnd) {
        JsonNode requestStart = request.reqValue(ViewRequest.START_KEY);
        JsonNode requestEnd = request.reqValue(ViewRequest.END_KEY);
        if (direction.isDescending()) {
            return new Pair<>(requestStart != null ? requestStart : computedEnd,
                    requestEnd != null ? requestEnd : computedStart);
        }
        return new Pair<>(requestStart != null ? requestStart : computedStart,
                requestEnd != null ? requestEnd : computedEnd);
    }

    /*
     * TIME RANGES
     */

    public Pair<Long, Long> timeRange(ViewRequest request, ViewOptions options) throws LoadException {
        return timeRange(request, options, rangeKeyName(options));
    }

    /**
     * Time range from "{key}_from"/"{key}_to", looked up in the options first and then in the
     * request.  "to" defaults to now, "from" to maxRange seconds before "to".
     */
    public Pair<Long, Long> timeRange(ViewRequest request, ViewOptions options, String key) throws LoadException {
        long maxRange = maxRange(options);
        long now = clock.millis() / 1000;
        long rangeTo = timeKey(request, options, key + "_to", now);
        long rangeFrom = timeKey(request, options, key + "_from", rangeTo - maxRange);
        return checkTimeRange(maxRange, key, rangeFrom, rangeTo);
    }

    public static Pair<Long, Long> checkTimeRange(long maxRange, String key, long rangeFrom, long rangeTo)
            throws LoadException {
        long span = rangeTo - rangeFrom;
        if (span < 0) {
            String message = String.format("%s_to %d is prior to %s_from %d", key, rangeTo, key, rangeFrom);
            logger.debug("{}", message);
            throw new LoadException(LoadError.validation(key + "_from", "date_range", message,
                    LongNode.valueOf(rangeFrom)));
        } else if (span > maxRange) {
            String message = String.format("%s_to %d is more than %d seconds from %s_from %d",
                    key, rangeTo, maxRange, key, rangeFrom);
            logger.debug("{}", message);
            throw new LoadException(LoadError.validation(key + "_to", "date_range", message,
                    LongNode.valueOf(rangeTo)));
        }
        return new Pair<>(rangeFrom, rangeTo);
    }

    public long maxRange(ViewOptions options) {
        Optional<Long> maxRange = options.getLong(ViewOptions.MAX_RANGE);
        return maxRange.orElseGet(() -> (long) config.getPositiveInt(CONFIG_CATEGORY, MAX_RANGE_KEY, DEFAULT_MAX_RANGE));
    }

    public static String rangeKeyName(ViewOptions options) {
        return options.getString(ViewOptions.RANGE_KEY_NAME).filter(s -> !s.isEmpty()).orElse(DEFAULT_RANGE_KEY_NAME);
    }

    private static long timeKey(ViewRequest request, ViewOptions options, String key, long defaultValue) {
        Optional<Long> fromOptions = options.getLong(key);
        if (fromOptions.isPresent()) {
            return fromOptions.get();
        }
        return request.reqLong(key).filter(t -> t > 0).orElse(defaultValue);
    }

    /*
     * RANGED KEYS
     */

    public Pair<JsonNode, JsonNode> rangedStartEndKeys(ViewRequest request, ViewOptions options) throws LoadException {
        Pair<Long, Long> range = timeRange(request, options);
        return rangedStartEndKeys(request, options, direction(request, options), range.getValue0(), range.getValue1());
    }

    /**
     * Start/end keys for a ranged load, built from the time range through the range key maps.
     * Request keys win; computed keys are swapped when descending.
     */
    public Pair<JsonNode, JsonNode> rangedStartEndKeys(ViewRequest request, ViewOptions options, Direction direction,
                                                       long startTime, long endTime) {
        Pair<RangeKeyMap, RangeKeyMap> maps = rangeKeyMaps(options);
        return pickKeys(direction, request, maps.getValue0().apply(startTime), maps.getValue1().apply(endTime));
    }

    private static Pair<RangeKeyMap, RangeKeyMap> rangeKeyMaps(ViewOptions options) {
        if (options.get(ViewOptions.RANGE_KEYMAP) != null) {
            RangeKeyMap keyMap = RangeKeyMap.fromSpec(options.get(ViewOptions.RANGE_KEYMAP));
            return new Pair<>(keyMap, keyMap);
        }
        return new Pair<>(RangeKeyMap.fromSpec(options.get(ViewOptions.RANGE_START_KEYMAP)),
                RangeKeyMap.fromSpec(options.get(ViewOptions.RANGE_END_KEYMAP)));
    }
}
