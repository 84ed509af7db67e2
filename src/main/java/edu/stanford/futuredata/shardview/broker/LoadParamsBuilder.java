package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.interfaces.*;
import edu.stanford.futuredata.shardview.utilities.*;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Turns a request, a view name and loader options into a {@link QueryDescriptor}.  All
 * validation happens here, before any shard is queried.
 */
public class LoadParamsBuilder {
    private static final Logger logger = LoggerFactory.getLogger(LoadParamsBuilder.class);

    public static final String CONFIG_CATEGORY = KeyRangeResolver.CONFIG_CATEGORY;
    public static final String PAGE_SIZE_KEY = "pagination_page_size";
    public static final String CHUNK_SIZE_KEY = "load_view_chunk_size";
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int DEFAULT_CHUNK_SIZE = 50;
    // Largest page or chunk size; one more row is always fetched on top.
    public static final int MAX_SIZE = Integer.MAX_VALUE - 1;

    private static final List<String> STORE_KEYS_STRIPPED = List.of(ViewOptions.STARTKEY, ViewOptions.ENDKEY,
            ViewOptions.DESCENDING, ViewOptions.LIMIT, ViewOptions.INCLUDE_DOCS);
    private static final List<String> GROUPING_KEYS = List.of(ViewOptions.REDUCE, ViewOptions.GROUP,
            ViewOptions.GROUP_LEVEL);

    private final ConfigSource config;
    private final ShardResolver shardResolver;
    private final KeyRangeResolver keyRangeResolver;

    public LoadParamsBuilder(ConfigSource config, ShardResolver shardResolver, KeyRangeResolver keyRangeResolver) {
        this.config = config;
        this.shardResolver = shardResolver;
        this.keyRangeResolver = keyRangeResolver;
    }

    /*
     * ENTRY SHAPES
     */

    // Plain key-range load against the listed databases or the account shard.
    public QueryDescriptor buildLoadParams(ViewRequest request, String view, ViewOptions options)
            throws LoadException {
        try {
            Direction direction = keyRangeResolver.direction(request, options);
            Pair<JsonNode, JsonNode> keys = keyRangeResolver.startEndKeys(request, options, direction);
            QueryDescriptor.Builder b = QueryDescriptor.builder()
                    .view(view)
                    .direction(direction)
                    .keys(keys.getValue0(), keys.getValue1())
                    .shards(explicitOrAccountShards(request, options));
            return finish(b, request, options, KeyRangeResolver.rangeKeyName(options));
        } catch (RuntimeException e) {
            throw callbackFault(view, e);
        }
    }

    // Time-bounded load against a single shard list, keys built from the validated time range.
    public QueryDescriptor buildLoadRangeParams(ViewRequest request, String view, ViewOptions options)
            throws LoadException {
        try {
            String rangeKeyName = KeyRangeResolver.rangeKeyName(options);
            Pair<Long, Long> range = keyRangeResolver.timeRange(request, options, rangeKeyName);
            QueryDescriptor.Builder b = rangedBuilder(request, view, options, range)
                    .shards(explicitOrAccountShards(request, options));
            return finish(b, request, options, rangeKeyName);
        } catch (RuntimeException e) {
            throw callbackFault(view, e);
        }
    }

    /**
     * Time-bounded load spread over partition shards.  Explicit databases are sorted and
     * de-duplicated; otherwise the shard resolver picks the partitions covering the range.
     * Either list is reversed for descending loads.
     */
    public QueryDescriptor buildPartitionedParams(ViewRequest request, String view, ViewOptions options)
            throws LoadException {
        try {
            String rangeKeyName = KeyRangeResolver.rangeKeyName(options);
            Pair<Long, Long> range = keyRangeResolver.timeRange(request, options, rangeKeyName);
            QueryDescriptor.Builder b = rangedBuilder(request, view, options, range);
            List<String> shards;
            if (options.isDefined(ViewOptions.DATABASES)) {
                shards = new ArrayList<>(new TreeSet<>(shardList(options.get(ViewOptions.DATABASES))));
            } else if (request.getAccountId().isEmpty()) {
                shards = new ArrayList<>();
            } else if (shardResolver == null) {
                throw new LoadException(LoadError.configuration("internal_error",
                        "partitioned load without a shard resolver"));
            } else {
                shards = new ArrayList<>(shardResolver.shardsForRange(request.getAccountId().get(),
                        range.getValue0(), range.getValue1()));
            }
            if (b.getDirection().isDescending()) {
                Collections.reverse(shards);
            }
            b.shards(shards);
            return finish(b, request, options, rangeKeyName);
        } catch (RuntimeException e) {
            throw callbackFault(view, e);
        }
    }

    private QueryDescriptor.Builder rangedBuilder(ViewRequest request, String view, ViewOptions options,
                                                  Pair<Long, Long> range) {
        Direction direction = keyRangeResolver.direction(request, options);
        Pair<JsonNode, JsonNode> keys = keyRangeResolver.rangedStartEndKeys(request, options, direction,
                range.getValue0(), range.getValue1());
        return QueryDescriptor.builder()
                .view(view)
                .direction(direction)
                .keys(keys.getValue0(), keys.getValue1())
                .timeRange(range.getValue0(), range.getValue1());
    }

    /*
     * COMMON PARAMETERS
     */

    private QueryDescriptor finish(QueryDescriptor.Builder b, ViewRequest request, ViewOptions options,
                                   String rangeKeyName) throws LoadException {
        List<String> shards = b.getShards();
        if (shards.isEmpty()) {
            logger.warn("View {} has no shards to query", b.getView());
            throw new LoadException(LoadError.configuration("no_target", "no databases to query"));
        }
        ChunkFormat chunkFormat;
        try {
            chunkFormat = ChunkFormat.fromOption(options.get(ViewOptions.CHUNK_RESPONSE_TYPE));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown chunk response type {}", options.get(ViewOptions.CHUNK_RESPONSE_TYPE));
            throw new LoadException(LoadError.configuration("internal_error",
                    "unknown chunk response type " + options.get(ViewOptions.CHUNK_RESPONSE_TYPE)));
        }
        boolean chunked = options.isTrue(ViewOptions.IS_CHUNKED);
        ChunkedMapper chunkedMapper = options.get(ViewOptions.CHUNKED_MAPPER, ChunkedMapper.class).orElse(null);
        ChunkTransport transport = options.get(ViewOptions.TRANSPORT, ChunkTransport.class).orElse(null);
        if (chunked && transport == null) {
            logger.warn("Chunked load of {} requested without a transport", b.getView());
            throw new LoadException(LoadError.configuration("internal_error",
                    "chunked response requested without a transport"));
        }
        if (chunked && chunkFormat == ChunkFormat.CSV && chunkedMapper == null) {
            logger.warn("Chunked CSV load of {} requested without a chunked mapper", b.getView());
            throw new LoadException(LoadError.configuration("internal_error",
                    "csv chunked response requires a chunked mapper"));
        }
        RowMapper mapper = options.get(ViewOptions.MAPPER, RowMapper.class).orElse(null);
        if (request.hasDocFilter()) {
            mapper = RowMapper.withDocFilter(request.getDocFilter().get(), mapper);
        }
        return b.pageSize(pageSize(request, options))
                .chunkSize(chunkSize(options))
                .chunked(chunked, chunkFormat)
                .mapper(mapper)
                .chunkedMapper(chunkedMapper)
                .transport(transport)
                .storeOptions(buildViewQuery(request, options, b.getDirection(), b.getStartKey(), b.getEndKey(), rangeKeyName))
                .request(request)
                .build();
    }

    // Null when the request does not paginate.
    Integer pageSize(ViewRequest request, ViewOptions options) {
        if (!request.shouldPaginate()) {
            return null;
        }
        Optional<Integer> limit = options.getInteger(ViewOptions.LIMIT).filter(l -> l > 0);
        if (limit.isPresent()) {
            return Math.min(limit.get(), MAX_SIZE);
        }
        return Math.min(MAX_SIZE, request.getPageSize().filter(p -> p > 0)
                .orElseGet(() -> config.getPositiveInt(CONFIG_CATEGORY, PAGE_SIZE_KEY, DEFAULT_PAGE_SIZE)));
    }

    int chunkSize(ViewOptions options) {
        return Math.min(MAX_SIZE, options.getInteger(ViewOptions.CHUNK_SIZE).filter(c -> c > 0)
                .orElseGet(() -> config.getPositiveInt(CONFIG_CATEGORY, CHUNK_SIZE_KEY, DEFAULT_CHUNK_SIZE)));
    }

    /**
     * Per-shard store options.  Loader keys, key bounds, direction and limit are stripped from the
     * pass-through options and replaced by the computed values.  A document filter forces
     * include_docs; reduce/group/group_level (unless false) turns it off again.
     */
    public static StoreQueryOptions buildViewQuery(ViewRequest request, ViewOptions options, Direction direction,
                                                   JsonNode startKey, JsonNode endKey, String rangeKeyName) {
        Set<String> stripped = new HashSet<>(ViewOptions.LOADER_KEYS);
        stripped.addAll(STORE_KEYS_STRIPPED);
        stripped.add(rangeKeyName + "_from");
        stripped.add(rangeKeyName + "_to");
        Map<String, Object> extra = options.without(stripped).asMap();

        boolean includeDocs = options.isTrue(ViewOptions.INCLUDE_DOCS) || request.hasDocFilter();
        for (String key: GROUPING_KEYS) {
            if (options.isDefined(key)) {
                if (!options.isFalse(key)) {
                    includeDocs = false;
                }
                break;
            }
        }
        return new StoreQueryOptions(startKey, endKey, null, direction.isDescending(), includeDocs, extra);
    }

    /*
     * SHARDS
     */

    private static List<String> explicitOrAccountShards(ViewRequest request, ViewOptions options) {
        if (options.isDefined(ViewOptions.DATABASES)) {
            return shardList(options.get(ViewOptions.DATABASES));
        }
        return request.getAccountShard().map(List::of).orElse(List.of());
    }

    // A single name, a collection of names, or a JSON string/array of names.
    static List<String> shardList(Object databases) {
        List<String> shards = new ArrayList<>();
        if (databases instanceof Collection) {
            for (Object shard: (Collection<?>) databases) {
                shards.add(shard.toString());
            }
        } else if (databases instanceof JsonNode && ((JsonNode) databases).isArray()) {
            ((JsonNode) databases).forEach(shard -> shards.add(shard.asText()));
        } else if (databases instanceof JsonNode) {
            shards.add(((JsonNode) databases).asText());
        } else if (databases != null) {
            shards.add(databases.toString());
        }
        return shards;
    }

    private static LoadException callbackFault(String view, RuntimeException e) {
        logger.error("Building load of view {} failed: {}", view, e.getMessage());
        return new LoadException(LoadError.systemFault("datastore_fault", String.valueOf(e.getMessage())), e);
    }
}
