package edu.stanford.futuredata.shardview.broker;

import edu.stanford.futuredata.shardview.interfaces.ChunkTransport;
import edu.stanford.futuredata.shardview.interfaces.ConfigSource;
import edu.stanford.futuredata.shardview.interfaces.ShardResolver;
import edu.stanford.futuredata.shardview.interfaces.ViewStore;
import edu.stanford.futuredata.shardview.utilities.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Entry point for view loads.  Each call builds a fresh descriptor, folds it over its shards and
 * returns the finished response.  Thread-safe as long as the store and config source are.
 */
public class ViewBroker {
    private static final Logger logger = LoggerFactory.getLogger(ViewBroker.class);

    private final LoadParamsBuilder paramsBuilder;
    private final ShardFoldEngine foldEngine;

    /*
     * CONSTRUCTORS
     */

    public ViewBroker(ViewStore store, ConfigSource config, ShardResolver shardResolver) {
        this(store, config, shardResolver, Clock.systemUTC());
    }

    public ViewBroker(ViewStore store, ConfigSource config, ShardResolver shardResolver, Clock clock) {
        this.paramsBuilder = new LoadParamsBuilder(config, shardResolver, new KeyRangeResolver(config, clock));
        this.foldEngine = new ShardFoldEngine(store);
    }

    /*
     * LOADS
     */

    public ViewResponse load(ViewRequest request, String view) {
        return load(request, view, new ViewOptions());
    }

    // Key-range load over the "databases" option or the account's own shard.
    public ViewResponse load(ViewRequest request, String view, ViewOptions options) {
        QueryDescriptor d;
        try {
            d = buildLoadParams(request, view, options);
        } catch (LoadException e) {
            return rejected(request, view, options, e);
        }
        return run(d);
    }

    public ViewResponse loadRange(ViewRequest request, String view) {
        return loadRange(request, view, new ViewOptions());
    }

    // Time-bounded load; the range comes from "{range_key_name}_from" and "_to".
    public ViewResponse loadRange(ViewRequest request, String view, ViewOptions options) {
        QueryDescriptor d;
        try {
            d = buildLoadRangeParams(request, view, options);
        } catch (LoadException e) {
            return rejected(request, view, options, e);
        }
        return run(d);
    }

    public ViewResponse loadPartitioned(ViewRequest request, String view) {
        return loadPartitioned(request, view, new ViewOptions());
    }

    // Time-bounded load over every partition shard covering the range.
    public ViewResponse loadPartitioned(ViewRequest request, String view, ViewOptions options) {
        QueryDescriptor d;
        try {
            d = buildPartitionedParams(request, view, options);
        } catch (LoadException e) {
            return rejected(request, view, options, e);
        }
        return run(d);
    }

    /*
     * PARAMETERS
     */

    public QueryDescriptor buildLoadParams(ViewRequest request, String view, ViewOptions options)
            throws LoadException {
        return paramsBuilder.buildLoadParams(request, view, options);
    }

    public QueryDescriptor buildLoadRangeParams(ViewRequest request, String view, ViewOptions options)
            throws LoadException {
        return paramsBuilder.buildLoadRangeParams(request, view, options);
    }

    public QueryDescriptor buildPartitionedParams(ViewRequest request, String view, ViewOptions options)
            throws LoadException {
        return paramsBuilder.buildPartitionedParams(request, view, options);
    }

    private ViewResponse run(QueryDescriptor d) {
        long startTime = System.nanoTime();
        foldEngine.fold(d);
        ViewResponse response = ResponseFinalizer.finish(d);
        logger.debug("Loaded view {} from {} shards: {} rows, status {} in {}us", d.getView(), d.getShards().size(),
                d.getTotalQueried(), response.getStatus(), (System.nanoTime() - startTime) / 1000L);
        return response;
    }

    private static ViewResponse rejected(ViewRequest request, String view, ViewOptions options, LoadException e) {
        logger.info("Load of view {} rejected: {}", view, e.error);
        ChunkTransport transport = options.get(ViewOptions.TRANSPORT, ChunkTransport.class).orElse(null);
        return ViewResponse.failed(e.error, request.getEnvelope(), transport);
    }
}
