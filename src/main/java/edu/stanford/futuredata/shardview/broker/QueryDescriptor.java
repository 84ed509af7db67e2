package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.interfaces.ChunkTransport;
import edu.stanford.futuredata.shardview.interfaces.ChunkedMapper;
import edu.stanford.futuredata.shardview.interfaces.RowMapper;
import edu.stanford.futuredata.shardview.utilities.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Everything one view load needs, plus the fold's running state.  Created once per request by
 * {@link LoadParamsBuilder} and then owned by a single {@link ShardFoldEngine} run.
 */
public class QueryDescriptor {
    private final String view;
    private final List<String> shards;
    private final Direction direction;
    private final JsonNode startKey;
    private final JsonNode endKey;
    private final Long startTime;
    private final Long endTime;
    private final Integer pageSize;
    private final int chunkSize;
    private final boolean chunked;
    private final ChunkFormat chunkFormat;
    private final RowMapper mapper;
    private final ChunkedMapper chunkedMapper;
    private final ChunkTransport transport;
    private final StoreQueryOptions storeOptions;
    private final ViewRequest request;

    // Fold state.
    int totalQueried = 0;
    JsonNode lastKey = null;
    final List<JsonNode> queriedRows = new ArrayList<>();
    private boolean startedChunk = false;
    private ViewResponse.Status status = ViewResponse.Status.SUCCESS;
    private LoadError error = null;

    private QueryDescriptor(Builder b) {
        this.view = b.view;
        this.shards = Collections.unmodifiableList(new ArrayList<>(b.shards));
        this.direction = b.direction;
        this.startKey = b.startKey;
        this.endKey = b.endKey;
        this.startTime = b.startTime;
        this.endTime = b.endTime;
        this.pageSize = b.pageSize;
        this.chunkSize = b.chunkSize;
        this.chunked = b.chunked;
        this.chunkFormat = b.chunkFormat;
        this.mapper = b.mapper;
        this.chunkedMapper = b.chunkedMapper;
        this.transport = b.transport;
        this.storeOptions = b.storeOptions;
        this.request = b.request;
        assert(!shards.isEmpty());
    }

    static Builder builder() {
        return new Builder();
    }

    public String getView() {
        return view;
    }

    public List<String> getShards() {
        return shards;
    }

    public Direction getDirection() {
        return direction;
    }

    public Optional<JsonNode> getStartKey() {
        return Optional.ofNullable(startKey);
    }

    public Optional<JsonNode> getEndKey() {
        return Optional.ofNullable(endKey);
    }

    public Optional<Long> getStartTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<Long> getEndTime() {
        return Optional.ofNullable(endTime);
    }

    // Null when the load is not paginated.
    public Integer getPageSize() {
        return pageSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public boolean isChunked() {
        return chunked;
    }

    public ChunkFormat getChunkFormat() {
        return chunkFormat;
    }

    public RowMapper getMapper() {
        return mapper;
    }

    public ChunkedMapper getChunkedMapper() {
        return chunkedMapper;
    }

    public ChunkTransport getTransport() {
        return transport;
    }

    public StoreQueryOptions getStoreOptions() {
        return storeOptions;
    }

    public ViewRequest getRequest() {
        return request;
    }

    public int getTotalQueried() {
        return totalQueried;
    }

    public Optional<JsonNode> getLastKey() {
        return Optional.ofNullable(lastKey);
    }

    public List<JsonNode> getQueriedRows() {
        return Collections.unmodifiableList(queriedRows);
    }

    public boolean isStartedChunk() {
        return startedChunk;
    }

    // Once the chunked envelope has been opened it stays open.
    void markChunkStarted() {
        startedChunk = true;
    }

    public ViewResponse.Status getStatus() {
        return status;
    }

    public Optional<LoadError> getError() {
        return Optional.ofNullable(error);
    }

    void succeed() {
        status = ViewResponse.Status.SUCCESS;
        error = null;
    }

    void fail(LoadError error) {
        this.status = ViewResponse.Status.ERROR;
        this.error = error;
    }

    static class Builder {
        private String view;
        private List<String> shards = List.of();
        private Direction direction = Direction.ASCENDING;
        private JsonNode startKey;
        private JsonNode endKey;
        private Long startTime;
        private Long endTime;
        private Integer pageSize;
        private int chunkSize;
        private boolean chunked;
        private ChunkFormat chunkFormat = ChunkFormat.JSON;
        private RowMapper mapper;
        private ChunkedMapper chunkedMapper;
        private ChunkTransport transport;
        private StoreQueryOptions storeOptions;
        private ViewRequest request;

        Builder view(String view) {
            this.view = view;
            return this;
        }

        Builder shards(List<String> shards) {
            this.shards = shards;
            return this;
        }

        Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        Builder keys(JsonNode startKey, JsonNode endKey) {
            this.startKey = startKey;
            this.endKey = endKey;
            return this;
        }

        Builder timeRange(long startTime, long endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
            return this;
        }

        Builder pageSize(Integer pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        Builder chunked(boolean chunked, ChunkFormat chunkFormat) {
            this.chunked = chunked;
            this.chunkFormat = chunkFormat;
            return this;
        }

        Builder mapper(RowMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        Builder chunkedMapper(ChunkedMapper chunkedMapper) {
            this.chunkedMapper = chunkedMapper;
            return this;
        }

        Builder transport(ChunkTransport transport) {
            this.transport = transport;
            return this;
        }

        Builder storeOptions(StoreQueryOptions storeOptions) {
            this.storeOptions = storeOptions;
            return this;
        }

        Builder request(ViewRequest request) {
            this.request = request;
            return this;
        }

        String getView() {
            return view;
        }

        List<String> getShards() {
            return shards;
        }

        Direction getDirection() {
            return direction;
        }

        JsonNode getStartKey() {
            return startKey;
        }

        JsonNode getEndKey() {
            return endKey;
        }

        QueryDescriptor build() {
            return new QueryDescriptor(this);
        }
    }
}
