package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;
import java.util.function.Predicate;

/**
 * The caller's side of one view load: who is asking, what the request carried, and the envelope
 * the response should be built on.
 */
public class ViewRequest {
    public static final String START_KEY = "start_key";
    public static final String END_KEY = "end_key";

    private final String accountId;
    private final Map<String, JsonNode> requestValues;
    private final boolean paginate;
    private final Integer pageSize;
    private final Predicate<JsonNode> docFilter;
    private final ObjectNode envelope;

    private ViewRequest(Builder b) {
        this.accountId = b.accountId;
        this.requestValues = Collections.unmodifiableMap(new HashMap<>(b.requestValues));
        this.paginate = b.paginate;
        this.pageSize = b.pageSize;
        this.docFilter = b.docFilter;
        this.envelope = b.envelope.deepCopy();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getAccountId() {
        return Optional.ofNullable(accountId);
    }

    // The shard holding the account's own documents.
    public Optional<String> getAccountShard() {
        return getAccountId().map(id -> "account/" + id);
    }

    // A request value, or null if absent or JSON null.
    public JsonNode reqValue(String key) {
        JsonNode value = requestValues.get(key);
        return (value == null || value.isNull()) ? null : value;
    }

    public Optional<Long> reqLong(String key) {
        JsonNode value = reqValue(key);
        if (value == null) {
            return Optional.empty();
        } else if (value.canConvertToLong()) {
            return Optional.of(value.longValue());
        }
        try {
            return Optional.of(Long.parseLong(value.asText()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean reqIsTrue(String key) {
        return Utilities.isTrue(reqValue(key));
    }

    public boolean reqIsFalse(String key) {
        return Utilities.isFalse(reqValue(key));
    }

    public boolean shouldPaginate() {
        return paginate;
    }

    public Optional<Integer> getPageSize() {
        return Optional.ofNullable(pageSize);
    }

    public Optional<Predicate<JsonNode>> getDocFilter() {
        return Optional.ofNullable(docFilter);
    }

    public boolean hasDocFilter() {
        return docFilter != null;
    }

    // A fresh copy of the caller's envelope.
    public ObjectNode getEnvelope() {
        return envelope.deepCopy();
    }

    public static class Builder {
        private String accountId;
        private final Map<String, JsonNode> requestValues = new HashMap<>();
        private boolean paginate = true;
        private Integer pageSize;
        private Predicate<JsonNode> docFilter;
        private ObjectNode envelope = Utilities.objectMapper.createObjectNode();

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder requestValue(String key, Object value) {
            requestValues.put(key, Utilities.toJson(value));
            return this;
        }

        public Builder paginate(boolean paginate) {
            this.paginate = paginate;
            return this;
        }

        public Builder pageSize(Integer pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        // Rows whose document fails the filter never reach the caller's mapper.
        public Builder docFilter(Predicate<JsonNode> docFilter) {
            this.docFilter = docFilter;
            return this;
        }

        public Builder envelope(ObjectNode envelope) {
            this.envelope = envelope;
            return this;
        }

        public ViewRequest build() {
            return new ViewRequest(this);
        }
    }
}
