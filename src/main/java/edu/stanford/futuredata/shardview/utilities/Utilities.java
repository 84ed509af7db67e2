package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.protobuf.ByteString;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class Utilities {
    private static final Logger logger = LoggerFactory.getLogger(Utilities.class);

    public static final ObjectMapper objectMapper = new ObjectMapper();

    public static Pair<String, Integer> parseConnectString(String connectString) {
        String[] hostPort = connectString.split(":");
        String host = hostPort[0];
        Integer port = Integer.parseInt(hostPort[1]);
        return new Pair<>(host, port);
    }

    // Convert an arbitrary option value into a JSON value.  Null stays null.
    public static JsonNode toJson(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return objectMapper.valueToTree(value);
    }

    // A missing, null, empty-string or empty-container value.
    public static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        } else if (value.isContainerNode()) {
            return value.size() == 0;
        } else if (value.isTextual()) {
            return value.asText().isEmpty();
        }
        return false;
    }

    // True if the JSON value reads as a boolean true ("true" strings included).
    public static boolean isTrue(JsonNode value) {
        if (value == null) {
            return false;
        }
        return value.isBoolean() ? value.booleanValue() : "true".equalsIgnoreCase(value.asText());
    }

    public static boolean isFalse(JsonNode value) {
        if (value == null) {
            return false;
        }
        return value.isBoolean() ? !value.booleanValue() : "false".equalsIgnoreCase(value.asText());
    }

    // Encode rows as the comma-joined body of a JSON array, without the surrounding brackets.
    public static String encodeArrayBody(List<JsonNode> rows) throws JsonProcessingException {
        ArrayNode array = objectMapper.createArrayNode();
        array.addAll(rows);
        String encoded = objectMapper.writeValueAsString(array);
        return encoded.substring(1, encoded.length() - 1);
    }

    public static String encode(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.error("Serialization Failed {} {}", value, e.getMessage());
            return "null";
        }
    }

    public static ByteString stringToByteString(String s) {
        return ByteString.copyFromUtf8(s);
    }
}
