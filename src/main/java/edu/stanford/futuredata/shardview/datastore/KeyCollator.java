package edu.stanford.futuredata.shardview.datastore;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

/**
 * Orders view keys the way CouchDB collates them: null, false, true, numbers, strings, arrays
 * (element by element, shorter first on a tie), then objects (field by field).
 */
public class KeyCollator implements Comparator<JsonNode> {

    public static final KeyCollator INSTANCE = new KeyCollator();

    @Override
    public int compare(JsonNode a, JsonNode b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (rankA) {
            case 3:
                return a.decimalValue().compareTo(b.decimalValue());
            case 4:
                return a.asText().compareTo(b.asText());
            case 5:
                return compareArrays(a, b);
            case 6:
                return compareObjects(a, b);
            default:
                return 0;
        }
    }

    private static int rank(JsonNode key) {
        if (key == null || key.isNull() || key.isMissingNode()) {
            return 0;
        } else if (key.isBoolean()) {
            return key.booleanValue() ? 2 : 1;
        } else if (key.isNumber()) {
            return 3;
        } else if (key.isTextual()) {
            return 4;
        } else if (key.isArray()) {
            return 5;
        }
        return 6;
    }

    private int compareArrays(JsonNode a, JsonNode b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    private int compareObjects(JsonNode a, JsonNode b) {
        Iterator<Map.Entry<String, JsonNode>> itA = a.fields();
        Iterator<Map.Entry<String, JsonNode>> itB = b.fields();
        while (itA.hasNext() && itB.hasNext()) {
            Map.Entry<String, JsonNode> fieldA = itA.next();
            Map.Entry<String, JsonNode> fieldB = itB.next();
            int c = fieldA.getKey().compareTo(fieldB.getKey());
            if (c != 0) {
                return c;
            }
            c = compare(fieldA.getValue(), fieldB.getValue());
            if (c != 0) {
                return c;
            }
        }
        return Boolean.compare(itA.hasNext(), itB.hasNext());
    }
}
