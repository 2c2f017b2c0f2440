package ai.anchor.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.Collections;

/**
 * Deterministic JSON encoding: object keys sorted at every level, no whitespace.
 *
 * <p>Decoding a canonical document and encoding it again yields the same bytes, which is what signature checks
 * rely on.
 */
final class CanonicalJson {
    static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {}

    static byte[] encode(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode canonical JSON", e);
        }
    }

    /** Deep copy of {@code node} with object fields in key order. */
    static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            var names = new ArrayList<String>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            var out = JsonNodeFactory.instance.objectNode();
            for (var name : names) {
                out.set(name, sorted(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            var out = JsonNodeFactory.instance.arrayNode();
            for (var element : node) {
                out.add(sorted(element));
            }
            return out;
        }
        return node;
    }
}
