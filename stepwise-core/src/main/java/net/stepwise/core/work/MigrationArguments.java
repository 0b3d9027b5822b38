package net.stepwise.core.work;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.stepwise.core.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 마이그레이션 인자. JSON 배열로 직렬화되어 저장되며, 직렬화 결과는 유일성 키의 일부다.
 * 객체 키는 이름순으로 정렬해 두므로 같은 인자는 항상 같은 문자열이 된다.
 */
public final class MigrationArguments {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final ArrayNode values;

    private MigrationArguments(ArrayNode values) {
        this.values = (ArrayNode) canonical(values);
    }

    private static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode sorted = MAPPER.createObjectNode();
            for (String name : names) sorted.set(name, canonical(node.get(name)));
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = MAPPER.createArrayNode();
            for (JsonNode child : node) copy.add(canonical(child));
            return copy;
        }
        return node;
    }

    public static MigrationArguments of(Object... args) {
        return new MigrationArguments(MAPPER.valueToTree(Arrays.asList(args)));
    }

    public static MigrationArguments empty() {
        return new MigrationArguments(MAPPER.createArrayNode());
    }

    public static MigrationArguments parse(String json) {
        if (json == null || json.isBlank()) return empty();
        try {
            JsonNode node = MAPPER.readTree(json);
            if (!node.isArray()) throw new ValidationException("Migration arguments must be a JSON array: " + json);
            return new MigrationArguments((ArrayNode) node);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed migration arguments: " + json, e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public int size() { return values.size(); }

    public JsonNode get(int index) {
        JsonNode n = values.get(index);
        if (n == null) throw new ValidationException("Missing migration argument #" + index);
        return n;
    }

    public Optional<JsonNode> find(int index) {
        JsonNode n = values.get(index);
        return n == null || n.isNull() ? Optional.empty() : Optional.of(n);
    }

    public String getString(int index) {
        JsonNode n = get(index);
        if (!n.isTextual()) throw new ValidationException("Migration argument #" + index + " must be a string");
        return n.asText();
    }

    public long getLong(int index) {
        JsonNode n = get(index);
        if (!n.canConvertToLong()) throw new ValidationException("Migration argument #" + index + " must be an integer");
        return n.asLong();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MigrationArguments other && values.equals(other.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return toJson(); }
}
