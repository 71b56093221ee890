package org.javai.converge.resource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts conditions from a generic resource held as a Jackson tree.
 *
 * <p>Reads {@code status.conditions}. A resource without a status block, or without a
 * condition list, has no conditions yet. This is normal right after creation. A condition list
 * that is not an array, or an entry missing {@code type} or {@code status}, is malformed.
 *
 * <pre>{@code
 * {
 *   "kind": "Infrastructure",
 *   "status": {
 *     "conditions": [
 *       {"type": "Ready", "status": "True", "reason": "Provisioned", "message": "..."}
 *     ]
 *   }
 * }
 * }</pre>
 */
public final class JsonConditionExtractor implements ConditionExtractor<JsonNode> {

    private final ObjectMapper mapper;

    public JsonConditionExtractor() {
        this(new ObjectMapper());
    }

    public JsonConditionExtractor(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public List<Condition> extract(JsonNode resource) throws ConditionDecodeException {
        if (resource == null || !resource.isObject()) {
            throw new ConditionDecodeException("resource is not a JSON object");
        }
        JsonNode conditions = resource.path("status").path("conditions");
        if (conditions.isMissingNode() || conditions.isNull()) {
            return List.of();
        }
        if (!conditions.isArray()) {
            throw new ConditionDecodeException(
                    "status.conditions must be an array, was " + conditions.getNodeType());
        }

        List<Condition> decoded = new ArrayList<>(conditions.size());
        int index = 0;
        for (JsonNode entry : conditions) {
            decoded.add(decode(entry, index++));
        }
        return List.copyOf(decoded);
    }

    private Condition decode(JsonNode entry, int index) throws ConditionDecodeException {
        if (!entry.hasNonNull("type") || !entry.hasNonNull("status")) {
            throw new ConditionDecodeException(
                    "status.conditions[" + index + "] must have a type and a status");
        }
        try {
            return mapper.treeToValue(entry, Condition.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConditionDecodeException("status.conditions[" + index + "] is malformed", e);
        }
    }
}
