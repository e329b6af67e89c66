package org.catalogregistry.harvest.pipeline.normalize;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.catalogregistry.harvest.pipeline.errors.MalformedRecordException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.RawRecord;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps raw catalog records into canonical records.
 *
 * Normalization trims strings, drops nulls, blank strings and empty objects, and
 * orders object keys, so semantically identical payloads serialize to the same
 * bytes no matter how the upstream ordered its fields. The fingerprint is the
 * SHA-256 of that serialization. Array element order is significant and kept.
 */
@Slf4j
public class RecordNormalizer {
    public static final String IDENTIFIER_FIELD = "identifier";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * @param seenAt timestamp recorded as the candidate's last-seen time
     * @return a candidate with revision 0; the change detector assigns the revision
     */
    public CanonicalRecord normalize(RawRecord raw, SourceEndpoint endpoint, Instant seenAt)
        throws MalformedRecordException {
        if (raw.payload() == null || raw.payload().isBlank()) {
            throw new MalformedRecordException("Record " + describe(raw) + " has no payload");
        }

        JsonNode parsed;
        try {
            parsed = OBJECT_MAPPER.readTree(raw.payload());
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Record " + describe(raw) + " is not valid JSON: "
                + e.getOriginalMessage(), e);
        }
        if (parsed == null || !parsed.isObject()) {
            throw new MalformedRecordException("Record " + describe(raw) + " payload must be a JSON object");
        }

        var normalized = normalizeObject((ObjectNode) parsed, raw);
        var localId = localIdOf(normalized, raw);
        if (localId == null) {
            throw new MalformedRecordException("Record " + describe(raw) + " has no identifier");
        }
        if (!normalized.has(IDENTIFIER_FIELD) || !normalized.get(IDENTIFIER_FIELD).isTextual()) {
            normalized = withField(normalized, IDENTIFIER_FIELD, NODES.textNode(localId), raw);
        }

        return new CanonicalRecord(
            endpoint.identifierFor(localId),
            endpoint.name(),
            normalized,
            fingerprint(normalized),
            0,
            false,
            seenAt
        );
    }

    /**
     * The identifier a record is stored under, resolved like {@link #normalize} does, for
     * records that may not normalize. Null when neither the payload nor the source names one.
     */
    public String identifierOf(RawRecord raw, SourceEndpoint endpoint) {
        ObjectNode payload = null;
        try {
            var parsed = raw.payload() == null ? null : OBJECT_MAPPER.readTree(raw.payload());
            if (parsed != null && parsed.isObject()) {
                payload = (ObjectNode) parsed;
            }
        } catch (JsonProcessingException e) {
            log.atDebug().setMessage("Payload of {} is not JSON, using its source id").addArgument(() -> describe(raw))
                .log();
        }
        var localId = payload == null ? localIdOf(NODES.objectNode(), raw) : localIdOf(payload, raw);
        return localId == null ? null : endpoint.identifierFor(localId);
    }

    /** The payload's identifier field, falling back to the id the source listed the record under. */
    private static String localIdOf(ObjectNode payload, RawRecord raw) {
        var fields = payload.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (IDENTIFIER_FIELD.equals(field.getKey().trim()) && field.getValue().isValueNode()
                && !field.getValue().isNull() && !field.getValue().asText().isBlank()) {
                return field.getValue().asText().trim();
            }
        }
        if (raw.localId() == null || raw.localId().isBlank()) {
            return null;
        }
        return raw.localId().trim();
    }

    /** SHA-256 hex digest of a normalized payload. */
    public static String fingerprint(ObjectNode normalizedPayload) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            var bytes = OBJECT_MAPPER.writeValueAsString(normalizedPayload).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Normalized payload could not be serialized", e);
        }
    }

    /** Keys are trimmed before sorting; two keys that trim to the same name make the record malformed. */
    static ObjectNode normalizeObject(ObjectNode input, RawRecord raw) throws MalformedRecordException {
        var fields = new TreeMap<String, JsonNode>();
        var entries = input.fields();
        while (entries.hasNext()) {
            var field = entries.next();
            var key = field.getKey().trim();
            if (fields.containsKey(key)) {
                throw new MalformedRecordException("Record " + describe(raw) + " has field '" + key
                    + "' more than once");
            }
            fields.put(key, field.getValue());
        }

        var output = NODES.objectNode();
        for (var field : fields.entrySet()) {
            var value = normalizeValue(field.getValue(), raw);
            if (value != null) {
                output.set(field.getKey(), value);
            }
        }
        return output;
    }

    private static JsonNode normalizeValue(JsonNode value, RawRecord raw) throws MalformedRecordException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isTextual()) {
            var trimmed = value.asText().trim();
            return trimmed.isEmpty() ? null : NODES.textNode(trimmed);
        }
        if (value.isObject()) {
            var object = normalizeObject((ObjectNode) value, raw);
            return object.isEmpty() ? null : object;
        }
        if (value.isArray()) {
            ArrayNode array = NODES.arrayNode();
            for (var element : value) {
                var normalized = normalizeValue(element, raw);
                if (normalized != null) {
                    array.add(normalized);
                }
            }
            return array;
        }
        return value;
    }

    private static ObjectNode withField(ObjectNode payload, String name, JsonNode value, RawRecord raw)
        throws MalformedRecordException {
        var copy = payload.deepCopy();
        copy.set(name, value);
        return normalizeObject(copy, raw);
    }

    private static String describe(RawRecord raw) {
        return raw.localId() == null ? "<unidentified>" : "'" + raw.localId() + "'";
    }
}
