package org.catalogregistry.registry.common.index;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import org.catalogregistry.harvest.pipeline.ir.IndexDocument;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One action of a {@code _bulk} request: index a catalog document, or delete one by identifier.
 * The {@code _type} metadata is only written for clusters that still need a mapping type.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BulkDocSection {
    public enum Action {
        INDEX,
        DELETE;

        String command() {
            return name().toLowerCase();
        }
    }

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final SerializedString LINE_BREAK = new SerializedString("\n");

    // Sections are serialized once while sizing the batch and again for the request body
    private static final LoadingCache<ObjectNode, String> SOURCE_CACHE = Caffeine.newBuilder()
        .maximumWeight(100L * 1000 * 1000)
        .weigher((ObjectNode k, String v) -> v.length())
        .weakKeys()
        .build(OBJECT_MAPPER::writeValueAsString);

    @EqualsAndHashCode.Include
    private final Action action;
    @EqualsAndHashCode.Include
    private final String indexName;
    @EqualsAndHashCode.Include
    private final String docId;
    private final String type;
    private final ObjectNode source;

    private BulkDocSection(Action action, String indexName, String docId, String type, ObjectNode source) {
        this.action = action;
        this.indexName = indexName;
        this.docId = docId;
        this.type = type;
        this.source = source;
    }

    public static BulkDocSection index(IndexDocument document, String type) {
        return new BulkDocSection(Action.INDEX, document.index(), document.id(), type, document.body());
    }

    public static BulkDocSection delete(String indexName, String id, String type) {
        return new BulkDocSection(Action.DELETE, indexName, id, type, null);
    }

    /** Newline-delimited body for {@code POST _bulk}, ending with the required trailing newline. */
    public static String convertToBulkRequestBody(Collection<BulkDocSection> sections) {
        var writer = new StringWriter();
        try (var gen = newGenerator(writer)) {
            for (var section : sections) {
                section.writeTo(gen);
            }
            gen.writeRaw(LINE_BREAK.getValue());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write bulk request of " + sections.size() + " sections", e);
        }
        return writer.toString();
    }

    /** Bytes this section adds to a request body, without its trailing newline. */
    public long getSerializedLength() {
        return asString().getBytes(StandardCharsets.UTF_8).length;
    }

    public String asString() {
        var writer = new StringWriter();
        try (var gen = newGenerator(writer)) {
            writeTo(gen);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write bulk " + action.command() + " of " + docId, e);
        }
        return writer.toString();
    }

    private static JsonGenerator newGenerator(StringWriter writer) throws IOException {
        var gen = OBJECT_MAPPER.getFactory().createGenerator(writer);
        gen.setRootValueSeparator(LINE_BREAK);
        return gen;
    }

    private void writeTo(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeObjectFieldStart(action.command());
        gen.writeStringField("_id", docId);
        if (type != null) {
            gen.writeStringField("_type", type);
        }
        gen.writeStringField("_index", indexName);
        gen.writeEndObject();
        gen.writeEndObject();
        if (source != null) {
            gen.writeRawValue(SOURCE_CACHE.get(source));
        }
    }
}
