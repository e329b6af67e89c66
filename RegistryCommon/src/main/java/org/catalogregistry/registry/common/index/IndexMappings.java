package org.catalogregistry.registry.common.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the catalog index body for a given server version.
 */
public final class IndexMappings {
    public static final String LEGACY_TYPE = "layer";
    public static final String DEFAULT_PRECISION = "500m";
    public static final String ALL_TEXT_FIELD = "alltext";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private IndexMappings() {}

    public static ObjectNode catalogIndexBody(ServerVersion version, String precision) {
        var body = OBJECT_MAPPER.createObjectNode();
        var mappings = body.putObject("mappings");
        var typeMapping = version.isTypeless() ? mappings : mappings.putObject(LEGACY_TYPE);
        var properties = typeMapping.putObject("properties");

        var shape = properties.putObject(IndexDocumentProjector.GEOSHAPE);
        shape.put("type", "geo_shape");
        if (version.supportsShapePrecision()) {
            shape.put("tree", "quadtree");
            shape.put("precision", precision == null ? DEFAULT_PRECISION : precision);
        }

        properties.set("title", textField(version).put("copy_to", ALL_TEXT_FIELD));
        properties.set("abstract", textField(version).put("copy_to", ALL_TEXT_FIELD));
        properties.set(ALL_TEXT_FIELD, textField(version));

        properties.set(IndexDocumentProjector.SOURCE, keywordField(version));
        properties.set(IndexDocumentProjector.IDENTIFIER, keywordField(version));
        properties.set(IndexDocumentProjector.ORIGINATOR, keywordField(version));
        properties.putObject(IndexDocumentProjector.DATE).put("type", "date");
        for (var bound : new String[] {"min_x", "min_y", "max_x", "max_y"}) {
            properties.putObject(bound).put("type", "double");
        }
        return body;
    }

    private static ObjectNode textField(ServerVersion version) {
        var field = OBJECT_MAPPER.createObjectNode();
        if (version.hasTextType()) {
            field.put("type", "text");
        } else {
            field.put("type", "string");
            field.put("index", "analyzed");
        }
        return field;
    }

    private static ObjectNode keywordField(ServerVersion version) {
        var field = OBJECT_MAPPER.createObjectNode();
        if (version.hasTextType()) {
            field.put("type", "keyword");
        } else {
            field.put("type", "string");
            field.put("index", "not_analyzed");
        }
        return field;
    }
}
