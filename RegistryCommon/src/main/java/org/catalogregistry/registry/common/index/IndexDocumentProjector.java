package org.catalogregistry.registry.common.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.IndexDocument;

import lombok.extern.slf4j.Slf4j;

/**
 * Projects a canonical record into the search document of its catalog.
 *
 * Records without a usable bounding box are placed on the whole world, so
 * every document carries a valid envelope.
 */
@Slf4j
public class IndexDocumentProjector {
    public static final String GEOSHAPE = "layer_geoshape";
    public static final String IDENTIFIER = "layer_identifier";
    public static final String ORIGINATOR = "layer_originator";
    public static final String DATE = "layer_date";
    public static final String SOURCE = "source";

    static final double[] WORLD = {-180, -90, 180, 90};

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public IndexDocument project(String catalog, CanonicalRecord record) {
        var payload = record.payload();
        var doc = OBJECT_MAPPER.createObjectNode();
        putText(doc, "title", payload.get("title"));
        putText(doc, "abstract", payload.get("abstract"));

        var bbox = boundingBox(record.identifier(), payload.get("bbox"));
        var bboxArray = doc.putArray("bbox");
        for (var value : bbox) {
            bboxArray.add(value);
        }
        doc.put("min_x", bbox[0]);
        doc.put("min_y", bbox[1]);
        doc.put("max_x", bbox[2]);
        doc.put("max_y", bbox[3]);

        putText(doc, DATE, payload.get("modified"));
        putText(doc, ORIGINATOR, payload.get("creator"));
        doc.put(IDENTIFIER, record.identifier());
        doc.put(SOURCE, record.source());
        doc.put("revision", record.revision());
        if (payload.has("subject")) {
            doc.set("keywords", payload.get("subject"));
        }
        if (payload.has("references")) {
            doc.set("references", payload.get("references"));
        }

        var shape = doc.putObject(GEOSHAPE);
        shape.put("type", "envelope");
        var coordinates = shape.putArray("coordinates");
        coordinates.addArray().add(bbox[0]).add(bbox[3]);
        coordinates.addArray().add(bbox[2]).add(bbox[1]);

        return new IndexDocument(record.identifier(), catalog, doc);
    }

    private static void putText(ObjectNode doc, String field, JsonNode value) {
        if (value != null && !value.isNull()) {
            doc.put(field, value.asText());
        }
    }

    static double[] boundingBox(String identifier, JsonNode bbox) {
        if (bbox == null || !bbox.isObject()) {
            return WORLD.clone();
        }
        var minx = bbox.path("minx");
        var miny = bbox.path("miny");
        var maxx = bbox.path("maxx");
        var maxy = bbox.path("maxy");
        if (!minx.isNumber() || !miny.isNumber() || !maxx.isNumber() || !maxy.isNumber()) {
            log.debug("Record {} has an incomplete bounding box, indexing it on the whole world", identifier);
            return WORLD.clone();
        }
        var box = new double[] {minx.asDouble(), miny.asDouble(), maxx.asDouble(), maxy.asDouble()};
        var valid = box[0] <= box[2] && box[1] <= box[3]
            && box[0] >= -180 && box[2] <= 180 && box[1] >= -90 && box[3] <= 90;
        if (!valid) {
            log.warn("Record {} has an invalid bounding box {},{},{},{}; indexing it on the whole world",
                identifier, box[0], box[1], box[2], box[3]);
            return WORLD.clone();
        }
        return box;
    }
}
