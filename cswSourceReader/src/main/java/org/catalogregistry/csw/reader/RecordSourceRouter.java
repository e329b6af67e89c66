package org.catalogregistry.csw.reader;

import java.util.LinkedHashMap;
import java.util.Map;

import org.catalogregistry.harvest.pipeline.errors.SourceUnreachableException;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.ir.SourceListing;
import org.catalogregistry.harvest.pipeline.source.RecordSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Hands each endpoint to the reader registered for its type.
 */
@Slf4j
public class RecordSourceRouter implements RecordSource {
    private final Map<String, RecordSource> readers = new LinkedHashMap<>();

    public RecordSourceRouter register(String type, RecordSource reader) {
        readers.put(type.toLowerCase(), reader);
        return this;
    }

    /** Readers for CSW services and transaction files. */
    public static RecordSourceRouter standard() {
        return new RecordSourceRouter()
            .register(CswRecordSource.TYPE, new CswRecordSource())
            .register(FileRecordSource.TYPE, new FileRecordSource());
    }

    @Override
    public SourceListing list(SourceEndpoint endpoint, String cursor) throws SourceUnreachableException {
        var type = endpoint.type() == null ? CswRecordSource.TYPE : endpoint.type().toLowerCase();
        var reader = readers.get(type);
        if (reader == null) {
            throw new SourceUnreachableException("No reader for type '" + type + "' of source " + endpoint.name());
        }
        return reader.list(endpoint, cursor);
    }

    @Override
    public void close() throws Exception {
        Exception failure = null;
        for (var reader : readers.values()) {
            try {
                reader.close();
            } catch (Exception e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
