package org.catalogregistry.csw.reader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.catalogregistry.harvest.pipeline.errors.SourceUnreachableException;
import org.catalogregistry.harvest.pipeline.ir.RawRecord;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.ir.SourceListing;
import org.catalogregistry.harvest.pipeline.source.RecordSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads CSW transaction documents from a file, or from every file of a directory.
 *
 * Loads are additive: the files given are not the whole content of the source, so the
 * listing is never complete and records missing from them are left alone.
 */
@Slf4j
public class FileRecordSource implements RecordSource {
    public static final String TYPE = "file";

    private final CswRecordParser parser = new CswRecordParser();

    @Override
    public SourceListing list(SourceEndpoint endpoint, String cursor) throws SourceUnreachableException {
        if (endpoint.location() == null) {
            throw new SourceUnreachableException("Source " + endpoint.name() + " has no path");
        }
        var records = new ArrayList<RawRecord>();
        for (var file : listFiles(Path.of(endpoint.location()))) {
            log.debug("Reading records from: {}", file);
            try (InputStream in = Files.newInputStream(file)) {
                var loaded = parser.parseTransaction(in);
                log.info("Read {} records from {}", loaded.size(), file);
                records.addAll(loaded);
            } catch (IOException | CswParseException e) {
                throw new SourceUnreachableException("Cannot read " + file + ": " + e.getMessage(), e);
            }
        }
        return SourceListing.partial(records, null);
    }

    static List<Path> listFiles(Path location) throws SourceUnreachableException {
        if (Files.isRegularFile(location)) {
            return List.of(location);
        }
        if (!Files.isDirectory(location)) {
            throw new SourceUnreachableException("Path is neither a file nor a directory: " + location);
        }
        var files = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(location)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        } catch (IOException e) {
            throw new SourceUnreachableException("Cannot list " + location + ": " + e.getMessage(), e);
        }
        files.sort(null);
        return files;
    }
}
