package org.catalogregistry.harvest.pipeline.sysprof;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.catalogregistry.harvest.pipeline.detect.ChangeDetector;
import org.catalogregistry.harvest.pipeline.errors.MalformedRecordException;
import org.catalogregistry.harvest.pipeline.errors.RecordWriteException;
import org.catalogregistry.harvest.pipeline.errors.StoreUnavailableException;
import org.catalogregistry.harvest.pipeline.ir.CanonicalRecord;
import org.catalogregistry.harvest.pipeline.ir.ChangeType;
import org.catalogregistry.harvest.pipeline.ir.RawRecord;
import org.catalogregistry.harvest.pipeline.ir.RecordChange;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;
import org.catalogregistry.harvest.pipeline.normalize.RecordNormalizer;
import org.catalogregistry.harvest.pipeline.store.RecordStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Publishes the service's own profile document under a fixed identifier.
 *
 * Registration goes through the same normalize/detect path as harvested
 * records, so running it again with the same profile is reported as unchanged
 * and never creates a second registration.
 */
@Slf4j
public class SysprofRegistrar {
    public static final String SOURCE = SourceEndpoint.RESERVED_NAME;
    public static final String LOCAL_ID = "sysprof";
    public static final SourceEndpoint ENDPOINT = SourceEndpoint.builder().name(SOURCE).type("self").build();
    public static final String IDENTIFIER = ENDPOINT.identifierFor(LOCAL_ID);
    public static final String RUNTIME_FIELD = "system";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final RecordStore store;
    private final ServiceProfile profile;
    private final RecordNormalizer normalizer;
    private final ChangeDetector detector;
    private final Clock clock;

    public SysprofRegistrar(RecordStore store, ServiceProfile profile, Clock clock) {
        this.store = store;
        this.profile = profile;
        this.normalizer = new RecordNormalizer();
        this.detector = new ChangeDetector();
        this.clock = clock;
    }

    /**
     * The profile document. Runtime details of the running installation are kept
     * under {@code system}, which is left out of the fingerprint.
     */
    public ObjectNode describe() {
        var doc = OBJECT_MAPPER.createObjectNode();
        doc.put("identifier", LOCAL_ID);
        doc.put("type", "service");
        doc.put("title", profile.title());
        doc.put("abstract", profile.abstractText());
        putList(doc, "keywords", profile.keywords());
        doc.put("keywords_type", profile.keywordsType());
        doc.put("fees", profile.fees());
        doc.put("access_constraints", profile.accessConstraints());
        putList(doc, "profiles", profile.profiles());

        var provider = doc.putObject("provider");
        provider.put("name", profile.providerName());
        provider.put("url", profile.providerUrl());

        var contact = doc.putObject("contact");
        contact.put("name", profile.contactName());
        contact.put("position", profile.contactPosition());
        contact.put("email", profile.contactEmail());
        contact.put("url", profile.contactUrl());
        contact.put("role", profile.contactRole());

        var system = doc.putObject(RUNTIME_FIELD);
        system.put("registry_version", registryVersion());
        system.put("java_version", System.getProperty("java.version"));
        system.put("java_vendor", System.getProperty("java.vendor"));
        system.put("os_name", System.getProperty("os.name"));
        system.put("os_arch", System.getProperty("os.arch"));
        system.put("jackson_version", com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION.toString());
        return doc;
    }

    /**
     * Upsert the profile document. A run with the same identification keeps the
     * revision; its runtime details are refreshed in place.
     */
    public RecordChange register() throws StoreUnavailableException, RecordWriteException {
        var raw = new RawRecord(LOCAL_ID, describe().toString());
        try {
            var normalized = normalizer.normalize(raw, ENDPOINT, clock.instant());
            var identification = normalized.payload().deepCopy();
            identification.remove(RUNTIME_FIELD);
            var candidate = new CanonicalRecord(normalized.identifier(), normalized.source(), normalized.payload(),
                RecordNormalizer.fingerprint(identification), 0, false, normalized.lastSeen());
            var change = detector.detect(candidate, store.get(IDENTIFIER));
            if (change.type() == ChangeType.UNCHANGED) {
                var stored = change.record();
                change = new RecordChange(ChangeType.UNCHANGED, new CanonicalRecord(stored.identifier(),
                    stored.source(), candidate.payload(), stored.fingerprint(), stored.revision(), false,
                    stored.lastSeen()));
            }
            store.upsert(change.record());
            log.info("Service profile {} {} at revision {}", IDENTIFIER, change.type(), change.record().revision());
            return change;
        } catch (MalformedRecordException e) {
            throw new IllegalStateException("Service profile document is malformed", e);
        }
    }

    public Optional<ObjectNode> registered() throws StoreUnavailableException {
        return store.get(IDENTIFIER).filter(r -> !r.tombstoned()).map(r -> r.payload());
    }

    private static void putList(ObjectNode doc, String field, List<String> values) {
        if (values != null) {
            var array = doc.putArray(field);
            values.forEach(array::add);
        }
    }

    private static String registryVersion() {
        var version = SysprofRegistrar.class.getPackage().getImplementationVersion();
        return version != null ? version : "development";
    }
}
