package org.catalogregistry.harvest.pipeline.normalize;

import java.time.Instant;

import org.catalogregistry.harvest.pipeline.errors.MalformedRecordException;
import org.catalogregistry.harvest.pipeline.ir.HarvestErrorKind;
import org.catalogregistry.harvest.pipeline.ir.RawRecord;
import org.catalogregistry.harvest.pipeline.ir.SourceEndpoint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class RecordNormalizerTest {
    private static final SourceEndpoint ENDPOINT = SourceEndpoint.builder().name("geodata").type("csw").build();
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final RecordNormalizer normalizer = new RecordNormalizer();

    @Test
    void fieldOrderDoesNotChangeTheFingerprint() throws Exception {
        var first = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\"title\":\"Rivers\",\"bbox\":{\"minx\":1,\"maxx\":2}}"), ENDPOINT, NOW);
        var second = normalizer.normalize(new RawRecord("r1",
            "{\"bbox\":{\"maxx\":2,\"minx\":1},\"title\":\"Rivers\",\"identifier\":\"r1\"}"), ENDPOINT, NOW);

        assertEquals(first.fingerprint(), second.fingerprint());
        assertEquals(first.payload(), second.payload());
    }

    @Test
    void whitespaceAndEmptyValuesAreNormalizedAway() throws Exception {
        var padded = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\" r1 \",\"title\":\"  Rivers \",\"abstract\":\"   \",\"extra\":null,\"meta\":{}}"),
            ENDPOINT, NOW);
        var plain = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\"title\":\"Rivers\"}"), ENDPOINT, NOW);

        assertEquals(plain.fingerprint(), padded.fingerprint());
        assertFalse(padded.payload().has("abstract"));
        assertFalse(padded.payload().has("meta"));
        assertEquals("Rivers", padded.text("title"));
    }

    @Test
    void paddedKeysSortLikeTheirTrimmedNames() throws Exception {
        var padded = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\" b\":1,\"a\":2}"), ENDPOINT, NOW);
        var plain = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\"b\":1,\"a\":2}"), ENDPOINT, NOW);

        assertEquals(plain.fingerprint(), padded.fingerprint());
        assertEquals("{\"a\":2,\"b\":1,\"identifier\":\"r1\"}", padded.payload().toString());
    }

    @Test
    void keysThatTrimToTheSameNameAreRejected() {
        var e = assertThrows(MalformedRecordException.class, () -> normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\"title\":\"Rivers\",\"title \":\"Lakes\"}"), ENDPOINT, NOW));
        assertTrue(e.getMessage().contains("'title'"));
    }

    @Test
    void identifierOfPrefersThePayloadIdentifier() {
        assertEquals("geodata:A", normalizer.identifierOf(new RawRecord("row-1",
            "{\"identifier\":\" A \",\"title\":\"x\",\"title \":\"y\"}"), ENDPOINT));
        assertEquals("geodata:row-1", normalizer.identifierOf(new RawRecord(" row-1 ", "{broken"), ENDPOINT));
        assertEquals("geodata:row-1", normalizer.identifierOf(new RawRecord("row-1", "{\"identifier\":\"  \"}"),
            ENDPOINT));
        assertNull(normalizer.identifierOf(new RawRecord(null, "[1]"), ENDPOINT));
    }

    @Test
    void arrayOrderIsSignificant() throws Exception {
        var ab = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\"subjects\":[\"a\",\"b\"]}"), ENDPOINT, NOW);
        var ba = normalizer.normalize(new RawRecord("r1",
            "{\"identifier\":\"r1\",\"subjects\":[\"b\",\"a\"]}"), ENDPOINT, NOW);

        assertNotEquals(ab.fingerprint(), ba.fingerprint());
    }

    @Test
    void contentChangeChangesTheFingerprint() throws Exception {
        var before = normalizer.normalize(new RawRecord("r1", "{\"identifier\":\"r1\",\"title\":\"Rivers\"}"),
            ENDPOINT, NOW);
        var after = normalizer.normalize(new RawRecord("r1", "{\"identifier\":\"r1\",\"title\":\"Lakes\"}"),
            ENDPOINT, NOW);

        assertNotEquals(before.fingerprint(), after.fingerprint());
    }

    @Test
    void identifierIsNamespacedBySource() throws Exception {
        var record = normalizer.normalize(new RawRecord("r1", "{\"identifier\":\"r1\"}"), ENDPOINT, NOW);

        assertEquals("geodata:r1", record.identifier());
        assertEquals("geodata", record.source());
        assertEquals(0, record.revision());
        assertFalse(record.tombstoned());
        assertEquals(NOW, record.lastSeen());
    }

    @Test
    void localIdIsUsedWhenThePayloadHasNoIdentifier() throws Exception {
        var record = normalizer.normalize(new RawRecord("r7", "{\"title\":\"Roads\"}"), ENDPOINT, NOW);

        assertEquals("geodata:r7", record.identifier());
        assertEquals("r7", record.text("identifier"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "not json", "[1,2]", "\"text\"", "{\"title\":\"no id\"}"})
    void malformedPayloadsAreRejected(String payload) {
        var e = assertThrows(MalformedRecordException.class,
            () -> normalizer.normalize(new RawRecord(null, payload), ENDPOINT, NOW));
        assertEquals(HarvestErrorKind.MALFORMED_RECORD, e.getKind());
        assertFalse(e.isPassScoped());
    }

    @Test
    void fingerprintIsAHexSha256() throws Exception {
        var record = normalizer.normalize(new RawRecord("r1", "{\"identifier\":\"r1\"}"), ENDPOINT, NOW);

        assertTrue(record.fingerprint().matches("[0-9a-f]{64}"));
    }
}
