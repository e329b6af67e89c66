package org.catalogregistry.registry;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineTest {

    @Test
    void commandFirstForm() throws Exception {
        var parsed = CommandLine.parse(new String[] {"load_records", "-p", "/data/xml", "-s", "hypermap"});

        assertEquals(CommandLine.LOAD_RECORDS, parsed.command());
        assertEquals("/data/xml", parsed.path());
        assertEquals("hypermap", parsed.selector());
        assertNull(parsed.configFile());
    }

    @Test
    void pycswForm() throws Exception {
        var parsed = CommandLine.parse(new String[] {"pycsw", "-c", "setup_db", "-f", "registry.yml"});

        assertEquals(CommandLine.SETUP_DB, parsed.command());
        assertEquals(Path.of("registry.yml"), parsed.configFile());
    }

    @Test
    void harvestMayNameOneSource() throws Exception {
        assertEquals("east", CommandLine.parse(new String[] {"harvest", "-s", "east"}).selector());
        assertNull(CommandLine.parse(new String[] {"harvest"}).selector());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "pycsw",
        "pycsw -c",
        "drop_db",
        "pycsw -c load_index",
        "harvest -x 1",
        "load_records -s hypermap",
        "load_records -p /data/xml",
    })
    void malformedCommandLinesAreRejected(String line) {
        var args = line.isEmpty() ? new String[0] : line.split(" ");

        assertThrows(UsageException.class, () -> CommandLine.parse(args));
    }
}
