package com.di.rawingest.precheck;

import com.di.rawingest.handler.ObjectStorage;
import com.di.rawingest.handler.TableCatalog;
import com.di.rawingest.schema.TableRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for IngestPrechecks.
 */
@DisplayName("IngestPrechecks Tests")
class IngestPrechecksTest {

    @TempDir
    Path tmp;

    private RecordingStorage storage;
    private RecordingCatalog catalog;

    @BeforeEach
    void setUp() {
        storage = new RecordingStorage();
        catalog = new RecordingCatalog();
    }

    // ============================================================================
    // Input reachability
    // ============================================================================

    @Test
    @DisplayName("Should find an existing local file without touching object storage")
    void testInputReachable_LocalFile() throws Exception {
        Path csv = Files.writeString(tmp.resolve("data.csv"), "id,name\n1,John");
        IngestPrechecks prechecks = new IngestPrechecks(storage, catalog, "/gcs/");

        assertTrue(prechecks.inputReachable(csv.toString()));
        assertTrue(storage.calls.isEmpty());
    }

    @Test
    @DisplayName("Should report a missing local file as unreachable")
    void testInputReachable_MissingLocalFile() {
        IngestPrechecks prechecks = new IngestPrechecks(storage, catalog, "/gcs/");

        assertFalse(prechecks.inputReachable(tmp.resolve("missing.csv").toString()));
        assertFalse(prechecks.inputReachable("non_existing.csv"));
        assertFalse(prechecks.inputReachable(""));
        assertTrue(storage.calls.isEmpty());
    }

    @Test
    @DisplayName("Should treat an invalid local path as unreachable")
    void testInputReachable_InvalidPath() {
        IngestPrechecks prechecks = new IngestPrechecks(storage, catalog, "/gcs/");
        assertFalse(prechecks.inputReachable("bad\u0000path.csv"));
    }

    @Test
    @DisplayName("Should check gs:// inputs through object storage")
    void testInputReachable_Gcs() {
        storage.existing.add("gs://bucket/data.csv");
        IngestPrechecks prechecks = new IngestPrechecks(storage, catalog, "/gcs/");

        assertTrue(prechecks.inputReachable("gs://bucket/data.csv"));
        assertFalse(prechecks.inputReachable("gs://bucket/missing.csv"));
        assertEquals(List.of("gs://bucket/data.csv", "gs://bucket/missing.csv"), storage.calls);
    }

    @Test
    @DisplayName("Should ask object storage even when the bucket is mounted locally")
    void testInputReachable_GcsMountedButMissingRemotely() throws Exception {
        Files.createDirectories(tmp.resolve("bucket"));
        Files.writeString(tmp.resolve("bucket/data.csv"), "id\n1");
        IngestPrechecks prechecks = new IngestPrechecks(storage, catalog, tmp + "/");

        assertFalse(prechecks.inputReachable("gs://bucket/data.csv"));
        assertEquals(1, storage.calls.size());
    }

    // ============================================================================
    // Destination
    // ============================================================================

    @Test
    @DisplayName("Should delegate the destination lookup to the catalog")
    void testDestinationExists() {
        catalog.existing.add("project.dataset.table");
        IngestPrechecks prechecks = new IngestPrechecks(storage, catalog, "/gcs/");

        assertTrue(prechecks.destinationExists(TableRef.parse("project.dataset.table")));
        assertFalse(prechecks.destinationExists(TableRef.parse("project.dataset.other")));
        assertEquals(2, catalog.calls);
    }

    @Test
    @DisplayName("Should propagate catalog failures other than not-found")
    void testDestinationExists_Failure() {
        TableCatalog failing = table -> {
            throw new IllegalStateException("catalog unavailable");
        };
        IngestPrechecks prechecks = new IngestPrechecks(storage, failing, "/gcs/");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> prechecks.destinationExists(TableRef.parse("project.dataset.table")));
        assertEquals("catalog unavailable", ex.getMessage());
    }

    static final class RecordingStorage implements ObjectStorage {
        final Set<String> existing = new HashSet<>();
        final List<String> calls = new ArrayList<>();

        @Override
        public boolean exists(String uri) {
            calls.add(uri);
            return existing.contains(uri);
        }
    }

    static final class RecordingCatalog implements TableCatalog {
        final Set<String> existing = new HashSet<>();
        int calls;

        @Override
        public boolean tableExists(TableRef table) {
            calls++;
            return existing.contains(table.toString());
        }
    }
}
