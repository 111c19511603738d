package com.di.rawingest.precheck;

import com.di.rawingest.config.RawIngestProperties;
import com.di.rawingest.handler.ObjectStorage;
import com.di.rawingest.handler.TableCatalog;
import com.di.rawingest.schema.TableRef;
import com.di.rawingest.util.GcsPaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Checks run before any record is read: is the input there, and does the destination table exist.
 * <ul>
 *   <li>Local input: checked on the filesystem, after rewriting a {@code gs://} prefix to the
 *       configured bucket mount point.</li>
 *   <li>{@code gs://} input: checked through {@link ObjectStorage}.</li>
 *   <li>Destination: looked up through {@link TableCatalog}.</li>
 * </ul>
 * The checks only answer yes/no; the caller decides whether to stop or continue.
 */
@Component
@Slf4j
public class IngestPrechecks {

    private final ObjectStorage objectStorage;
    private final TableCatalog tableCatalog;
    private final String gcsMountPrefix;

    @Autowired
    public IngestPrechecks(ObjectStorage objectStorage, TableCatalog tableCatalog, RawIngestProperties properties) {
        this(objectStorage, tableCatalog, properties.getGcsMountPrefix());
    }

    public IngestPrechecks(ObjectStorage objectStorage, TableCatalog tableCatalog, String gcsMountPrefix) {
        this.objectStorage = objectStorage;
        this.tableCatalog = tableCatalog;
        this.gcsMountPrefix = gcsMountPrefix;
    }

    public boolean inputReachable(String input) {
        if (GcsPaths.isGcsUri(input)) {
            boolean exists = objectStorage.exists(input);
            log.debug("[PRECHECK] GCS input {} exists={}", input, exists);
            return exists;
        }
        String localPath = GcsPaths.toMountedPath(input, gcsMountPrefix);
        boolean exists = localFileExists(localPath);
        log.debug("[PRECHECK] Local input {} exists={}", localPath, exists);
        return exists;
    }

    public boolean destinationExists(TableRef table) {
        return tableCatalog.tableExists(table);
    }

    private static boolean localFileExists(String path) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        try {
            return Files.exists(Path.of(path));
        } catch (InvalidPathException e) {
            log.debug("[PRECHECK] Not a valid local path: {} ({})", path, e.getMessage());
            return false;
        }
    }
}
