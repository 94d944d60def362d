package com.phillippitts.streamwatch.service.disk;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks usable space of the file store holding the path. A path that does not exist yet is checked through its
 * nearest existing parent. If the file store cannot be queried, space is reported as sufficient so that a
 * transient I/O error does not block recording.
 */
public class FileStoreDiskSpaceGuard implements DiskSpaceGuard {

    private static final Logger LOG = LogManager.getLogger(FileStoreDiskSpaceGuard.class);
    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    @Override
    public boolean freeSpaceBelow(double thresholdGb, String path) {
        if (thresholdGb <= 0) {
            return false;
        }
        Path probe = Path.of(path).toAbsolutePath();
        while (probe != null && !Files.exists(probe)) {
            probe = probe.getParent();
        }
        if (probe == null) {
            LOG.warn("No existing directory found for {}; skipping free-space check", path);
            return false;
        }
        try {
            double freeGb = Files.getFileStore(probe).getUsableSpace() / BYTES_PER_GB;
            LOG.debug("Free space under {}: {} GB (threshold {} GB)", probe, String.format("%.2f", freeGb), thresholdGb);
            return freeGb < thresholdGb;
        } catch (IOException e) {
            LOG.warn("Could not query free space under {}: {}", probe, e.getMessage());
            return false;
        }
    }
}
