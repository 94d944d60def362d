package com.phillippitts.streamwatch.service.disk;

/**
 * Reports whether free space under a directory has dropped below a threshold.
 */
public interface DiskSpaceGuard {

    /**
     * @param thresholdGb minimum free space in gigabytes
     * @param path        directory that recordings are written to
     * @return true if free space is below {@code thresholdGb}
     */
    boolean freeSpaceBelow(double thresholdGb, String path);
}
