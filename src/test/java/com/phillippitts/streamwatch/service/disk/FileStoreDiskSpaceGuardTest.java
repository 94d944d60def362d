package com.phillippitts.streamwatch.service.disk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileStoreDiskSpaceGuardTest {

    private final FileStoreDiskSpaceGuard guard = new FileStoreDiskSpaceGuard();

    @TempDir
    Path dir;

    @Test
    void absurdThresholdIsReportedLow() {
        assertThat(guard.freeSpaceBelow(1_000_000_000.0, dir.toString())).isTrue();
    }

    @Test
    void missingDirectoryIsCheckedThroughParent() {
        assertThat(guard.freeSpaceBelow(1_000_000_000.0, dir.resolve("not/yet/created").toString())).isTrue();
    }

    @Test
    void disabledThresholdIsNeverLow() {
        assertThat(guard.freeSpaceBelow(0, dir.toString())).isFalse();
    }
}
