package org.javai.storage;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class StorageConstantsTest {

    @Test
    void storageClasses_haveServiceValues() {
        assertThat(StorageConstants.STANDARD_STORAGE_CLASS).isEqualTo("STANDARD");
        assertThat(StorageConstants.NEARLINE_STORAGE_CLASS).isEqualTo("NEARLINE");
        assertThat(StorageConstants.COLDLINE_STORAGE_CLASS).isEqualTo("COLDLINE");
        assertThat(StorageConstants.ARCHIVE_STORAGE_CLASS).isEqualTo("ARCHIVE");
    }

    @Test
    void legacyStorageClasses_haveServiceValues() {
        assertThat(StorageConstants.MULTI_REGIONAL_LEGACY_STORAGE_CLASS).isEqualTo("MULTI_REGIONAL");
        assertThat(StorageConstants.REGIONAL_LEGACY_STORAGE_CLASS).isEqualTo("REGIONAL");
        assertThat(StorageConstants.DURABLE_REDUCED_AVAILABILITY_LEGACY_STORAGE_CLASS)
                .isEqualTo("DURABLE_REDUCED_AVAILABILITY");
    }

    @Test
    void locationTypes_haveServiceValues() {
        assertThat(StorageConstants.MULTI_REGION_LOCATION_TYPE).isEqualTo("multi-region");
        assertThat(StorageConstants.REGION_LOCATION_TYPE).isEqualTo("region");
        assertThat(StorageConstants.DUAL_REGION_LOCATION_TYPE).isEqualTo("dual-region");
    }

    @Test
    void defaultTimeout_isSixtySeconds() {
        assertThat(StorageConstants.DEFAULT_TIMEOUT_SECONDS).isEqualTo(60);
        assertThat(StorageConstants.DEFAULT_TIMEOUT).isEqualTo(Duration.ofSeconds(60));
    }
}
