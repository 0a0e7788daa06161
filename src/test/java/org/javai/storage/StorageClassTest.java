package org.javai.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StorageClassTest {

    @Test
    void value_matchesConstants() {
        assertThat(StorageClass.STANDARD.value()).isEqualTo(StorageConstants.STANDARD_STORAGE_CLASS);
        assertThat(StorageClass.ARCHIVE.value()).isEqualTo(StorageConstants.ARCHIVE_STORAGE_CLASS);
        assertThat(StorageClass.DURABLE_REDUCED_AVAILABILITY.toString())
                .isEqualTo(StorageConstants.DURABLE_REDUCED_AVAILABILITY_LEGACY_STORAGE_CLASS);
    }

    @Test
    void fromValue_roundTripsEveryClass() {
        for (StorageClass storageClass : StorageClass.values()) {
            assertThat(StorageClass.fromValue(storageClass.value())).isSameAs(storageClass);
        }
    }

    @Test
    void fromValue_isCaseSensitive() {
        assertThatThrownBy(() -> StorageClass.fromValue("nearline"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nearline");
    }

    @Test
    void legacyClasses_aliasCurrentClasses() {
        assertThat(StorageClass.MULTI_REGIONAL.isLegacy()).isTrue();
        assertThat(StorageClass.MULTI_REGIONAL.aliasOf()).isEqualTo(StorageClass.STANDARD);
        assertThat(StorageClass.REGIONAL.aliasOf()).isEqualTo(StorageClass.STANDARD);
        assertThat(StorageClass.DURABLE_REDUCED_AVAILABILITY.aliasOf()).isEqualTo(StorageClass.NEARLINE);
    }

    @Test
    void currentClasses_aliasThemselves() {
        assertThat(StorageClass.COLDLINE.isLegacy()).isFalse();
        assertThat(StorageClass.COLDLINE.aliasOf()).isEqualTo(StorageClass.COLDLINE);
    }

    @Test
    void isAllowedIn_restrictsRegionalLegacyClasses() {
        assertThat(StorageClass.MULTI_REGIONAL.isAllowedIn(LocationType.MULTI_REGION)).isTrue();
        assertThat(StorageClass.MULTI_REGIONAL.isAllowedIn(LocationType.REGION)).isFalse();
        assertThat(StorageClass.REGIONAL.isAllowedIn(LocationType.REGION)).isTrue();
        assertThat(StorageClass.REGIONAL.isAllowedIn(LocationType.DUAL_REGION)).isFalse();
        assertThat(StorageClass.ARCHIVE.isAllowedIn(LocationType.DUAL_REGION)).isTrue();
    }

    @Test
    void locationType_fromValue_parsesWireValues() {
        assertThat(LocationType.fromValue("multi-region")).isEqualTo(LocationType.MULTI_REGION);
        assertThat(LocationType.fromValue("region")).isEqualTo(LocationType.REGION);
        assertThat(LocationType.fromValue("dual-region")).isEqualTo(LocationType.DUAL_REGION);
        assertThatThrownBy(() -> LocationType.fromValue("DUAL_REGION"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
