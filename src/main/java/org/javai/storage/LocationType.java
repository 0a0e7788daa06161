package org.javai.storage;

import java.util.Objects;

/**
 * Where a bucket's data is placed.
 */
public enum LocationType {

    MULTI_REGION(StorageConstants.MULTI_REGION_LOCATION_TYPE),
    REGION(StorageConstants.REGION_LOCATION_TYPE),
    DUAL_REGION(StorageConstants.DUAL_REGION_LOCATION_TYPE);

    private final String value;

    LocationType(String value) {
        this.value = value;
    }

    /**
     * The wire value, e.g. {@code "dual-region"}.
     */
    public String value() {
        return value;
    }

    /**
     * Parses a wire value. Matching is exact.
     *
     * @throws IllegalArgumentException if the value is not a known location type
     */
    public static LocationType fromValue(String value) {
        Objects.requireNonNull(value, "value must not be null");
        for (LocationType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown location type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
