package org.javai.storage;

import java.util.Objects;

/**
 * Storage classes accepted by the service, including the legacy aliases.
 */
public enum StorageClass {

    STANDARD(StorageConstants.STANDARD_STORAGE_CLASS, null),
    NEARLINE(StorageConstants.NEARLINE_STORAGE_CLASS, null),
    COLDLINE(StorageConstants.COLDLINE_STORAGE_CLASS, null),
    ARCHIVE(StorageConstants.ARCHIVE_STORAGE_CLASS, null),
    MULTI_REGIONAL(StorageConstants.MULTI_REGIONAL_LEGACY_STORAGE_CLASS, STANDARD),
    REGIONAL(StorageConstants.REGIONAL_LEGACY_STORAGE_CLASS, STANDARD),
    DURABLE_REDUCED_AVAILABILITY(StorageConstants.DURABLE_REDUCED_AVAILABILITY_LEGACY_STORAGE_CLASS, NEARLINE);

    private final String value;
    private final StorageClass legacyAliasOf;

    StorageClass(String value, StorageClass legacyAliasOf) {
        this.value = value;
        this.legacyAliasOf = legacyAliasOf;
    }

    /**
     * The wire value, e.g. {@code "NEARLINE"}.
     */
    public String value() {
        return value;
    }

    public boolean isLegacy() {
        return legacyAliasOf != null;
    }

    /**
     * The current storage class this one stands for. Non-legacy classes return themselves.
     */
    public StorageClass aliasOf() {
        return legacyAliasOf != null ? legacyAliasOf : this;
    }

    /**
     * Whether objects of this class may live in a bucket of the given location type.
     * {@link #MULTI_REGIONAL} is tied to multi-region buckets and {@link #REGIONAL}
     * to single-region buckets; every other class is allowed everywhere.
     */
    public boolean isAllowedIn(LocationType locationType) {
        Objects.requireNonNull(locationType, "locationType must not be null");
        return switch (this) {
            case MULTI_REGIONAL -> locationType == LocationType.MULTI_REGION;
            case REGIONAL -> locationType == LocationType.REGION;
            default -> true;
        };
    }

    /**
     * Parses a wire value. Matching is exact and case-sensitive.
     *
     * @throws IllegalArgumentException if the value is not a known storage class
     */
    public static StorageClass fromValue(String value) {
        Objects.requireNonNull(value, "value must not be null");
        for (StorageClass storageClass : values()) {
            if (storageClass.value.equals(value)) {
                return storageClass;
            }
        }
        throw new IllegalArgumentException("Unknown storage class: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
