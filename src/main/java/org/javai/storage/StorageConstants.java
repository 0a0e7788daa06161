package org.javai.storage;

import java.time.Duration;

/**
 * Constants shared across the storage client.
 *
 * <p>Storage class and location type values are the literal strings the service accepts on
 * the wire. See {@link StorageClass} and {@link LocationType} for typed views of the same values.
 */
public final class StorageConstants {

    private StorageConstants() {
        // Constants holder
    }

    // === Storage classes ===

    /** Storage class for objects accessed more than once per month. */
    public static final String STANDARD_STORAGE_CLASS = "STANDARD";

    /** Storage class for objects accessed at most once per month. */
    public static final String NEARLINE_STORAGE_CLASS = "NEARLINE";

    /** Storage class for objects accessed at most once per year. */
    public static final String COLDLINE_STORAGE_CLASS = "COLDLINE";

    /** Storage class for objects accessed less frequently than once per year. */
    public static final String ARCHIVE_STORAGE_CLASS = "ARCHIVE";

    /**
     * Legacy storage class, alias for {@link #STANDARD_STORAGE_CLASS}.
     * Only valid for buckets whose location type is {@link #MULTI_REGION_LOCATION_TYPE}.
     */
    public static final String MULTI_REGIONAL_LEGACY_STORAGE_CLASS = "MULTI_REGIONAL";

    /**
     * Legacy storage class, alias for {@link #STANDARD_STORAGE_CLASS}.
     * Only valid for buckets whose location type is {@link #REGION_LOCATION_TYPE}.
     */
    public static final String REGIONAL_LEGACY_STORAGE_CLASS = "REGIONAL";

    /** Legacy storage class, similar to {@link #NEARLINE_STORAGE_CLASS}. */
    public static final String DURABLE_REDUCED_AVAILABILITY_LEGACY_STORAGE_CLASS = "DURABLE_REDUCED_AVAILABILITY";

    // === Location types ===

    /** Data replicated across regions in a multi-region. Highest availability across the largest area. */
    public static final String MULTI_REGION_LOCATION_TYPE = "multi-region";

    /** Data stored within a single region. Lowest latency within that region. */
    public static final String REGION_LOCATION_TYPE = "region";

    /** Data stored within two primary regions. High availability and low latency across both. */
    public static final String DUAL_REGION_LOCATION_TYPE = "dual-region";

    // === Request defaults ===

    /** Default request timeout, in seconds, used when a caller gives none. */
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    /** {@link #DEFAULT_TIMEOUT_SECONDS} as a {@link Duration}. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
}
