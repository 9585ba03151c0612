package com.hrx.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for {@link com.hrx.core.HrxCodec}.
 *
 * <p>Loaded from {@code hrx.yaml}. Any setting left out of the file is {@code null} until
 * {@link #withDefaults()} fills it in.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * defaultBoundaryLength: 5
 * maxInputLength: 1048576
 * autoResizeBoundary: true
 * }</pre>
 *
 * @param defaultBoundaryLength boundary length for newly created archives
 * @param maxInputLength largest accepted input in characters; 0 means unlimited
 * @param autoResizeBoundary widen the boundary on write instead of failing when text contains it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HrxConfig(
    @JsonProperty("defaultBoundaryLength") Integer defaultBoundaryLength,
    @JsonProperty("maxInputLength") Integer maxInputLength,
    @JsonProperty("autoResizeBoundary") Boolean autoResizeBoundary
) {
    public static final int DEFAULT_BOUNDARY_LENGTH = 3;

    /**
     * Creates the default configuration: boundary length 3, unlimited input, no resizing.
     *
     * @return default configuration
     */
    public static HrxConfig defaults() {
        return new HrxConfig(DEFAULT_BOUNDARY_LENGTH, 0, false);
    }

    /**
     * Replaces unset values with their defaults.
     *
     * @return configuration with every value set
     */
    public HrxConfig withDefaults() {
        return new HrxConfig(
            defaultBoundaryLength != null ? defaultBoundaryLength : DEFAULT_BOUNDARY_LENGTH,
            maxInputLength != null ? maxInputLength : 0,
            autoResizeBoundary != null ? autoResizeBoundary : false
        );
    }

    public boolean hasInputLimit() {
        return maxInputLength != null && maxInputLength > 0;
    }
}
