package org.geoserve.server.spring.config.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.geoserve.server.geolocation.ResponseCache;
import org.springframework.validation.annotation.Validated;

@Validated
@Data
@NoArgsConstructor
public class GeoLocationProperties {

    /**
     * Uncompressed database file, takes precedence over the remote source for the initial load.
     */
    private String databaseFile;

    @NotBlank
    private String basePath;

    private String allowOrigin;

    @Positive
    private int cacheSize = ResponseCache.DEFAULT_CAPACITY;

    @Positive
    private long lookupTimeoutMs;

    @Valid
    @NotNull
    private RemoteDatabaseProperties remote;
}
