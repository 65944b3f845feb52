package org.geoserve.server.geolocation;

import io.vertx.core.Future;
import org.geoserve.server.geolocation.model.LookupResult;

/**
 * Retrieves geolocation information by IP address.
 * <p>
 * Provided default implementation - {@link CoordinatorGeoLocationService}.
 */
@FunctionalInterface
public interface GeoLocationService {

    /**
     * Returns serialized geolocation record for the given IP address, along with the canonical form of the address,
     * or failed future if it cannot be resolved.
     */
    Future<LookupResult> lookup(String ip);
}
