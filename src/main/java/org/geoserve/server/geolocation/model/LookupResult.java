package org.geoserve.server.geolocation.model;

import lombok.Value;

/**
 * Serialized geolocation record together with the canonical form of the address it was resolved for.
 */
@Value(staticConstructor = "of")
public class LookupResult {

    String ip;

    byte[] body;
}
