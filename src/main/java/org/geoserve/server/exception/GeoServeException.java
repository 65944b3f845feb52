package org.geoserve.server.exception;

/**
 * Failure of a geolocation operation: unparseable address, missing or unreadable database, failed download.
 */
@SuppressWarnings("serial")
public class GeoServeException extends RuntimeException {

    public GeoServeException(String message) {
        super(message);
    }

    public GeoServeException(String message, Throwable cause) {
        super(message, cause);
    }
}
