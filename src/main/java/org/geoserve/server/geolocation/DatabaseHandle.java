package org.geoserve.server.geolocation;

import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.AbstractCountryResponse;
import org.apache.commons.lang3.StringUtils;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.time.Instant;
import java.util.Objects;

/**
 * Opened read-only MaxMind database together with the moment its data was last modified.
 * <p>
 * City-level editions are queried with {@link DatabaseReader#city(InetAddress)}, country-level editions with
 * {@link DatabaseReader#country(InetAddress)}.
 */
public class DatabaseHandle implements Closeable {

    private final DatabaseReader databaseReader;
    private final String source;
    private final Instant lastModified;
    private final boolean cityEdition;

    DatabaseHandle(DatabaseReader databaseReader, String source, Instant lastModified, boolean cityEdition) {
        this.databaseReader = Objects.requireNonNull(databaseReader);
        this.source = Objects.requireNonNull(source);
        this.lastModified = Objects.requireNonNull(lastModified);
        this.cityEdition = cityEdition;
    }

    public static DatabaseHandle of(DatabaseReader databaseReader, String source, Instant lastModified) {
        final String databaseType = databaseReader.getMetadata().getDatabaseType();
        return new DatabaseHandle(databaseReader, source, lastModified,
                StringUtils.containsIgnoreCase(databaseType, "City"));
    }

    public AbstractCountryResponse lookup(InetAddress inetAddress) throws IOException, GeoIp2Exception {
        return cityEdition ? databaseReader.city(inetAddress) : databaseReader.country(inetAddress);
    }

    public String getSource() {
        return source;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public boolean isCityEdition() {
        return cityEdition;
    }

    @Override
    public void close() throws IOException {
        databaseReader.close();
    }

    @Override
    public String toString() {
        return "DatabaseHandle(source=%s, lastModified=%s)".formatted(source, lastModified);
    }
}
