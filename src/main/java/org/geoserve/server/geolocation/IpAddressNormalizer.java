package org.geoserve.server.geolocation;

import inet.ipaddr.AddressStringException;
import inet.ipaddr.IPAddress;
import inet.ipaddr.IPAddressString;
import inet.ipaddr.IPAddressStringParameters;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.exception.GeoServeException;

/**
 * Parses IP address literals without touching DNS and produces their canonical textual form, used as cache key.
 */
public final class IpAddressNormalizer {

    private static final IPAddressStringParameters IP_ADDRESS_VALIDATION_OPTIONS;

    static {
        final IPAddressStringParameters.Builder builder = IPAddressString.DEFAULT_VALIDATION_OPTIONS.toBuilder()
                .allowSingleSegment(false)
                .allowEmpty(false);

        // dotted-quad only: no hex, octal or shortened inet_aton forms
        builder.getIPv4AddressParametersBuilder()
                .allow_inet_aton(false)
                .allowLeadingZeros(false);

        IP_ADDRESS_VALIDATION_OPTIONS = builder.toParams();
    }

    private IpAddressNormalizer() {
    }

    /**
     * Returns parsed single address.
     *
     * @throws GeoServeException if the value is not a single IPv4 or IPv6 address literal
     */
    public static IPAddress parse(String ip) throws GeoServeException {
        final String trimmed = StringUtils.trimToNull(ip);
        if (trimmed == null) {
            throw new GeoServeException("IP address is empty");
        }

        final IPAddress address;
        try {
            address = new IPAddressString(trimmed, IP_ADDRESS_VALIDATION_OPTIONS).toAddress();
        } catch (AddressStringException e) {
            throw new GeoServeException("Invalid IP address: " + ip, e);
        }

        if (address == null || address.isMultiple() || address.isPrefixed()) {
            throw new GeoServeException("Invalid IP address: " + ip);
        }
        return address;
    }

    public static String normalize(IPAddress address) {
        return address.toCanonicalString();
    }
}
