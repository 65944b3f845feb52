package org.geoserve.server.util;

import io.netty.handler.codec.http.HttpHeaderValues;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * This class consists of {@code static} utility methods for operating HTTP requests.
 */
public final class HttpUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpUtil.class);

    public static final String APPLICATION_JSON_CONTENT_TYPE =
            HttpHeaderValues.APPLICATION_JSON + ";" + HttpHeaderValues.CHARSET + "="
                    + StandardCharsets.UTF_8.toString().toLowerCase();

    public static final CharSequence X_FORWARDED_FOR_HEADER = HttpHeaders.createOptimized("X-Forwarded-For");
    public static final CharSequence X_REFLECTED_IP_HEADER = HttpHeaders.createOptimized("X-Reflected-Ip");
    public static final CharSequence CONTENT_TYPE_HEADER = HttpHeaders.createOptimized("Content-Type");
    public static final CharSequence IF_MODIFIED_SINCE_HEADER = HttpHeaders.createOptimized("If-Modified-Since");
    public static final CharSequence LAST_MODIFIED_HEADER = HttpHeaders.createOptimized("Last-Modified");
    public static final CharSequence ACCESS_CONTROL_ALLOW_ORIGIN_HEADER =
            HttpHeaders.createOptimized("Access-Control-Allow-Origin");

    public static final String MACROS_OPEN = "{{";
    public static final String MACROS_CLOSE = "}}";

    private static final Pattern CREDENTIAL_QUERY_PARAM =
            Pattern.compile("(?i)((?:license_key|key|token|password)=)[^&]*");

    private HttpUtil() {
    }

    /**
     * Checks the input string for using as URL.
     */
    public static String validateUrl(String url) {
        try {
            return new URL(url).toString();
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("URL supplied is not valid: " + url, e);
        }
    }

    /**
     * Replaces every {@code {{macroName}}} occurrence in the given template.
     */
    public static String expandMacro(String template, String macroName, String value) {
        return StringUtils.replace(template, MACROS_OPEN + macroName + MACROS_CLOSE, StringUtils.defaultString(value));
    }

    /**
     * Returns URL with credential-like query parameter values replaced, suitable for logs.
     */
    public static String maskCredentials(String url) {
        return url != null ? CREDENTIAL_QUERY_PARAM.matcher(url).replaceAll("$1***") : null;
    }

    /**
     * Formats the given instant as HTTP-date (RFC 1123), e.g. {@code Tue, 3 Jun 2008 11:05:30 GMT}.
     */
    public static String formatHttpDate(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
    }

    /**
     * Parses HTTP-date (RFC 1123). Returns null if value is blank or malformed.
     */
    public static Instant parseHttpDate(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }

        try {
            return DateTimeFormatter.RFC_1123_DATE_TIME.parse(value.trim(), Instant::from);
        } catch (DateTimeParseException e) {
            logger.debug("Malformed HTTP date {}: {}", value, e.getMessage());
            return null;
        }
    }

    public static boolean executeSafely(RoutingContext routingContext,
                                        String endpoint,
                                        Consumer<HttpServerResponse> responseConsumer) {

        final HttpServerResponse response = routingContext.response();

        if (response.closed()) {
            logger.warn("Client already closed connection, response to {} will be skipped", endpoint);
            return false;
        }

        try {
            responseConsumer.accept(response);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to send {} response: {}", endpoint, e.getMessage());
            return false;
        }
    }
}
