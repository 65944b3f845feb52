package org.geoserve.server.handler;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.vertx.core.AsyncResult;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.RoutingContext;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.geolocation.GeoLocationService;
import org.geoserve.server.geolocation.model.LookupResult;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;
import org.geoserve.server.util.HttpUtil;

import java.util.Objects;

/**
 * Serves geolocation records at {@code <basePath>/<ip>}.
 * <p>
 * Without an explicit address the caller's own one is resolved: the first entry of {@code X-Forwarded-For} or,
 * when absent, the peer address of the connection.
 */
public class LookupHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(LookupHandler.class);

    private final GeoLocationService geoLocationService;
    private final String basePath;
    private final String allowOrigin;

    public LookupHandler(GeoLocationService geoLocationService, String basePath, String allowOrigin) {
        this.geoLocationService = Objects.requireNonNull(geoLocationService);
        this.basePath = StringUtils.removeEnd(Objects.requireNonNull(basePath), "/");
        this.allowOrigin = StringUtils.trimToNull(allowOrigin);
    }

    @Override
    public void handle(RoutingContext routingContext) {
        final String pathIp = ipFromPath(routingContext.normalizedPath());
        final String ip = StringUtils.isNotEmpty(pathIp) ? pathIp : clientIpFrom(routingContext.request());

        geoLocationService.lookup(ip).onComplete(result -> handleResult(result, ip, routingContext));
    }

    private String ipFromPath(String path) {
        final String remainder = StringUtils.removeStart(StringUtils.defaultString(path), basePath);
        return StringUtils.trimToEmpty(QueryStringDecoder.decodeComponent(StringUtils.removeStart(remainder, "/")));
    }

    /**
     * Determines address of the original client, a forwarded header may list every proxy on the way.
     */
    static String clientIpFrom(HttpServerRequest request) {
        final String forwardedFor = StringUtils.trimToNull(request.getHeader(HttpUtil.X_FORWARDED_FOR_HEADER));
        if (forwardedFor != null) {
            return StringUtils.trim(StringUtils.substringBefore(forwardedFor, ","));
        }

        final SocketAddress remoteAddress = request.remoteAddress();
        return remoteAddress != null ? remoteAddress.host() : null;
    }

    private void handleResult(AsyncResult<LookupResult> result, String ip, RoutingContext routingContext) {
        if (result.succeeded()) {
            final LookupResult lookupResult = result.result();
            HttpUtil.executeSafely(routingContext, basePath, response -> {
                addAllowOrigin(response);
                response.putHeader(HttpUtil.CONTENT_TYPE_HEADER, HttpUtil.APPLICATION_JSON_CONTENT_TYPE)
                        .putHeader(HttpUtil.X_REFLECTED_IP_HEADER, lookupResult.getIp())
                        .end(Buffer.buffer(lookupResult.getBody()));
            });
        } else {
            logger.debug("Lookup of {} failed: {}", ip, result.cause().getMessage());
            HttpUtil.executeSafely(routingContext, basePath, response -> {
                addAllowOrigin(response);
                response.setStatusCode(HttpResponseStatus.INTERNAL_SERVER_ERROR.code())
                        .end();
            });
        }
    }

    private void addAllowOrigin(HttpServerResponse response) {
        if (allowOrigin != null) {
            response.putHeader(HttpUtil.ACCESS_CONTROL_ALLOW_ORIGIN_HEADER, allowOrigin);
        }
    }
}
