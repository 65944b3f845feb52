package org.geoserve.server.geolocation;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.geoserve.server.exception.GeoServeException;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;
import org.geoserve.server.util.HttpUtil;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Keeps the database of the {@link LookupCoordinator} fresh by polling the remote source.
 * <p>
 * Each attempt is a conditional GET with {@code If-Modified-Since} set to the modification time of the installed
 * data. A new archive is decoded on a worker thread and handed to the coordinator, after which the next attempt
 * is scheduled after the long refresh interval. Unchanged data or any error leads to the short check interval.
 * Errors are never fatal.
 */
public class DatabaseRefresher {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseRefresher.class);

    private final String downloadUrl;
    private final String loggableUrl;
    private final long checkIntervalMs;
    private final long refreshIntervalMs;
    private final long timeoutMs;
    private final DatabaseLoader databaseLoader;
    private final CoordinatorGeoLocationService geoLocationService;
    private final HttpClient httpClient;
    private final Vertx vertx;
    private final Clock clock;

    private volatile Instant lastKnownModified;
    private volatile long nextDelay;
    private volatile long timerId = -1;
    private volatile boolean stopped;

    public DatabaseRefresher(String downloadUrl,
                             long checkIntervalMs,
                             long refreshIntervalMs,
                             long timeoutMs,
                             DatabaseLoader databaseLoader,
                             CoordinatorGeoLocationService geoLocationService,
                             HttpClient httpClient,
                             Vertx vertx,
                             Clock clock) {

        this.downloadUrl = HttpUtil.validateUrl(Objects.requireNonNull(downloadUrl));
        this.loggableUrl = HttpUtil.maskCredentials(downloadUrl);
        this.checkIntervalMs = verifyInterval(checkIntervalMs);
        this.refreshIntervalMs = verifyInterval(refreshIntervalMs);
        this.timeoutMs = timeoutMs;
        this.databaseLoader = Objects.requireNonNull(databaseLoader);
        this.geoLocationService = Objects.requireNonNull(geoLocationService);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.vertx = Objects.requireNonNull(vertx);
        this.clock = Objects.requireNonNull(clock);

        nextDelay = checkIntervalMs;
    }

    private static long verifyInterval(long interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("Database refresh intervals must be positive");
        }
        return interval;
    }

    /**
     * Records the modification time of a database installed by other means, e.g. loaded from a local file.
     */
    public void setLastKnownModified(Instant lastKnownModified) {
        this.lastKnownModified = lastKnownModified;
    }

    public Instant getLastKnownModified() {
        return lastKnownModified;
    }

    public long getNextDelay() {
        return nextDelay;
    }

    /**
     * Starts periodic polling, the first attempt happens after {@link #getNextDelay()}.
     */
    public void start() {
        stopped = false;
        logger.info("Geo location database will be checked for updates at {}", loggableUrl);
        scheduleRefresh(nextDelay);
    }

    public void stop() {
        stopped = true;
        if (timerId != -1) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }

    /**
     * Performs a single conditional fetch. The returned future always succeeds.
     */
    public Future<RefreshOutcome> refresh() {
        final Instant ifModifiedSince = lastKnownModified;

        return httpClient.request(requestOptions(ifModifiedSince))
                .compose(HttpClientRequest::send)
                .compose(response -> processResponse(response, ifModifiedSince))
                .recover(this::failRefresh)
                .onSuccess(this::updateNextDelay);
    }

    private RequestOptions requestOptions(Instant ifModifiedSince) {
        final RequestOptions requestOptions = new RequestOptions()
                .setMethod(HttpMethod.GET)
                .setAbsoluteURI(downloadUrl)
                .setFollowRedirects(true)
                .setTimeout(timeoutMs);

        if (ifModifiedSince != null) {
            requestOptions.putHeader(HttpUtil.IF_MODIFIED_SINCE_HEADER, HttpUtil.formatHttpDate(ifModifiedSince));
        }
        return requestOptions;
    }

    private Future<RefreshOutcome> processResponse(HttpClientResponse response, Instant ifModifiedSince) {
        final int statusCode = response.statusCode();
        if (statusCode == 304) {
            logger.debug("Geo location database at {} is not modified since {}", loggableUrl, ifModifiedSince);
            return Future.succeededFuture(RefreshOutcome.NOT_MODIFIED);
        }
        if (statusCode != 200) {
            return Future.failedFuture(new GeoServeException("Unexpected HTTP status code " + statusCode));
        }

        final Instant lastModified = resolveLastModified(response);
        if (ifModifiedSince != null && !lastModified.isAfter(ifModifiedSince)) {
            logger.debug("Remote geo location database at {} is not newer than {}", loggableUrl, ifModifiedSince);
            return response.end().map(RefreshOutcome.NOT_MODIFIED);
        }

        return response.body()
                .compose(body -> vertx.executeBlocking(() -> loadDatabase(body, lastModified)))
                .compose(this::installDatabase);
    }

    private Instant resolveLastModified(HttpClientResponse response) {
        final String header = response.getHeader(HttpUtil.LAST_MODIFIED_HEADER);
        final Instant lastModified = HttpUtil.parseHttpDate(header);
        if (lastModified != null) {
            return lastModified;
        }

        logger.warn("Response from {} has no valid Last-Modified header: {}, current time is used instead",
                loggableUrl, header);
        return clock.instant();
    }

    private DatabaseHandle loadDatabase(Buffer body, Instant lastModified) {
        return databaseLoader.fromArchive(body.getBytes(), loggableUrl, lastModified);
    }

    private Future<RefreshOutcome> installDatabase(DatabaseHandle databaseHandle) {
        return geoLocationService.replaceDatabase(databaseHandle)
                .onFailure(ignored -> closeUninstalled(databaseHandle))
                .map(ignored -> {
                    lastKnownModified = databaseHandle.getLastModified();
                    logger.info("Geo location database updated from {}, last modified {}",
                            loggableUrl, lastKnownModified);
                    return RefreshOutcome.UPDATED;
                });
    }

    private static void closeUninstalled(DatabaseHandle databaseHandle) {
        try {
            databaseHandle.close();
        } catch (IOException e) {
            logger.error("Failed to close not installed geo location database {}", e, databaseHandle);
        }
    }

    private Future<RefreshOutcome> failRefresh(Throwable error) {
        logger.warn("Unable to update geo location database from {}: {}", loggableUrl, error.getMessage());
        return Future.succeededFuture(RefreshOutcome.FAILED);
    }

    private void updateNextDelay(RefreshOutcome outcome) {
        nextDelay = outcome == RefreshOutcome.UPDATED ? refreshIntervalMs : checkIntervalMs;
    }

    private void scheduleRefresh(long delay) {
        if (stopped) {
            return;
        }

        timerId = vertx.setTimer(delay, ignored -> refresh().onComplete(result -> scheduleRefresh(nextDelay)));
    }

    public enum RefreshOutcome {

        UPDATED, NOT_MODIFIED, FAILED
    }
}
