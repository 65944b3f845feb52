package org.geoserve.server.geolocation;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.exception.GeoServeException;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;
import org.geoserve.server.vertx.Initializable;

import java.time.Instant;
import java.util.Objects;

/**
 * Installs the initial database before any request is served and then starts {@link DatabaseRefresher}, if any.
 * <p>
 * A configured local file takes precedence over the remote source. Initialization fails when neither yields a
 * database.
 */
public class DatabaseInitializer implements Initializable {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    private final String databaseFile;
    private final DatabaseLoader databaseLoader;
    private final DatabaseRefresher databaseRefresher;
    private final CoordinatorGeoLocationService geoLocationService;
    private final Vertx vertx;

    public DatabaseInitializer(String databaseFile,
                               DatabaseLoader databaseLoader,
                               DatabaseRefresher databaseRefresher,
                               CoordinatorGeoLocationService geoLocationService,
                               Vertx vertx) {

        this.databaseFile = StringUtils.trimToNull(databaseFile);
        this.databaseLoader = Objects.requireNonNull(databaseLoader);
        this.databaseRefresher = databaseRefresher;
        this.geoLocationService = Objects.requireNonNull(geoLocationService);
        this.vertx = Objects.requireNonNull(vertx);
    }

    @Override
    public void initialize(Promise<Void> initializePromise) {
        final Future<Void> initialization;
        if (databaseFile != null) {
            initialization = initializeFromFile();
        } else if (databaseRefresher != null) {
            initialization = initializeFromRemote();
        } else {
            initialization = Future.failedFuture(
                    new GeoServeException("Neither database file nor remote database source is configured"));
        }

        initialization
                .onFailure(error -> logger.error("Unable to load initial geo location database: {}",
                        error.getMessage()))
                .onComplete(initializePromise);
    }

    public void shutdown() {
        if (databaseRefresher != null) {
            databaseRefresher.stop();
        }
    }

    private Future<Void> initializeFromFile() {
        logger.info("Loading geo location database from file {}, this can take a while", databaseFile);

        return vertx.executeBlocking(() -> databaseLoader.fromFile(databaseFile))
                .compose(databaseHandle -> geoLocationService.replaceDatabase(databaseHandle)
                        .map(databaseHandle.getLastModified()))
                .onSuccess(this::startRefresher)
                .mapEmpty();
    }

    private void startRefresher(Instant lastModified) {
        if (databaseRefresher != null) {
            databaseRefresher.setLastKnownModified(lastModified);
            databaseRefresher.start();
        }
    }

    private Future<Void> initializeFromRemote() {
        logger.info("Downloading geo location database, this can take a while");

        return databaseRefresher.refresh()
                .compose(outcome -> outcome == DatabaseRefresher.RefreshOutcome.UPDATED
                        ? Future.<Void>succeededFuture()
                        : Future.<Void>failedFuture(new GeoServeException(
                        "Initial download of geo location database finished with " + outcome)))
                .onSuccess(ignored -> databaseRefresher.start());
    }
}
