package org.geoserve.server.spring.config;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import org.geoserve.server.geolocation.CoordinatorGeoLocationService;
import org.geoserve.server.geolocation.DatabaseInitializer;
import org.geoserve.server.geolocation.DatabaseLoader;
import org.geoserve.server.geolocation.DatabaseRefresher;
import org.geoserve.server.geolocation.LookupCoordinator;
import org.geoserve.server.json.JacksonMapper;
import org.geoserve.server.spring.config.model.GeoLocationProperties;
import org.geoserve.server.spring.config.model.RemoteDatabaseProperties;
import org.geoserve.server.vertx.ContextRunner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class GeoLocationConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "geolocation")
    GeoLocationProperties geoLocationProperties() {
        return new GeoLocationProperties();
    }

    @Bean
    LookupCoordinator lookupCoordinator(GeoLocationProperties geoLocationProperties,
                                        JacksonMapper mapper,
                                        Vertx vertx,
                                        ContextRunner contextRunner) {

        final LookupCoordinator lookupCoordinator =
                new LookupCoordinator(geoLocationProperties.getCacheSize(), mapper);

        // single instance, all lookups and replacements are handled on one context
        contextRunner.<String>runBlocking(promise -> vertx.deployVerticle(lookupCoordinator).onComplete(promise));

        return lookupCoordinator;
    }

    @Bean
    CoordinatorGeoLocationService geoLocationService(LookupCoordinator lookupCoordinator,
                                                     GeoLocationProperties geoLocationProperties,
                                                     Vertx vertx) {

        return new CoordinatorGeoLocationService(vertx.eventBus(), geoLocationProperties.getLookupTimeoutMs());
    }

    @Bean
    DatabaseLoader databaseLoader(GeoLocationProperties geoLocationProperties) {
        return new DatabaseLoader(geoLocationProperties.getRemote().getDatabaseFileNames());
    }

    @Bean(destroyMethod = "shutdown")
    DatabaseInitializer databaseInitializer(GeoLocationProperties geoLocationProperties,
                                            DatabaseLoader databaseLoader,
                                            CoordinatorGeoLocationService geoLocationService,
                                            Vertx vertx,
                                            Clock clock) {

        final RemoteDatabaseProperties remote = geoLocationProperties.getRemote();
        final String downloadUrl = remote.resolveDownloadUrl();

        final DatabaseRefresher databaseRefresher = downloadUrl != null
                ? new DatabaseRefresher(
                downloadUrl,
                remote.getCheckIntervalMs(),
                remote.getRefreshIntervalMs(),
                remote.getTimeoutMs(),
                databaseLoader,
                geoLocationService,
                downloadHttpClient(vertx, remote),
                vertx,
                clock)
                : null;

        return new DatabaseInitializer(
                geoLocationProperties.getDatabaseFile(),
                databaseLoader,
                databaseRefresher,
                geoLocationService,
                vertx);
    }

    private static HttpClient downloadHttpClient(Vertx vertx, RemoteDatabaseProperties remote) {
        final HttpClientOptions options = new HttpClientOptions()
                .setConnectTimeout(Math.toIntExact(remote.getConnectTimeoutMs()))
                .setMaxRedirects(remote.getMaxRedirects())
                .setTryUseCompression(false);

        return vertx.createHttpClient(options);
    }
}
