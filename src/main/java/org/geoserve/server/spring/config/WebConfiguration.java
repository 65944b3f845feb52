package org.geoserve.server.spring.config;

import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.geolocation.DatabaseInitializer;
import org.geoserve.server.geolocation.GeoLocationService;
import org.geoserve.server.handler.LookupHandler;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;
import org.geoserve.server.spring.config.model.GeoLocationProperties;
import org.geoserve.server.vertx.ContextRunner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WebConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(WebConfiguration.class);

    @Autowired
    private ContextRunner contextRunner;

    @Autowired
    private Vertx vertx;

    @Autowired
    private DatabaseInitializer databaseInitializer;

    @Autowired
    @Qualifier("router")
    private Router router;

    @Value("${http.port}")
    private int port;

    @Bean
    LookupHandler lookupHandler(GeoLocationService geoLocationService, GeoLocationProperties geoLocationProperties) {
        return new LookupHandler(
                geoLocationService,
                geoLocationProperties.getBasePath(),
                geoLocationProperties.getAllowOrigin());
    }

    @Bean(name = "router")
    Router router(LookupHandler lookupHandler, GeoLocationProperties geoLocationProperties) {
        final String basePath = StringUtils.removeEnd(geoLocationProperties.getBasePath(), "/");

        final Router router = Router.router(vertx);
        router.get(basePath).handler(lookupHandler);
        router.get(basePath + "/*").handler(lookupHandler);

        return router;
    }

    @PostConstruct
    public void startHttpServer() {
        // requests are accepted only once a database is installed
        contextRunner.<Void>runBlocking(databaseInitializer::initialize);

        logger.info("Starting HTTP server to serve requests on port {}", port);

        contextRunner.<HttpServer>runBlocking(promise -> vertx.createHttpServer(new HttpServerOptions())
                .requestHandler(router)
                .listen(port)
                .onComplete(promise));

        logger.info("Successfully started HTTP server");
    }
}
