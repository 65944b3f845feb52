package org.geoserve.server.spring.config;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.geoserve.server.vertx.ContextRunner;
import org.geoserve.server.vertx.LocalMessageCodec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VertxConfiguration {

    @Bean(destroyMethod = "close")
    Vertx vertx(@Value("${vertx.worker-pool-size}") int workerPoolSize,
                @Value("${vertx.event-loop-pool-size}") int eventLoopPoolSize) {

        final VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(workerPoolSize)
                .setPreferNativeTransport(true);
        if (eventLoopPoolSize > 0) {
            options.setEventLoopPoolSize(eventLoopPoolSize);
        }

        final Vertx vertx = Vertx.vertx(options);
        vertx.eventBus().registerCodec(LocalMessageCodec.create());

        return vertx;
    }

    @Bean
    ContextRunner contextRunner(Vertx vertx, @Value("${vertx.init-timeout-ms}") long initTimeoutMs) {
        return new ContextRunner(vertx, initTimeoutMs);
    }
}
