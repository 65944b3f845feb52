package org.geoserve.server.vertx;

import io.vertx.core.Promise;

/**
 * Denotes components that must finish their initialization before the application starts serving requests.
 * <p>
 * Initialization is performed on a Vert.x context, see {@link ContextRunner#runBlocking(io.vertx.core.Handler)}.
 */
@FunctionalInterface
public interface Initializable {

    void initialize(Promise<Void> initializePromise);
}
