package org.geoserve.server.geolocation;

import io.vertx.core.Future;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import org.geoserve.server.geolocation.model.LookupResult;
import org.geoserve.server.vertx.LocalMessageCodec;

import java.util.Objects;

/**
 * Event-bus facade of the {@link LookupCoordinator}.
 * <p>
 * Every call is a single request whose reply (result or failure) completes the returned future exactly once; the
 * send timeout bounds the wait when the coordinator does not answer.
 */
public class CoordinatorGeoLocationService implements GeoLocationService {

    private final EventBus eventBus;
    private final DeliveryOptions lookupDeliveryOptions;
    private final DeliveryOptions replaceDeliveryOptions;

    public CoordinatorGeoLocationService(EventBus eventBus, long lookupTimeoutMs) {
        this.eventBus = Objects.requireNonNull(eventBus);

        lookupDeliveryOptions = new DeliveryOptions()
                .setLocalOnly(true)
                .setSendTimeout(lookupTimeoutMs);

        replaceDeliveryOptions = new DeliveryOptions()
                .setLocalOnly(true)
                .setCodecName(LocalMessageCodec.codecName());
    }

    @Override
    public Future<LookupResult> lookup(String ip) {
        return eventBus.<LookupResult>request(LookupCoordinator.LOOKUP_ADDRESS, ip, lookupDeliveryOptions)
                .map(Message::body);
    }

    /**
     * Hands the database over to the coordinator. Succeeds once it is installed and the cache is invalidated.
     */
    public Future<Void> replaceDatabase(DatabaseHandle databaseHandle) {
        return eventBus.request(LookupCoordinator.REPLACE_DATABASE_ADDRESS,
                        Objects.requireNonNull(databaseHandle), replaceDeliveryOptions)
                .mapEmpty();
    }
}
