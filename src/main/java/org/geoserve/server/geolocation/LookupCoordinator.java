package org.geoserve.server.geolocation;

import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.AbstractCountryResponse;
import inet.ipaddr.IPAddress;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import org.geoserve.server.exception.GeoServeException;
import org.geoserve.server.geolocation.model.LookupResult;
import org.geoserve.server.json.JacksonMapper;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;
import org.geoserve.server.vertx.LocalMessageCodec;

import java.io.IOException;
import java.util.Objects;

/**
 * Owner of the active {@link DatabaseHandle} and the {@link ResponseCache} derived from it.
 * <p>
 * Must be deployed as a single verticle instance: both event-bus consumers are then invoked on the same Vert.x
 * context one message at a time, so a lookup always observes either the database/cache pair before a replacement
 * or the pair after it, never a mixture. Other components talk to it only through the event bus, see
 * {@link CoordinatorGeoLocationService}.
 * <p>
 * Lookup failures (invalid address, address not found, decoder or encoding errors) are replied as
 * {@link io.vertx.core.eventbus.ReplyException} with {@link #LOOKUP_FAILURE_CODE} and are never cached.
 */
public class LookupCoordinator extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(LookupCoordinator.class);

    public static final String LOOKUP_ADDRESS = "geolocation.lookup";
    public static final String REPLACE_DATABASE_ADDRESS = "geolocation.replace-database";

    public static final int LOOKUP_FAILURE_CODE = 500;

    private final int cacheCapacity;
    private final JacksonMapper mapper;
    private final DeliveryOptions replyDeliveryOptions;

    private DatabaseHandle activeDatabase;
    private ResponseCache cache;

    public LookupCoordinator(int cacheCapacity, JacksonMapper mapper) {
        this.cache = new ResponseCache(cacheCapacity);
        this.cacheCapacity = cacheCapacity;
        this.mapper = Objects.requireNonNull(mapper);

        replyDeliveryOptions = new DeliveryOptions()
                .setLocalOnly(true)
                .setCodecName(LocalMessageCodec.codecName());
    }

    @Override
    public void start(Promise<Void> startPromise) {
        final EventBus eventBus = vertx.eventBus();
        final MessageConsumer<String> lookupConsumer = eventBus.localConsumer(LOOKUP_ADDRESS, this::handleLookup);
        final MessageConsumer<DatabaseHandle> replaceConsumer =
                eventBus.localConsumer(REPLACE_DATABASE_ADDRESS, this::handleReplaceDatabase);

        final Promise<Void> lookupRegistered = Promise.promise();
        final Promise<Void> replaceRegistered = Promise.promise();
        lookupConsumer.completionHandler(lookupRegistered);
        replaceConsumer.completionHandler(replaceRegistered);

        lookupRegistered.future()
                .compose(ignored -> replaceRegistered.future())
                .onSuccess(ignored -> logger.info("Lookup coordinator started with cache capacity {}", cacheCapacity))
                .onComplete(startPromise);
    }

    @Override
    public void stop() {
        final DatabaseHandle database = activeDatabase;
        activeDatabase = null;
        cache.clear();
        closeDatabase(database);
    }

    private void handleLookup(Message<String> message) {
        final String ip = message.body();

        final LookupResult result;
        try {
            result = lookup(ip);
        } catch (RuntimeException e) {
            logger.warn("Unable to look up ip address {}: {}", ip, e.getMessage());
            message.fail(LOOKUP_FAILURE_CODE, e.getMessage());
            return;
        }

        message.reply(result, replyDeliveryOptions);
    }

    private LookupResult lookup(String ip) {
        final IPAddress address = IpAddressNormalizer.parse(ip);
        final String key = IpAddressNormalizer.normalize(address);

        final byte[] cached = cache.get(key);
        if (cached != null) {
            logger.trace("Cache hit for {}", key);
            return LookupResult.of(key, cached);
        }

        if (activeDatabase == null) {
            throw new GeoServeException("Geo location database hasn't been loaded yet, try again later");
        }

        logger.trace("Cache miss for {}, looking up geolocation info", key);
        final AbstractCountryResponse response;
        try {
            response = activeDatabase.lookup(address.toInetAddress());
        } catch (IOException | GeoIp2Exception e) {
            throw new GeoServeException("Lookup in %s failed: %s".formatted(activeDatabase, e.getMessage()), e);
        }

        final byte[] body = mapper.encodeToBytes(response);
        cache.put(key, body);
        return LookupResult.of(key, body);
    }

    private void handleReplaceDatabase(Message<DatabaseHandle> message) {
        final DatabaseHandle newDatabase = message.body();
        if (newDatabase == null) {
            message.fail(LOOKUP_FAILURE_CODE, "Database to install is missing");
            return;
        }

        final DatabaseHandle previousDatabase = activeDatabase;
        activeDatabase = newDatabase;
        cache = new ResponseCache(cacheCapacity);
        logger.info("Applied geo location database {}, cached lookups cleared", newDatabase);

        message.reply(null);

        // nothing can reach the previous handle anymore
        closeDatabase(previousDatabase);
    }

    private static void closeDatabase(DatabaseHandle database) {
        if (database == null) {
            return;
        }

        try {
            database.close();
            logger.debug("Closed geo location database {}", database);
        } catch (IOException e) {
            logger.error("Failed to close geo location database {}", e, database);
        }
    }
}
