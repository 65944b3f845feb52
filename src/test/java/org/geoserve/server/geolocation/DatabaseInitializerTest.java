package org.geoserve.server.geolocation;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.geoserve.server.exception.GeoServeException;
import org.geoserve.server.geolocation.DatabaseRefresher.RefreshOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.concurrent.Callable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mock.Strictness.LENIENT;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
public class DatabaseInitializerTest {

    private static final String DATABASE_FILE = "/var/lib/geoserve/GeoLite2-City.mmdb";
    private static final Instant LAST_MODIFIED = Instant.parse("2024-03-05T07:08:09Z");

    @Mock(strictness = LENIENT)
    private Vertx vertx;
    @Mock(strictness = LENIENT)
    private DatabaseLoader databaseLoader;
    @Mock(strictness = LENIENT)
    private DatabaseRefresher databaseRefresher;
    @Mock(strictness = LENIENT)
    private CoordinatorGeoLocationService geoLocationService;
    @Mock(strictness = LENIENT)
    private DatabaseHandle databaseHandle;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        given(vertx.executeBlocking(any(Callable.class))).willAnswer(invocation -> {
            try {
                return Future.succeededFuture(((Callable<Object>) invocation.getArgument(0)).call());
            } catch (Exception e) {
                return Future.failedFuture(e);
            }
        });

        given(databaseLoader.fromFile(DATABASE_FILE)).willReturn(databaseHandle);
        given(databaseHandle.getLastModified()).willReturn(LAST_MODIFIED);
        given(geoLocationService.replaceDatabase(any())).willReturn(Future.succeededFuture());
    }

    @Test
    public void initializeShouldInstallDatabaseFileAndStartRefresherWithItsModificationTime() {
        // given
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                DATABASE_FILE, databaseLoader, databaseRefresher, geoLocationService, vertx);

        // when
        final Promise<Void> promise = Promise.promise();
        databaseInitializer.initialize(promise);

        // then
        assertThat(promise.future().succeeded()).isTrue();
        verify(geoLocationService).replaceDatabase(databaseHandle);

        final InOrder inOrder = inOrder(databaseRefresher);
        inOrder.verify(databaseRefresher).setLastKnownModified(LAST_MODIFIED);
        inOrder.verify(databaseRefresher).start();
        verify(databaseRefresher, never()).refresh();
    }

    @Test
    public void initializeShouldInstallDatabaseFileWithoutRemoteSource() {
        // given
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                DATABASE_FILE, databaseLoader, null, geoLocationService, vertx);

        // when
        final Promise<Void> promise = Promise.promise();
        databaseInitializer.initialize(promise);

        // then
        assertThat(promise.future().succeeded()).isTrue();
        verify(geoLocationService).replaceDatabase(databaseHandle);
    }

    @Test
    public void initializeShouldFailWhenDatabaseFileIsUnreadable() {
        // given
        given(databaseLoader.fromFile(DATABASE_FILE)).willThrow(new GeoServeException("Unable to read database file"));
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                DATABASE_FILE, databaseLoader, databaseRefresher, geoLocationService, vertx);

        // when
        final Promise<Void> promise = Promise.promise();
        databaseInitializer.initialize(promise);

        // then
        assertThat(promise.future().failed()).isTrue();
        assertThat(promise.future().cause()).hasMessage("Unable to read database file");
        verifyNoInteractions(geoLocationService, databaseRefresher);
    }

    @Test
    public void initializeShouldDownloadDatabaseWhenNoFileConfigured() {
        // given
        given(databaseRefresher.refresh()).willReturn(Future.succeededFuture(RefreshOutcome.UPDATED));
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                " ", databaseLoader, databaseRefresher, geoLocationService, vertx);

        // when
        final Promise<Void> promise = Promise.promise();
        databaseInitializer.initialize(promise);

        // then
        assertThat(promise.future().succeeded()).isTrue();
        verify(databaseRefresher).start();
        verifyNoInteractions(databaseLoader);
    }

    @Test
    public void initializeShouldFailWhenInitialDownloadFailed() {
        // given
        given(databaseRefresher.refresh()).willReturn(Future.succeededFuture(RefreshOutcome.FAILED));
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                null, databaseLoader, databaseRefresher, geoLocationService, vertx);

        // when
        final Promise<Void> promise = Promise.promise();
        databaseInitializer.initialize(promise);

        // then
        assertThat(promise.future().failed()).isTrue();
        assertThat(promise.future().cause())
                .isInstanceOf(GeoServeException.class)
                .hasMessage("Initial download of geo location database finished with FAILED");
        verify(databaseRefresher, never()).start();
    }

    @Test
    public void initializeShouldFailWhenNoSourceConfigured() {
        // given
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                null, databaseLoader, null, geoLocationService, vertx);

        // when
        final Promise<Void> promise = Promise.promise();
        databaseInitializer.initialize(promise);

        // then
        assertThat(promise.future().failed()).isTrue();
        assertThat(promise.future().cause())
                .hasMessage("Neither database file nor remote database source is configured");
    }

    @Test
    public void shutdownShouldStopRefresher() {
        // given
        final DatabaseInitializer databaseInitializer = new DatabaseInitializer(
                DATABASE_FILE, databaseLoader, databaseRefresher, geoLocationService, vertx);

        // when
        databaseInitializer.shutdown();

        // then
        verify(databaseRefresher).stop();
    }
}
