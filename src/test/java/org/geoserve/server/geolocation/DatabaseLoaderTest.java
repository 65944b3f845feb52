package org.geoserve.server.geolocation;

import com.maxmind.db.Metadata;
import com.maxmind.geoip2.DatabaseReader;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.geoserve.server.exception.GeoServeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mock.Strictness.LENIENT;

@ExtendWith(MockitoExtension.class)
public class DatabaseLoaderTest {

    private static final List<String> DATABASE_FILE_NAMES = List.of("GeoLite2-City.mmdb", "GeoLite2-Country.mmdb");
    private static final Instant LAST_MODIFIED = Instant.parse("2024-03-05T07:08:09Z");
    private static final String SOURCE = "https://example.com/db.tar.gz";

    @Mock(strictness = LENIENT)
    private DatabaseReader databaseReader;
    @Mock(strictness = LENIENT)
    private Metadata metadata;

    @TempDir
    Path tempDir;

    private RecordingDatabaseLoader databaseLoader;

    @BeforeEach
    public void setUp() {
        given(databaseReader.getMetadata()).willReturn(metadata);
        given(metadata.getDatabaseType()).willReturn("GeoLite2-City");

        databaseLoader = new RecordingDatabaseLoader(DATABASE_FILE_NAMES, databaseReader);
    }

    @Test
    public void creationShouldFailOnEmptyDatabaseFileNames() {
        assertThatIllegalArgumentException().isThrownBy(() -> new DatabaseLoader(emptyList()));
    }

    @Test
    public void fromArchiveShouldOpenDatabaseEntryOfTarArchive() throws IOException {
        // given
        final Map<String, String> entries = new LinkedHashMap<>();
        entries.put("GeoLite2-City_20240305/", null);
        entries.put("GeoLite2-City_20240305/LICENSE.txt", "license");
        entries.put("GeoLite2-City_20240305/GeoLite2-City.mmdb", "city-database");

        // when
        final DatabaseHandle handle = databaseLoader.fromArchive(tarGz(entries), SOURCE, LAST_MODIFIED);

        // then
        assertThat(databaseLoader.openedContents).containsExactly("city-database");
        assertThat(handle.getSource()).isEqualTo(SOURCE);
        assertThat(handle.getLastModified()).isEqualTo(LAST_MODIFIED);
        assertThat(handle.isCityEdition()).isTrue();
    }

    @Test
    public void fromArchiveShouldOpenFirstMatchingEntry() throws IOException {
        // given
        final Map<String, String> entries = new LinkedHashMap<>();
        entries.put("GeoLite2-Country.mmdb", "country-database");
        entries.put("GeoLite2-City.mmdb", "city-database");

        // when
        databaseLoader.fromArchive(tarGz(entries), SOURCE, LAST_MODIFIED);

        // then
        assertThat(databaseLoader.openedContents).containsExactly("country-database");
    }

    @Test
    public void fromArchiveShouldFailWhenArchiveHasNoDatabaseEntry() throws IOException {
        // given
        final byte[] archive = tarGz(Map.of("README.txt", "nothing here"));

        // when and then
        assertThatThrownBy(() -> databaseLoader.fromArchive(archive, SOURCE, LAST_MODIFIED))
                .isInstanceOf(GeoServeException.class)
                .hasMessageStartingWith("Database file")
                .hasMessageContaining("not found in archive from " + SOURCE);
        assertThat(databaseLoader.openedContents).isEmpty();
    }

    @Test
    public void fromArchiveShouldOpenGzippedDatabaseFile() throws IOException {
        // when
        databaseLoader.fromArchive(gzip("plain-database"), SOURCE, LAST_MODIFIED);

        // then
        assertThat(databaseLoader.openedContents).containsExactly("plain-database");
    }

    @Test
    public void fromArchiveShouldFailOnNonGzipContent() {
        // given
        final byte[] archive = "<html>Invalid license key</html>".getBytes(StandardCharsets.UTF_8);

        // when and then
        assertThatThrownBy(() -> databaseLoader.fromArchive(archive, SOURCE, LAST_MODIFIED))
                .isInstanceOf(GeoServeException.class)
                .hasMessageStartingWith("IO Exception occurred while trying to read an archive/db file from "
                        + SOURCE);
    }

    @Test
    public void fromArchiveShouldDetectCountryEdition() throws IOException {
        // given
        given(metadata.getDatabaseType()).willReturn("GeoLite2-Country");

        // when
        final DatabaseHandle handle = databaseLoader.fromArchive(gzip("country-database"), SOURCE, LAST_MODIFIED);

        // then
        assertThat(handle.isCityEdition()).isFalse();
    }

    @Test
    public void fromFileShouldUseFileModificationTime() throws IOException {
        // given
        final Path databaseFile = tempDir.resolve("GeoLite2-City.mmdb");
        Files.writeString(databaseFile, "file-database");
        Files.setLastModifiedTime(databaseFile, FileTime.from(LAST_MODIFIED));

        // when
        final DatabaseHandle handle = databaseLoader.fromFile(databaseFile.toString());

        // then
        assertThat(databaseLoader.openedContents).containsExactly("file-database");
        assertThat(handle.getSource()).isEqualTo(databaseFile.toString());
        assertThat(handle.getLastModified()).isEqualTo(LAST_MODIFIED);
    }

    @Test
    public void fromFileShouldFailWhenFileIsMissing() {
        // given
        final String databaseFile = tempDir.resolve("missing.mmdb").toString();

        // when and then
        assertThatThrownBy(() -> databaseLoader.fromFile(databaseFile))
                .isInstanceOf(GeoServeException.class)
                .hasMessageStartingWith("Unable to read database file " + databaseFile);
    }

    private static byte[] tarGz(Map<String, String> entries) throws IOException {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tarOutput = new TarArchiveOutputStream(new GzipCompressorOutputStream(output))) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                final byte[] content = entry.getValue() != null
                        ? entry.getValue().getBytes(StandardCharsets.UTF_8)
                        : new byte[0];

                final TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey());
                tarEntry.setSize(content.length);
                tarOutput.putArchiveEntry(tarEntry);
                tarOutput.write(content);
                tarOutput.closeArchiveEntry();
            }
        }
        return output.toByteArray();
    }

    private static byte[] gzip(String content) throws IOException {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (GzipCompressorOutputStream gzipOutput = new GzipCompressorOutputStream(output)) {
            gzipOutput.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return output.toByteArray();
    }

    private static class RecordingDatabaseLoader extends DatabaseLoader {

        private final List<String> openedContents = new ArrayList<>();
        private final DatabaseReader databaseReader;

        RecordingDatabaseLoader(List<String> databaseFileNames, DatabaseReader databaseReader) {
            super(databaseFileNames);
            this.databaseReader = databaseReader;
        }

        @Override
        protected DatabaseReader openReader(InputStream input) throws IOException {
            openedContents.add(new String(input.readAllBytes(), StandardCharsets.UTF_8));
            return databaseReader;
        }
    }
}
