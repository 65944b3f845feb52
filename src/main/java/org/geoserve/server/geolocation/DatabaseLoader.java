package org.geoserve.server.geolocation;

import com.maxmind.db.CHMCache;
import com.maxmind.db.Reader;
import com.maxmind.geoip2.DatabaseReader;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.utils.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.geoserve.server.exception.GeoServeException;
import org.geoserve.server.log.Logger;
import org.geoserve.server.log.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Opens {@link DatabaseHandle}s from an uncompressed database file or from a downloaded gzip archive.
 * <p>
 * Archives are either tar+gzip bundles containing the database under one of the recognized file names (the first
 * matching entry wins), or a single gzip-compressed database file.
 */
public class DatabaseLoader {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseLoader.class);

    private static final int TAR_HEADER_SIZE = 512;

    private final List<String> databaseFileNames;

    public DatabaseLoader(List<String> databaseFileNames) {
        if (Objects.requireNonNull(databaseFileNames).isEmpty()) {
            throw new IllegalArgumentException("At least one database file name should be configured");
        }
        this.databaseFileNames = List.copyOf(databaseFileNames);
    }

    public DatabaseHandle fromFile(String filePath) {
        try {
            final Path path = Paths.get(filePath);
            final Instant lastModified = Files.getLastModifiedTime(path).toInstant();
            try (InputStream input = new BufferedInputStream(Files.newInputStream(path))) {
                final DatabaseHandle handle = DatabaseHandle.of(openReader(input), filePath, lastModified);
                logger.info("Opened geo location database from file {}, last modified {}", filePath, lastModified);
                return handle;
            }
        } catch (IOException | InvalidPathException e) {
            throw new GeoServeException(
                    "Unable to read database file %s: %s".formatted(filePath, e.getMessage()), e);
        }
    }

    public DatabaseHandle fromArchive(byte[] archive, String source, Instant lastModified) {
        try (InputStream input = new BufferedInputStream(
                new GzipCompressorInputStream(new ByteArrayInputStream(archive)))) {

            final DatabaseReader databaseReader = isTarArchive(input)
                    ? readFromTarArchive(new TarArchiveInputStream(input), source)
                    : openReader(input);

            final DatabaseHandle handle = DatabaseHandle.of(databaseReader, source, lastModified);
            logger.info("Opened geo location database from {}, last modified {}", source, lastModified);
            return handle;
        } catch (IOException e) {
            throw new GeoServeException(
                    "IO Exception occurred while trying to read an archive/db file from %s: %s"
                            .formatted(source, e.getMessage()), e);
        }
    }

    /**
     * Creates the decoder over the given stream, reading it fully into memory.
     */
    protected DatabaseReader openReader(InputStream input) throws IOException {
        return new DatabaseReader.Builder(input)
                .fileMode(Reader.FileMode.MEMORY)
                .withCache(new CHMCache())
                .build();
    }

    private DatabaseReader readFromTarArchive(TarArchiveInputStream tarInput, String source) throws IOException {
        TarArchiveEntry currentEntry;
        while ((currentEntry = tarInput.getNextEntry()) != null) {
            if (!currentEntry.isDirectory() && isDatabaseFile(currentEntry.getName())) {
                logger.debug("Found database file {} in archive from {}", currentEntry.getName(), source);
                return openReader(tarInput);
            }
        }

        throw new GeoServeException(
                "Database file %s not found in archive from %s".formatted(databaseFileNames, source));
    }

    private boolean isDatabaseFile(String entryName) {
        final String fileName = StringUtils.substringAfterLast("/" + entryName, "/");
        return databaseFileNames.contains(fileName);
    }

    private static boolean isTarArchive(InputStream input) throws IOException {
        final byte[] header = new byte[TAR_HEADER_SIZE];
        input.mark(TAR_HEADER_SIZE);
        final int read = IOUtils.readFully(input, header);
        input.reset();

        return TarArchiveInputStream.matches(header, read);
    }
}
