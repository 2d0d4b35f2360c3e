package com.densityviz.service;

import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import com.densityviz.io.FileOpenException;
import com.densityviz.model.SamplingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Lists the regular files of a directory (not recursive) that are large
 * enough for the file-set grid. Entries that cannot be inspected are skipped.
 */
public class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    private final GridGeometry geometry;
    private final int sampleBytes;
    private final SamplingMetrics metrics;

    public DirectoryScanner(GridGeometry geometry, int sampleBytes, SamplingMetrics metrics) {
        this.geometry = geometry;
        this.sampleBytes = sampleBytes;
        this.metrics = metrics;
    }

    /**
     * Scan a directory, passing each qualifying file to {@code onFile}.
     *
     * @return Number of qualifying files
     * @throws FileOpenException If the directory itself cannot be listed
     */
    public int scan(Path directory, CancellationToken token, Consumer<Path> onFile) throws FileOpenException {
        if (!Files.isDirectory(directory)) {
            throw new FileOpenException(directory, Files.exists(directory) ? "Not a directory" : "Directory does not exist");
        }

        long minSize = RegionMapper.minimumFileSize(geometry, sampleBytes);
        int found = 0;

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            Iterator<Path> entries = stream.iterator();
            while (!token.isCancelled() && entries.hasNext()) {
                Path entry = entries.next();
                if (accept(entry, minSize)) {
                    found++;
                    onFile.accept(entry);
                }
            }
        } catch (DirectoryIteratorException e) {
            logger.warn("Directory listing of {} aborted after {} files", directory, found, e.getCause());
        } catch (IOException e) {
            throw new FileOpenException(directory, "Cannot list directory", e);
        }

        logger.info("Discovered {} files of at least {} bytes in {}", found, minSize, directory);
        return found;
    }

    private boolean accept(Path entry, long minSize) {
        try {
            if (!Files.isRegularFile(entry)) {
                return false;
            }
            long size = Files.size(entry);
            if (size < minSize) {
                logger.debug("Skipping {}: {} bytes is below {}", entry.getFileName(), size, minSize);
                return false;
            }
            return true;
        } catch (IOException | SecurityException e) {
            metrics.increment(SamplingMetrics.Counter.ENTRIES_SKIPPED);
            logger.warn("Skipping unreadable entry {}: {}", entry, e.getMessage());
            return false;
        }
    }
}
