package com.densityviz.io;

import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only handle for random sampling of a file that other processes may be
 * reading or writing at the same time.
 *
 * The channel is opened with {@link StandardOpenOption#READ} only and no
 * {@link java.nio.channels.FileLock} is ever taken; on Windows the JDK opens
 * it with read, write and delete sharing. Each worker owns its own reader.
 */
public class SharedFileReader implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(SharedFileReader.class);

    private final Path path;
    private final FileChannel channel;

    private SharedFileReader(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
    }

    /**
     * Open a file for shared reading.
     *
     * @throws FileOpenException If the path is missing, not a regular file or not readable
     */
    public static SharedFileReader open(Path path) throws FileOpenException {
        if (!Files.isRegularFile(path)) {
            throw new FileOpenException(path, Files.exists(path) ? "Not a regular file" : "File does not exist");
        }
        try {
            FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
            logger.trace("Opened shared reader for {}", path);
            return new SharedFileReader(path, channel);
        } catch (NoSuchFileException e) {
            throw new FileOpenException(path, "File does not exist", e);
        } catch (AccessDeniedException e) {
            throw new FileOpenException(path, "Access denied", e);
        } catch (IOException | SecurityException e) {
            throw new FileOpenException(path, "Cannot open file", e);
        }
    }

    /**
     * Check that a file exists and is large enough for the geometry.
     *
     * @return The file size
     */
    public static long checkMappable(Path path, GridGeometry geometry, int sampleBytes)
            throws FileOpenException, FileTooSmallException {
        long size;
        try {
            if (!Files.isRegularFile(path)) {
                throw new FileOpenException(path, Files.exists(path) ? "Not a regular file" : "File does not exist");
            }
            size = Files.size(path);
        } catch (FileOpenException e) {
            throw e;
        } catch (IOException | SecurityException e) {
            throw new FileOpenException(path, "Cannot read file size", e);
        }

        long required = RegionMapper.minimumFileSize(geometry, sampleBytes);
        if (size < required) {
            throw new FileTooSmallException(path, size, required);
        }
        return size;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Current size of the file. May change while sampling if another process
     * writes to it.
     */
    public long size() throws IOException {
        return channel.size();
    }

    public void seek(long position) throws SampleReadException {
        try {
            channel.position(position);
        } catch (IOException | IllegalArgumentException e) {
            throw new SampleReadException(position, e);
        }
    }

    /**
     * Read up to {@code length} bytes from the current position. Stops early
     * at end of file.
     *
     * @return Number of bytes read, 0 at end of file
     */
    public int readUpTo(byte[] buffer, int length) throws SampleReadException {
        ByteBuffer target = ByteBuffer.wrap(buffer, 0, length);
        long start = -1;
        try {
            start = channel.position();
            while (target.hasRemaining()) {
                if (channel.read(target) < 0) {
                    break;
                }
            }
        } catch (IOException e) {
            throw new SampleReadException(start, e);
        }
        return target.position();
    }

    /**
     * Seek and read in one step.
     */
    public int readAt(long position, byte[] buffer, int length) throws SampleReadException {
        seek(position);
        return readUpTo(buffer, length);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
