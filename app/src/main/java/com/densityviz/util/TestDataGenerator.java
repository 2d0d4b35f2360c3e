package com.densityviz.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Random;

/**
 * Utility to generate files with known byte density for tests and demos.
 */
public class TestDataGenerator {

    private static final Logger logger = LoggerFactory.getLogger(TestDataGenerator.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Generate a file of uniformly random bytes.
     *
     * @param sizeBytes Size in bytes
     * @param outputPath Output file path
     */
    public static void generateRandomFile(long sizeBytes, Path outputPath) throws IOException {
        generateRandomFile(sizeBytes, outputPath, 42);
    }

    public static void generateRandomFile(long sizeBytes, Path outputPath, long seed) throws IOException {
        logger.debug("Generating {} byte random file: {}", sizeBytes, outputPath);
        Random random = new Random(seed);
        byte[] buffer = new byte[BUFFER_SIZE];

        try (BufferedOutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
            long remaining = sizeBytes;
            while (remaining > 0) {
                int toWrite = (int) Math.min(buffer.length, remaining);
                random.nextBytes(buffer);
                out.write(buffer, 0, toWrite);
                remaining -= toWrite;
            }
        }
    }

    /**
     * Generate a file where every byte has the same value (score 1 everywhere).
     */
    public static void generateConstantFile(long sizeBytes, byte value, Path outputPath) throws IOException {
        logger.debug("Generating {} byte constant file: {}", sizeBytes, outputPath);
        byte[] buffer = new byte[BUFFER_SIZE];
        Arrays.fill(buffer, value);

        try (BufferedOutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
            long remaining = sizeBytes;
            while (remaining > 0) {
                int toWrite = (int) Math.min(buffer.length, remaining);
                out.write(buffer, 0, toWrite);
                remaining -= toWrite;
            }
        }
    }

    /**
     * Generate a file whose first half is zeros and second half is random,
     * giving a sharp density edge in the middle of the grid.
     */
    public static void generateMixedFile(long sizeBytes, Path outputPath) throws IOException {
        logger.debug("Generating {} byte mixed file: {}", sizeBytes, outputPath);
        Random random = new Random(42);
        byte[] zeros = new byte[BUFFER_SIZE];
        byte[] noise = new byte[BUFFER_SIZE];
        long half = sizeBytes / 2;

        try (BufferedOutputStream out = new BufferedOutputStream(Files.newOutputStream(outputPath))) {
            long written = 0;
            while (written < sizeBytes) {
                boolean lowHalf = written < half;
                long limit = lowHalf ? half : sizeBytes;
                int toWrite = (int) Math.min(BUFFER_SIZE, limit - written);
                if (lowHalf) {
                    out.write(zeros, 0, toWrite);
                } else {
                    random.nextBytes(noise);
                    out.write(noise, 0, toWrite);
                }
                written += toWrite;
            }
        }
    }

    /**
     * CLI entry point.
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: TestDataGenerator <sizeBytes> [outputFile] [--constant|--mixed]");
            System.exit(1);
        }

        try {
            long sizeBytes = Long.parseLong(args[0]);
            String outputFile = args.length > 1 ? args[1] : "density-" + sizeBytes + ".bin";
            String mode = args.length > 2 ? args[2] : "";

            Path outputPath = Paths.get(outputFile);

            switch (mode) {
                case "--constant":
                    generateConstantFile(sizeBytes, (byte) 0, outputPath);
                    break;
                case "--mixed":
                    generateMixedFile(sizeBytes, outputPath);
                    break;
                default:
                    generateRandomFile(sizeBytes, outputPath);
            }

            System.out.println("Generated: " + outputPath.toAbsolutePath());

        } catch (Exception e) {
            logger.error("Failed to generate test file", e);
            System.exit(1);
        }
    }
}
