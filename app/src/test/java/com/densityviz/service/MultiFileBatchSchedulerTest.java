package com.densityviz.service;

import com.densityviz.core.Coordinate;
import com.densityviz.core.DistinctByteScoreFunction;
import com.densityviz.core.GridGeometry;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.FileTooSmallException;
import com.densityviz.model.SamplingMetrics;
import com.densityviz.util.TestDataGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Tests for batched file-set sampling.
 */
class MultiFileBatchSchedulerTest {

    // 10x10 grid with 8-byte samples needs 800 bytes per file
    private static final GridGeometry GEOMETRY = new GridGeometry(10, 10);

    @TempDir
    Path tempDir;

    private SampleEventBus bus;
    private RecordingListener listener;
    private MultiFileBatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        bus = new SampleEventBus();
        listener = new RecordingListener(true);
        bus.subscribe(listener);
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private MultiFileBatchScheduler newScheduler(int batchSize, long tickMs) {
        scheduler = new MultiFileBatchScheduler(GEOMETRY, 8, 4, batchSize, tickMs,
            new DistinctByteScoreFunction(), bus, new Random(11));
        return scheduler;
    }

    private Path file(String name, long size) throws IOException {
        Path path = tempDir.resolve(name);
        TestDataGenerator.generateRandomFile(size, path, name.hashCode());
        return path;
    }

    private static Map<Path, Long> countByFile(List<BatchSample> samples) {
        return samples.stream().collect(Collectors.groupingBy(BatchSample::getFile, LinkedHashMap::new, Collectors.counting()));
    }

    @Test
    void testDiscoverySkipsSmallFiles() throws Exception {
        Path a = file("a.bin", 1_000);
        Path b = file("b.bin", 800);
        Path c = file("c.bin", 50_000);
        Path small = file("small.bin", 799);
        Files.createDirectory(tempDir.resolve("subdir"));
        newScheduler(500, 1_000);

        scheduler.start(tempDir);
        assertTrue(listener.discoveryDone.await(10, TimeUnit.SECONDS));

        assertEquals(3, listener.discovered.size());
        assertEquals(new HashSet<>(List.of(a, b, c)), new HashSet<>(listener.discovered));
        assertFalse(listener.discovered.contains(small));
        assertEquals(3, scheduler.getActiveFiles().size());
        assertEquals(3, scheduler.getMetrics().get(SamplingMetrics.Counter.FILES_DISCOVERED));
    }

    @Test
    void testMissingDirectoryIsRejected() {
        newScheduler(500, 50);

        assertThrows(FileOpenException.class, () -> scheduler.start(tempDir.resolve("nope")));
        assertEquals(1, listener.errors.size());
        assertFalse(scheduler.isRunning());
    }

    @Test
    void testEveryFileGetsAtLeastOneSample() throws Exception {
        newScheduler(2, 1_000);
        for (int i = 0; i < 3; i++) {
            scheduler.addFile(file("f" + i + ".bin", 900));
        }

        Map<Path, Long> counts = countByFile(scheduler.planTick());

        assertEquals(3, counts.size());
        counts.values().forEach(count -> assertEquals(1L, count));
    }

    @Test
    void testFileAddedMidRunShrinksShares() throws Exception {
        newScheduler(500, 1_000);
        Path a = file("a.bin", 1_000);
        Path b = file("b.bin", 1_000);
        scheduler.addFile(a);
        scheduler.addFile(b);

        assertEquals(250L, countByFile(scheduler.planTick()).get(a));

        Path c = file("c.bin", 1_000);
        scheduler.addFile(c);
        Map<Path, Long> counts = countByFile(scheduler.planTick());

        assertEquals(List.of(a, b, c), new ArrayList<>(counts.keySet()));
        assertEquals(166L, counts.get(a));
        assertEquals(166L, counts.get(c));
    }

    @Test
    void testEachFileCoveredBeforeRepeat() throws Exception {
        newScheduler(30, 1_000);
        Path a = file("a.bin", 1_000);
        scheduler.addFile(a);

        List<Coordinate> sampled = new ArrayList<>();
        for (int tick = 0; tick < 4; tick++) {
            scheduler.planTick().forEach(s -> sampled.add(s.getCoordinate()));
        }

        assertEquals(120, sampled.size());
        assertEquals(100, new HashSet<>(sampled.subList(0, 100)).size());
        assertEquals(20, scheduler.getFileState(a).getCursor());
        assertEquals(1, scheduler.getFileState(a).getCompletedCycles());
    }

    @Test
    void testAddFileRejectsSmallFile() throws Exception {
        newScheduler(500, 1_000);
        Path small = file("small.bin", 10);

        assertThrows(FileTooSmallException.class, () -> scheduler.addFile(small));
        assertTrue(scheduler.getActiveFiles().isEmpty());
    }

    @Test
    void testTickDoesNothingWhenNotRunning() throws Exception {
        newScheduler(500, 1_000);
        scheduler.addFile(file("a.bin", 1_000));

        assertEquals(0, scheduler.runTick());
    }

    @Test
    void testSamplesAllFilesAndStopsCleanly() throws Exception {
        Path a = file("a.bin", 4_000);
        Path b = file("b.bin", 8_000);
        newScheduler(50, 10);

        scheduler.start(tempDir);

        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline
                && scheduler.getAggregator().files().size() < 2) {
            Thread.sleep(10);
        }
        assertEquals(new HashSet<>(List.of(a, b)), scheduler.getAggregator().files());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        int afterStop = listener.samples.get();
        Thread.sleep(200);
        assertEquals(afterStop, listener.samples.get(), "Events arrived after stop");

        for (int i = 0; i < listener.events.size(); i++) {
            assertNotNull(listener.events.get(i).getFile());
        }
        assertTrue(scheduler.getMetrics().get(SamplingMetrics.Counter.TICKS_RUN) > 0);
    }

    @Test
    void testBusyPoolStillTakesNextTick() throws Exception {
        file("a.bin", 1_000);
        CountDownLatch release = new CountDownLatch(1);
        DistinctByteScoreFunction distinct = new DistinctByteScoreFunction();
        ScoreFunction blocking = new ScoreFunction() {
            @Override
            public int score(byte[] data, int offset, int length) {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return distinct.score(data, offset, length);
            }

            @Override
            public String getName() {
                return "blocking";
            }
        };
        // Ticker is effectively idle; ticks are driven by hand
        scheduler = new MultiFileBatchScheduler(GEOMETRY, 8, 2, 10, 3_600_000, blocking, bus, new Random(11));

        try {
            scheduler.start(tempDir);
            assertTrue(listener.discoveryDone.await(10, TimeUnit.SECONDS));

            assertEquals(2, scheduler.runTick());
            assertEquals(2, scheduler.runTick());
            assertEquals(1, scheduler.getMetrics().get(SamplingMetrics.Counter.TICKS_OVERLAPPED));
        } finally {
            release.countDown();
        }

        long deadline = System.currentTimeMillis() + 10_000;
        while (listener.samples.get() < 20 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(20, listener.samples.get());
        assertEquals(2, scheduler.getMetrics().get(SamplingMetrics.Counter.TICKS_RUN));
    }

    @Test
    void testRemovedFileStaysRemovedWhileSampling() throws Exception {
        Path a = file("a.bin", 4_000);
        Path b = file("b.bin", 4_000);
        newScheduler(50, 5);

        scheduler.start(tempDir);
        assertTrue(listener.discoveryDone.await(10, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline
                && scheduler.getAggregator().files().size() < 2) {
            Thread.sleep(10);
        }
        assertEquals(2, scheduler.getAggregator().files().size());

        scheduler.removeFile(a);
        Thread.sleep(200);

        assertTrue(scheduler.getAggregator().snapshot(a).isEmpty(), "Cells of a removed file came back");
        assertEquals(new HashSet<>(List.of(b)), scheduler.getAggregator().files());
        assertEquals(List.of(b), scheduler.getActiveFiles());
        assertNull(scheduler.getFileState(a));
    }

    @Test
    void testRemoveFileDropsCells() throws Exception {
        newScheduler(500, 1_000);
        Path a = file("a.bin", 1_000);
        scheduler.addFile(a);
        scheduler.getAggregator().merge(a, 0, 0, 3);

        scheduler.removeFile(a);

        assertTrue(scheduler.getActiveFiles().isEmpty());
        assertNull(scheduler.getAggregator().get(a, 0, 0));
        assertTrue(scheduler.planTick().isEmpty());
    }

    @Test
    void testRejectsInvalidSettings() {
        DistinctByteScoreFunction score = new DistinctByteScoreFunction();

        assertThrows(IllegalArgumentException.class,
            () -> new MultiFileBatchScheduler(GEOMETRY, 8, 0, 500, 50, score, bus));
        assertThrows(IllegalArgumentException.class,
            () -> new MultiFileBatchScheduler(GEOMETRY, 8, 4, 0, 50, score, bus));
    }
}
