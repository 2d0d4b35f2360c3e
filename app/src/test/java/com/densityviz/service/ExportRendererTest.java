package com.densityviz.service;

import com.densityviz.core.DistinctByteScoreFunction;
import com.densityviz.core.GridGeometry;
import com.densityviz.core.SampleEvent;
import com.densityviz.core.ScoreFunction;
import com.densityviz.io.FileTooSmallException;
import com.densityviz.util.TestDataGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

/**
 * Tests for one-shot export rendering.
 */
class ExportRendererTest {

    @TempDir
    Path tempDir;

    private SampleEventBus bus;
    private RecordingListener listener;
    private ExportRenderer renderer;

    @BeforeEach
    void setUp() {
        bus = new SampleEventBus();
        listener = new RecordingListener(true);
        bus.subscribe(listener);
        renderer = new ExportRenderer(new DistinctByteScoreFunction(), bus, new Random(5));
    }

    @Test
    void testVisitsPixelsRowByRow() throws Exception {
        Path file = tempDir.resolve("random.bin");
        TestDataGenerator.generateRandomFile(20 * 10 * 8 * 3, file);
        GridGeometry geometry = new GridGeometry(20, 10);

        ExportResult result = renderer.render(file, geometry, 8);

        List<SampleEvent> events = listener.events;
        assertEquals(200, events.size());
        for (int i = 0; i < events.size(); i++) {
            assertEquals(i % 20, events.get(i).getX());
            assertEquals(i / 20, events.get(i).getY());
            assertEquals(file, events.get(i).getFile());
            assertEquals(events.get(i).getScore(), result.getScore(i % 20, i / 20));
        }
        assertTrue(result.isComplete());
        assertEquals(200, result.getSamplesWritten());
    }

    @Test
    void testProgressReportedPerPixel() throws Exception {
        Path file = tempDir.resolve("random.bin");
        TestDataGenerator.generateRandomFile(1_000, file);

        ExportResult result = renderer.render(file, new GridGeometry(5, 5), 4);

        assertEquals(25, listener.progress.size());
        for (int i = 0; i < 25; i++) {
            assertEquals(i + 1L, listener.progress.get(i));
        }
        assertEquals(1, listener.exports.size());
        assertSame(result, listener.exports.get(0));
    }

    @Test
    void testConstantFileScoresOne() throws Exception {
        Path file = tempDir.resolve("zeros.bin");
        TestDataGenerator.generateConstantFile(3_200, (byte) 7, file);

        ExportResult result = renderer.render(file, new GridGeometry(20, 20), 8);

        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 20; x++) {
                assertEquals(1, result.getScore(x, y));
                assertEquals(0.0, result.normalized(x, y));
            }
        }
        assertEquals(1.0, result.getMeanScore());
    }

    @Test
    void testMixedFileHasDenseSecondHalf() throws Exception {
        Path file = tempDir.resolve("mixed.bin");
        TestDataGenerator.generateMixedFile(64_000, file);

        // One row: column x maps to region x, so the left half is all zeros
        ExportResult result = renderer.render(file, new GridGeometry(100, 1), 16);

        for (int x = 0; x < 50; x++) {
            assertEquals(1, result.getScore(x, 0));
        }
        double rightMean = 0;
        for (int x = 50; x < 100; x++) {
            rightMean += result.getScore(x, 0);
        }
        assertTrue(rightMean / 50 > 8, "Random half should be dense");
    }

    @Test
    void testTooSmallFileRejected() throws Exception {
        Path file = tempDir.resolve("small.bin");
        TestDataGenerator.generateRandomFile(100, file);

        assertThrows(FileTooSmallException.class, () -> renderer.render(file, new GridGeometry(100, 100), 8));
        assertEquals(1, listener.errors.size());
        assertTrue(listener.events.isEmpty());
        assertTrue(listener.exports.isEmpty());
    }

    @Test
    void testCancelBeforeRenderIsIgnored() throws Exception {
        Path file = tempDir.resolve("random.bin");
        TestDataGenerator.generateRandomFile(10 * 10 * 8, file);

        renderer.cancel();
        ExportResult result = renderer.render(file, new GridGeometry(10, 10), 8);

        assertTrue(result.isComplete());
        assertEquals(100, result.getSamplesWritten());
    }

    @Test
    void testCancelFromScoringThreadStopsAfterCurrentPixel() throws Exception {
        Path file = tempDir.resolve("random.bin");
        TestDataGenerator.generateRandomFile(10 * 10 * 8, file);
        DistinctByteScoreFunction distinct = new DistinctByteScoreFunction();
        ExportRenderer[] holder = new ExportRenderer[1];
        holder[0] = new ExportRenderer(new ScoreFunction() {
            @Override
            public int score(byte[] data, int offset, int length) {
                holder[0].cancel();
                return distinct.score(data, offset, length);
            }

            @Override
            public String getName() {
                return "cancelling";
            }
        }, bus, new Random(5));

        ExportResult result = holder[0].render(file, new GridGeometry(10, 10), 8);

        assertFalse(result.isComplete());
        assertEquals(1, result.getSamplesWritten());
        assertEquals(List.of(1L), listener.progress);
    }

    @Test
    void testNormalizedSingleByteWindow() {
        ExportResult result = new ExportResult(null, new GridGeometry(1, 1), 1, new int[]{1}, 1, true);
        assertEquals(0.5, result.normalized(0, 0));
    }

    @Test
    void testCancelStopsRender() throws Exception {
        Path file = tempDir.resolve("random.bin");
        TestDataGenerator.generateRandomFile(100 * 100 * 8, file);
        SamplingListener canceller = new SamplingListener() {
            @Override
            public void onProgress(long processed, long total) {
                if (processed == 10) {
                    renderer.cancel();
                }
            }
        };
        bus.subscribe(canceller);

        ExportResult result = renderer.render(file, new GridGeometry(100, 100), 8);

        assertFalse(result.isComplete());
        assertEquals(10, result.getSamplesWritten());
        assertTrue(listener.exports.isEmpty());

        // A new render starts with a fresh token
        bus.unsubscribe(canceller);
        ExportResult again = renderer.render(file, new GridGeometry(10, 10), 8);
        assertTrue(again.isComplete());
    }
}
