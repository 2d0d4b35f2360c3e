package com.densityviz.cli;

import com.densityviz.config.AppConfig;
import com.densityviz.core.CellAggregator;
import com.densityviz.core.GridCell;
import com.densityviz.core.GridGeometry;
import com.densityviz.core.RegionMapper;
import com.densityviz.io.FileOpenException;
import com.densityviz.io.FileTooSmallException;
import com.densityviz.model.SamplingMetrics;
import com.densityviz.service.CellInspection;
import com.densityviz.service.ExportRenderer;
import com.densityviz.service.ExportResult;
import com.densityviz.service.MultiFileBatchScheduler;
import com.densityviz.service.SampleEventBus;
import com.densityviz.service.SamplingListener;
import com.densityviz.service.SchedulerFactory;
import com.densityviz.service.SingleFileScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Command-line front end for the density sampler.
 *
 * Usage:
 *   Scan:   java -jar densityviz.jar scan <file> [refine-seconds]
 *   Folder: java -jar densityviz.jar folder <directory> [seconds]
 *   Export: java -jar densityviz.jar export <file> [width height [bytes]]
 *   Inspect: java -jar densityviz.jar inspect <file> <x> <y>
 */
public class DensityCLI {

    private static final Logger logger = LoggerFactory.getLogger(DensityCLI.class);
    private static final int DEFAULT_FOLDER_SECONDS = 5;

    public static void main(String[] args) {
        if (args.length < 2) {
            printUsage();
            System.exit(1);
        }

        String operation = args[0].toLowerCase();
        Path target = Paths.get(args[1]);
        AppConfig config = new AppConfig();

        try {
            switch (operation) {
                case "scan":
                case "s":
                    scan(config, target, args.length > 2 ? parseInt(args[2], "refine seconds") : 0);
                    break;

                case "folder":
                case "f":
                    folder(config, target, args.length > 2 ? parseInt(args[2], "seconds") : DEFAULT_FOLDER_SECONDS);
                    break;

                case "export":
                case "e":
                    GridGeometry geometry = config.getExportGeometry();
                    int bytes = config.getExportBytesPerSample();
                    if (args.length > 3) {
                        geometry = new GridGeometry(parseInt(args[2], "width"), parseInt(args[3], "height"));
                    }
                    if (args.length > 4) {
                        bytes = parseInt(args[4], "bytes");
                    }
                    export(config, target, geometry, bytes);
                    break;

                case "inspect":
                case "i":
                    if (args.length < 4) {
                        printUsage();
                        System.exit(1);
                    }
                    inspect(config, target, parseInt(args[2], "x"), parseInt(args[3], "y"));
                    break;

                default:
                    System.err.println("Unknown operation: " + operation);
                    printUsage();
                    System.exit(1);
            }

        } catch (FileOpenException | FileTooSmallException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            logger.error("Operation failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            System.exit(130);
        } catch (Exception e) {
            logger.error("Unexpected error", e);
            System.err.println("Unexpected error: " + e.getMessage());
            System.exit(1);
        }
    }

    private static void scan(AppConfig config, Path file, int refineSeconds)
            throws IOException, InterruptedException {
        SampleEventBus bus = new SampleEventBus();
        bus.subscribe(new ProgressPrinter());
        boolean persistent = refineSeconds > 0;

        try (SingleFileScheduler scheduler = SchedulerFactory.createSingleFileScheduler(config, bus)) {
            System.out.println("Sampling...");
            System.out.println("  File:    " + file);
            System.out.println("  Size:    " + formatSize(Files.size(file)));
            System.out.println("  Grid:    " + scheduler.getGeometry());
            System.out.println("  Workers: " + config.getWorkerThreads());

            scheduler.start(file, persistent);
            scheduler.awaitFirstPass(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
            System.out.println("\nFirst pass complete.");

            if (persistent) {
                System.out.println("Refining for " + refineSeconds + " seconds...");
                Thread.sleep(TimeUnit.SECONDS.toMillis(refineSeconds));
            }
            scheduler.stop();

            printGridSummary(scheduler.getAggregator().snapshot(), config.getBytesPerSample());
            printMetrics(config, scheduler.getMetrics());
        }
    }

    private static void folder(AppConfig config, Path directory, int seconds)
            throws IOException, InterruptedException {
        SampleEventBus bus = new SampleEventBus();
        bus.subscribe(new SamplingListener() {
            @Override
            public void onFileDiscovered(Path file) {
                System.out.println("  + " + file.getFileName());
            }

            @Override
            public void onDiscoveryComplete(int discovered) {
                System.out.println("Discovered " + discovered + " files, sampling...");
            }
        });

        GridGeometry geometry = config.getFileSetGeometry();
        System.out.println("Scanning " + directory + " for files of at least "
            + formatSize(MultiFileBatchScheduler.minimumFileSize(geometry, config.getBytesPerSample())));

        try (MultiFileBatchScheduler scheduler = SchedulerFactory.createMultiFileScheduler(config, bus)) {
            scheduler.start(directory);
            Thread.sleep(TimeUnit.SECONDS.toMillis(seconds));
            scheduler.stop();

            CellAggregator aggregator = scheduler.getAggregator();
            System.out.println();
            System.out.println(String.format("%-40s %10s %10s", "File", "Cells", "Mean"));
            for (Path file : scheduler.getActiveFiles()) {
                Map<?, GridCell> cells = aggregator.snapshot(file);
                System.out.println(String.format("%-40s %10d %10.3f",
                    file.getFileName(), cells.size(), meanOf(cells)));
            }
            printMetrics(config, scheduler.getMetrics());
        }
    }

    private static void export(AppConfig config, Path file, GridGeometry geometry, int bytes)
            throws IOException {
        long minSize = RegionMapper.minimumFileSize(geometry, bytes);
        System.out.println("Exporting...");
        System.out.println("  File:         " + file);
        System.out.println("  Resolution:   " + geometry.getWidth() + "x" + geometry.getHeight());
        System.out.println("  Sample bytes: " + bytes);
        System.out.println("  Minimum size: " + formatSize(minSize));

        SampleEventBus bus = new SampleEventBus();
        bus.subscribe(new ProgressPrinter());
        ExportRenderer renderer = SchedulerFactory.createExportRenderer(config, bus);

        long startTime = System.currentTimeMillis();
        ExportResult result = renderer.render(file, geometry, bytes);
        double timeSec = (System.currentTimeMillis() - startTime) / 1000.0;

        System.out.println("\n\nExport complete!");
        System.out.println("  Pixels:     " + result.getSamplesWritten());
        System.out.println("  Mean score: " + String.format("%.3f", result.getMeanScore()));
        System.out.println("  Time:       " + String.format("%.2f", timeSec) + " seconds");
    }

    private static void inspect(AppConfig config, Path file, int x, int y)
            throws IOException, InterruptedException {
        SampleEventBus bus = new SampleEventBus();

        try (SingleFileScheduler scheduler = SchedulerFactory.createSingleFileScheduler(config, bus)) {
            if (!scheduler.getGeometry().contains(x, y)) {
                System.err.println("Cell (" + x + ", " + y + ") is outside " + scheduler.getGeometry());
                System.exit(1);
            }
            scheduler.start(file, false);
            scheduler.awaitFirstPass(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
            scheduler.stop();

            CellInspection inspection = scheduler.inspect(x, y);
            System.out.println("Cell:          (" + x + ", " + y + ")");
            System.out.println("Region start:  " + inspection.getRegionStart());
            System.out.println("Samples:       " + inspection.getCount());
            System.out.println("Average:       " + (inspection.getCell() != null
                ? String.format("%.2f", inspection.getCell().getAverage()) : "N/A"));
            System.out.println("New sample at: " + inspection.getSamplePosition());
            System.out.println("  " + inspection.getSampleHex());
        }
    }

    private static void printGridSummary(Map<?, GridCell> cells, int sampleBytes) {
        long[] histogram = new long[sampleBytes + 1];
        for (GridCell cell : cells.values()) {
            int bucket = (int) Math.round(cell.getAverage());
            histogram[Math.min(sampleBytes, Math.max(1, bucket))]++;
        }

        System.out.println();
        System.out.println("Cells sampled: " + cells.size());
        System.out.println("Mean score:    " + String.format("%.3f", meanOf(cells)));
        System.out.println("Score distribution (rounded cell averages):");
        for (int score = 1; score <= sampleBytes; score++) {
            System.out.println(String.format("  %2d: %,8d", score, histogram[score]));
        }
    }

    private static double meanOf(Map<?, GridCell> cells) {
        return cells.values().stream()
                .mapToDouble(GridCell::getAverage)
                .average()
                .orElse(0);
    }

    private static void printMetrics(AppConfig config, SamplingMetrics metrics) {
        if (config.isMetricsEnabled()) {
            System.out.println();
            System.out.print(metrics.getSummary());
        }
    }

    private static int parseInt(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + value);
            System.exit(1);
            return 0;
        }
    }

    static String formatSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.2f KB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024) return String.format("%.2f MB", bytes / (1024.0 * 1024));
        return String.format("%.2f GB", bytes / (1024.0 * 1024 * 1024));
    }

    private static void printUsage() {
        System.out.println("DensityViz - Byte Density Sampler");
        System.out.println();
        System.out.println("Usage:");
        System.out.println("  Scan:   java -jar densityviz.jar scan <file> [refine-seconds]");
        System.out.println("  Folder: java -jar densityviz.jar folder <directory> [seconds]");
        System.out.println("  Export: java -jar densityviz.jar export <file> [width height [bytes]]");
        System.out.println("  Inspect: java -jar densityviz.jar inspect <file> <x> <y>");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar densityviz.jar scan firmware.bin");
        System.out.println("  java -jar densityviz.jar scan growing.log 30");
        System.out.println("  java -jar densityviz.jar folder ~/Downloads 10");
        System.out.println("  java -jar densityviz.jar export disk.img 3840 2160 16");
        System.out.println("  java -jar densityviz.jar inspect firmware.bin 120 7");
        System.out.println();
        System.out.println("Short forms:");
        System.out.println("  's' for scan, 'f' for folder, 'e' for export, 'i' for inspect");
    }

    private static class ProgressPrinter implements SamplingListener {
        private volatile int lastPercent = -1;

        @Override
        public void onProgress(long processed, long total) {
            int percent = (int) (processed * 100 / total);
            if (percent != lastPercent) {
                lastPercent = percent;
                System.out.print("\rProgress: " + percent + "%");
            }
        }
    }
}
