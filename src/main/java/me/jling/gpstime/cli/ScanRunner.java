package me.jling.gpstime.cli;

import lombok.extern.slf4j.Slf4j;
import me.jling.gpstime.exception.ExifTimeException;
import me.jling.gpstime.image.core.time.ExifTimeReconciler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Walks every root given on the command line and prints one line per file.
 *
 * <p>Files are reconciled on {@code scanExecutor} but printed in path order, at
 * most {@code gpstime.scan.queue-capacity} of them in flight at a time.
 */
@Slf4j
@Component
public class ScanRunner implements ApplicationRunner {

    private final ExifTimeReconciler reconciler;
    private final ResultFormatter formatter;
    private final Executor scanExecutor;
    private final PrintStream out;
    private final int batchSize;

    @Value("${gpstime.scan.follow-links:false}")
    private boolean followLinks;

    @Autowired
    public ScanRunner(ExifTimeReconciler reconciler,
                      ResultFormatter formatter,
                      @Qualifier("scanExecutor") Executor scanExecutor,
                      @Value("${gpstime.scan.queue-capacity:64}") int batchSize) {
        this(reconciler, formatter, scanExecutor, System.out, batchSize);
    }

    ScanRunner(ExifTimeReconciler reconciler, ResultFormatter formatter, Executor scanExecutor, PrintStream out) {
        this(reconciler, formatter, scanExecutor, out, 64);
    }

    ScanRunner(ExifTimeReconciler reconciler, ResultFormatter formatter, Executor scanExecutor,
               PrintStream out, int batchSize) {
        this.reconciler = reconciler;
        this.formatter = formatter;
        this.scanExecutor = scanExecutor;
        this.out = out;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> roots = args.getNonOptionArgs();
        if (roots.isEmpty()) {
            log.info("usage: gpstime-check <file-or-directory>...");
            return;
        }
        for (String root : roots) {
            scan(Path.of(root));
        }
    }

    public void scan(Path root) {
        List<Path> files;
        try {
            files = listFiles(root);
        } catch (IOException e) {
            log.warn("[scan] cannot walk {}: {}", root, e.toString());
            return;
        }

        for (int from = 0; from < files.size(); from += batchSize) {
            List<Path> batch = files.subList(from, Math.min(files.size(), from + batchSize));
            List<CompletableFuture<String>> lines = new ArrayList<>(batch.size());
            for (Path file : batch) {
                lines.add(CompletableFuture.supplyAsync(() -> describe(root, file), scanExecutor));
            }
            for (CompletableFuture<String> line : lines) {
                out.println(line.join());
            }
            out.flush();
        }
    }

    String describe(Path root, Path file) {
        String rel = relative(root, file);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            return rel + ": " + formatter.format(reconciler.reconcile(in, rel));
        } catch (IOException e) {
            return rel + " open: " + e.getMessage();
        } catch (ExifTimeException e) {
            return rel + " exif: " + e.getMessage();
        } catch (RuntimeException e) {
            // decoder bug on a malformed file; report it against this file only
            log.warn("[describe] unexpected failure reading {}", file, e);
            return rel + " exif: " + e;
        }
    }

    private List<Path> listFiles(Path root) throws IOException {
        List<Path> files = new ArrayList<>();
        Set<FileVisitOption> options = followLinks ? EnumSet.of(FileVisitOption.FOLLOW_LINKS) : Set.of();
        Files.walkFileTree(root, options, Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                if (file.equals(root)) {
                    log.warn("[scan] cannot read root {}: {}", root, e.toString());
                } else {
                    log.debug("[scan] skipping {}: {}", file, e.toString());
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);
        return files;
    }

    private static String relative(Path root, Path file) {
        Path rel = root.relativize(file);
        return rel.toString().isEmpty() ? String.valueOf(file.getFileName()) : rel.toString();
    }
}
