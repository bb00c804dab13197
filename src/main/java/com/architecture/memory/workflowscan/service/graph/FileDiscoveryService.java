package com.architecture.memory.workflowscan.service.graph;

import com.architecture.memory.workflowscan.model.ScanConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Walks a repository and returns the files a scan should visit, sorted by path.
 *
 * <p>Excluded and hidden directories are pruned without being entered. A file qualifies when its
 * name ends with an included extension, ignoring case, and matches none of the exclude globs.
 */
@Slf4j
public class FileDiscoveryService {

    public List<Path> discover(Path root, ScanConfig config) throws IOException {
        Set<String> excludedDirs = new HashSet<>(config.getExcludeDirs());
        List<String> extensions = new ArrayList<>();
        for (String extension : config.getIncludeExtensions()) {
            extensions.add(extension.toLowerCase(Locale.ROOT));
        }
        FileSystem fs = FileSystems.getDefault();
        List<PathMatcher> excludeGlobs = new ArrayList<>();
        for (String pattern : config.getExcludePatterns()) {
            excludeGlobs.add(fs.getPathMatcher("glob:" + pattern));
        }

        List<Path> files = new ArrayList<>();
        int[] dirsSkipped = {0};
        int[] filesExcluded = {0};

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (excludedDirs.contains(name) || name.startsWith(".")) {
                    dirsSkipped[0]++;
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) {
                    return FileVisitResult.CONTINUE;
                }
                Path name = file.getFileName();
                String fileName = name.toString().toLowerCase(Locale.ROOT);
                if (extensions.stream().noneMatch(fileName::endsWith)) {
                    return FileVisitResult.CONTINUE;
                }
                if (excludeGlobs.stream().anyMatch(glob -> glob.matches(name))) {
                    filesExcluded[0]++;
                    return FileVisitResult.CONTINUE;
                }
                files.add(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        Collections.sort(files);
        if (dirsSkipped[0] > 0 || filesExcluded[0] > 0) {
            log.info("Filtered: {} directories, {} files (minified/generated)", dirsSkipped[0], filesExcluded[0]);
        }
        return files;
    }
}
