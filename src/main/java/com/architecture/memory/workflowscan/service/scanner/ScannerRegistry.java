package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.DetectionToggles;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Ordered scanner list; the first scanner that accepts a path handles it.
 *
 * <p>The default order puts the narrower dialects first: WPF ({@code .xaml.cs} before plain
 * C#), Angular ({@code .component.ts} before plain TypeScript), then React, TypeScript and C#.
 */
public class ScannerRegistry {

    private final List<LanguageScanner> scanners;

    public ScannerRegistry(List<LanguageScanner> scanners) {
        this.scanners = List.copyOf(scanners);
    }

    public static ScannerRegistry defaults(DetectionToggles toggles) {
        return new ScannerRegistry(List.of(
                new WpfScanner(toggles),
                new AngularScanner(toggles),
                new ReactScanner(toggles),
                new TypeScriptScanner(toggles),
                new CSharpScanner(toggles)));
    }

    public Optional<LanguageScanner> scannerFor(Path file) {
        for (LanguageScanner scanner : scanners) {
            if (scanner.canScan(file)) {
                return Optional.of(scanner);
            }
        }
        return Optional.empty();
    }

    public List<LanguageScanner> getScanners() {
        return scanners;
    }
}
