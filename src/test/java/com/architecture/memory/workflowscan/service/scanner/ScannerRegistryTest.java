package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.DetectionToggles;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ScannerRegistryTest {

    private final ScannerRegistry registry = ScannerRegistry.defaults(DetectionToggles.allEnabled());

    private String scannerName(String path) {
        return registry.scannerFor(Path.of(path)).map(LanguageScanner::getName).orElse(null);
    }

    @Test
    void scannerFor_prefersNarrowerDialects() {
        assertThat(scannerName("Views/MainWindow.xaml.cs")).isEqualTo("wpf");
        assertThat(scannerName("Views/MainWindow.xaml")).isEqualTo("wpf");
        assertThat(scannerName("app/orders.component.ts")).isEqualTo("angular");
        assertThat(scannerName("app/orders.component.html")).isEqualTo("angular");
        assertThat(scannerName("src/App.tsx")).isEqualTo("react");
        assertThat(scannerName("src/api.ts")).isEqualTo("typescript");
        assertThat(scannerName("public/app.js")).isEqualTo("typescript");
        assertThat(scannerName("Services/OrderService.cs")).isEqualTo("csharp");
    }

    @Test
    void scannerFor_returnsEmptyForUnknownFiles() {
        assertThat(registry.scannerFor(Path.of("README.md"))).isEmpty();
        assertThat(registry.getScanners()).hasSize(5);
    }
}
