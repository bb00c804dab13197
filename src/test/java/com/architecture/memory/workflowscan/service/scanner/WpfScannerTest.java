package com.architecture.memory.workflowscan.service.scanner;

import com.architecture.memory.workflowscan.model.WorkflowEdge;
import com.architecture.memory.workflowscan.model.WorkflowGraph;
import com.architecture.memory.workflowscan.model.WorkflowNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WpfScannerTest {

    @TempDir
    Path repo;

    private final WpfScanner scanner = new WpfScanner();

    private Path xaml;
    private Path codeBehind;

    @BeforeEach
    void writeWindow() throws Exception {
        xaml = repo.resolve("MainWindow.xaml");
        Files.writeString(xaml, String.join("\n",
                "<Window x:Class=\"Shop.MainWindow\"",
                "        Title=\"Shop\">",
                "  <StackPanel>",
                "    <Button Content=\"Load\" Click=\"LoadButton_Click\"/>",
                "    <Button Content=\"Other\" Click=\"Missing_Click\"/>",
                "  </StackPanel>",
                "</Window>"));
        codeBehind = repo.resolve("MainWindow.xaml.cs");
        Files.writeString(codeBehind, String.join("\n",
                "public partial class MainWindow : Window",
                "{",
                "    private async void LoadButton_Click(object sender, RoutedEventArgs e)",
                "    {",
                "        var json = await _client.GetAsync(\"https://api.shop.test/orders\");",
                "    }",
                "}"));
    }

    @Test
    void scanFile_linksTriggersThroughHandlerMethods() throws Exception {
        WorkflowGraph graph = scanner.scanFile(xaml);

        WorkflowNode call = graph.getNode(codeBehind + ":http:5").orElseThrow();
        assertThat(call.getMethod()).isEqualTo("GET");
        assertThat(call.getEndpoint()).isEqualTo("https://api.shop.test/orders");

        WorkflowNode load = graph.getNode(xaml + ":ui_trigger:4").orElseThrow();
        assertThat(load.getMetadata())
                .containsEntry("component", "MainWindow")
                .containsEntry("handler", "LoadButton_Click");
        WorkflowNode missing = graph.getNode(xaml + ":ui_trigger:5").orElseThrow();

        assertThat(graph.getOutgoingEdges(load.getId()))
                .extracting(WorkflowEdge::getLabel)
                .containsExactly("WPF Event → HTTP Call");
        assertThat(graph.getOutgoingEdges(missing.getId()))
                .extracting(WorkflowEdge::getLabel)
                .containsExactly("WPF Event → HTTP Call (proximity)");
    }

    @Test
    void scanFile_codeBehindAloneEmitsSameCallNodes() throws Exception {
        WorkflowGraph fromXaml = scanner.scanFile(xaml);
        WorkflowGraph fromCodeBehind = scanner.scanFile(codeBehind);

        assertThat(fromCodeBehind.nodeCount()).isEqualTo(1);
        fromXaml.merge(fromCodeBehind);
        assertThat(fromXaml.nodeCount()).isEqualTo(3);
    }

    @Test
    void scanFile_withoutCodeBehindEmitsTriggersOnly() throws Exception {
        Files.delete(codeBehind);

        WorkflowGraph graph = scanner.scanFile(xaml);

        assertThat(graph.getNodes()).allMatch(WorkflowNode::isUiTrigger);
        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void canScan_acceptsMarkupAndCodeBehind() {
        assertThat(scanner.canScan(Path.of("Views/MainWindow.xaml"))).isTrue();
        assertThat(scanner.canScan(Path.of("Views/MainWindow.xaml.cs"))).isTrue();
        assertThat(scanner.canScan(Path.of("Services/OrderService.cs"))).isFalse();
    }
}
