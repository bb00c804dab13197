package com.architecture.memory.workflowscan.config;

import com.architecture.memory.workflowscan.service.graph.FileDiscoveryService;
import com.architecture.memory.workflowscan.service.graph.WorkflowGraphBuilder;
import com.architecture.memory.workflowscan.service.schema.SchemaResolver;
import com.architecture.memory.workflowscan.service.workflow.WorkflowAnalyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The scan engine is plain Java; these beans expose it to the service layer.
 */
@Configuration
public class ScannerBeansConfig {

    @Bean
    public FileDiscoveryService fileDiscoveryService() {
        return new FileDiscoveryService();
    }

    @Bean
    public SchemaResolver schemaResolver() {
        return new SchemaResolver();
    }

    @Bean
    public WorkflowAnalyzer workflowAnalyzer() {
        return new WorkflowAnalyzer();
    }

    @Bean
    public WorkflowGraphBuilder workflowGraphBuilder(FileDiscoveryService fileDiscoveryService,
                                                     SchemaResolver schemaResolver,
                                                     WorkflowAnalyzer workflowAnalyzer) {
        return new WorkflowGraphBuilder(fileDiscoveryService, schemaResolver, workflowAnalyzer);
    }
}
