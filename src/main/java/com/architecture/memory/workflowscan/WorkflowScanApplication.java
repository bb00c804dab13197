package com.architecture.memory.workflowscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowScanApplication.class, args);
    }
}
