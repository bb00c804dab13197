package com.architecture.memory.workflowscan.exception;

import lombok.Getter;

@Getter
public class InvalidRepositoryPathException extends RuntimeException {

    private final String repositoryPath;

    public InvalidRepositoryPathException(String repositoryPath, String reason) {
        super("Invalid repository path '" + repositoryPath + "': " + reason);
        this.repositoryPath = repositoryPath;
    }
}
