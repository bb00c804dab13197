package com.architecture.memory.workflowscan.exception;

import com.architecture.memory.workflowscan.dto.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void unknownScanMapsToNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleScanNotFound(new ScanNotFoundException("s9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getStatus()).isEqualTo(404);
        assertThat(response.getBody().getMessage()).isEqualTo("Scan not found: s9");
        assertThat(response.getBody().getTimestamp()).isNotNull();
    }

    @Test
    void invalidPathMapsToBadRequest() {
        ResponseEntity<ErrorResponse> response =
                handler.handleBadRequest(new InvalidRepositoryPathException("/nope", "path does not exist"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getError()).isEqualTo("Bad Request");
        assertThat(response.getBody().getMessage()).isEqualTo("Invalid repository path '/nope': path does not exist");
    }

    @Test
    void saturatedExecutorMapsToServiceUnavailable() {
        ResponseEntity<ErrorResponse> response =
                handler.handleRejected(new ScanRejectedException("s1", new RuntimeException("full")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }
}
