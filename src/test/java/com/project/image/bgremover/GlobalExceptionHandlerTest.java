package com.project.image.bgremover;

import com.project.image.bgremover.exceptions.GlobalExceptionHandler;
import com.project.image.bgremover.exceptions.StorageException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GlobalExceptionHandlerTest {
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void storage_rejectedInputIsBadRequest() {
        ResponseEntity<Map<String, Object>> response = handler.handleStorage(new StorageException("Invalid filename: ../x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("error_kind", "StorageError");
    }

    @Test
    void storage_writeFailureIsServerError() {
        StorageException failure = new StorageException("Failed to store result image", new IOException("disk full"));

        ResponseEntity<Map<String, Object>> response = handler.handleStorage(failure);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "Failed to store result image");
    }
}
