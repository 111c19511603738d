package com.di.rawingest.exception;

import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.storage.StorageException;
import com.di.rawingest.schema.SchemaSpec;
import com.di.rawingest.schema.TableRef;
import org.apache.beam.sdk.Pipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    @Test
    @DisplayName("Should return correct name and description")
    void testGetNameAndDescription() {
        for (ErrorCategory category : ErrorCategory.values()) {
            assertFalse(category.getName().isEmpty());
            assertFalse(category.getDescription().isEmpty());
        }
    }

    @Test
    @DisplayName("Should return UNKNOWN for null")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    static Stream<Arguments> exceptions() {
        return Stream.of(
                Arguments.of(new IllegalArgumentException("Invalid schema entry 'id'"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new IllegalStateException("Unexpected state"), ErrorCategory.VALIDATION_ERROR),
                Arguments.of(new PipelineRunException("Pipeline for data.csv ended in state FAILED"), ErrorCategory.PIPELINE_ERROR),
                Arguments.of(new BigQueryException(403, "Access Denied: Table project:dataset.table"), ErrorCategory.AUTHENTICATION_ERROR),
                Arguments.of(new StorageException(401, "Login Required"), ErrorCategory.AUTHENTICATION_ERROR),
                Arguments.of(new BigQueryException(400, "Invalid schema update"), ErrorCategory.CLOUD_SERVICE_ERROR),
                Arguments.of(new SocketTimeoutException("Read timed out"), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new TimeoutException(), ErrorCategory.TIMEOUT_ERROR),
                Arguments.of(new ConnectException("Connection refused"), ErrorCategory.NETWORK_ERROR),
                Arguments.of(new RuntimeException("Boom!"), ErrorCategory.APPLICATION_ERROR)
        );
    }

    @ParameterizedTest
    @MethodSource("exceptions")
    @DisplayName("Should categorize exceptions")
    void testCategorize(Throwable exception, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(exception));
    }

    @Test
    @DisplayName("Should categorize a pipeline failure by its cause")
    void testCategorize_PipelineExecutionException() {
        Pipeline.PipelineExecutionException wrapped =
                new Pipeline.PipelineExecutionException(new BigQueryException(404, "Not found: Dataset project:missing"));
        assertEquals(ErrorCategory.CLOUD_SERVICE_ERROR, ErrorCategory.categorize(wrapped));
    }

    @Test
    @DisplayName("Should keep validation errors as validation whatever names they quote")
    void testCategorize_ValidationMessageWithKeywords() {
        IllegalArgumentException badSchema = assertThrows(IllegalArgumentException.class,
                () -> SchemaSpec.parse("id:STRING,timeout"));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(badSchema));

        IllegalArgumentException badTable = assertThrows(IllegalArgumentException.class,
                () -> TableRef.parse("access denied"));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(badTable));

        assertEquals(ErrorCategory.VALIDATION_ERROR,
                ErrorCategory.categorize(new IllegalArgumentException("Duplicate column 'connection_timeout'")));
    }
}
