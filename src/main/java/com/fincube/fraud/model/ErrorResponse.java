package com.fincube.fraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpStatus;

@Value
@Builder
@Schema(description = "Error body returned by every endpoint")
public class ErrorResponse {

    @Schema(description = "HTTP status code", example = "503")
    int status;

    @Schema(description = "HTTP reason phrase", example = "Service Unavailable")
    String error;

    @Schema(description = "What went wrong", example = "No feature scaler fitted. Load reference data before scoring.")
    String message;

    @Schema(description = "Epoch milliseconds", example = "1739886764000")
    long timestamp;

    public static ErrorResponse of(HttpStatus status, String message) {
        return ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
