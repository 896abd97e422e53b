package com.filestorm.ingest.resource.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Error body shared by the consumer endpoints.
 */
@Schema(description = "Error response")
public class ErrorResponse {

    @Schema(example = "CONSUMER_DISABLED")
    public String code;

    @Schema(example = "Consumer is disabled")
    public String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
