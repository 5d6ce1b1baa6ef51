package com.payment.observability.api;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.Map;

/**
 * REST API request body for ingesting one raw provider event.
 */
@Data
public class EventIngestRequestDto {

    /** Provider payload exactly as received. Required and non-empty. */
    @NotEmpty(message = "rawEvent is required")
    private Map<String, Object> rawEvent;

    /** Optional provider name from the caller; informational only. */
    private String provider;
}
