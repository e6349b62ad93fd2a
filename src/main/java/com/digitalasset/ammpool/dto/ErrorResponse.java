// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * Example:
 * {
 *   "error": "NON_EQUIVALENT_VALUE",
 *   "message": "Deposit 50/60 does not match pool ratio 100/100",
 *   "timestamp": "2025-10-21T15:30:45.123Z",
 *   "path": "/api/liquidity/provide",
 *   "status": 422,
 *   "requestId": "4b0c..."
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code (uppercase snake_case), the domain error code where there is one.
     */
    private String error;

    private String message;

    /**
     * ISO-8601 timestamp when error occurred.
     */
    private String timestamp;

    private String path;

    private int status;

    /**
     * Correlation id from X-Request-ID.
     */
    private String requestId;

    /**
     * Optional: per-field validation messages.
     */
    private Object details;

    public ErrorResponse() {
        this.timestamp = Instant.now().toString();
    }

    public ErrorResponse(String error, String message, int status, String path) {
        this();
        this.error = error;
        this.message = message;
        this.status = status;
        this.path = path;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Object getDetails() {
        return details;
    }

    public void setDetails(Object details) {
        this.details = details;
    }
}
