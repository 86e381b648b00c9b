package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by every portal query endpoint.
 * <p>
 * On success {@code data} is the portal's payload as received; on failure it is absent
 * and {@code message} says why.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;

    private String message = "";

    private JsonNode data;

    public static ApiResponse ok(JsonNode data) {
        return new ApiResponse(true, "", data);
    }

    public static ApiResponse failure(String message) {
        return new ApiResponse(false, message, null);
    }
}
