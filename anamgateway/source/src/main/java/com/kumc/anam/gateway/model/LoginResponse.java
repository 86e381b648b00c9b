package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginResponse {

    public static final String TOKEN_TYPE = "bearer";

    private boolean success;

    private String message;

    @JsonProperty("access_token")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String accessToken;

    @JsonProperty("token_type")
    private String tokenType = TOKEN_TYPE;

    public static LoginResponse succeeded(String message, String accessToken) {
        return new LoginResponse(true, message, accessToken, TOKEN_TYPE);
    }

    public static LoginResponse failed(String message) {
        return new LoginResponse(false, message, null, TOKEN_TYPE);
    }
}
