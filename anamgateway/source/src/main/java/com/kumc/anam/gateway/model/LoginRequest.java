package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Portal member id and password.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank(message = "identifier is required")
    @JsonProperty("identifier")
    @JsonAlias("username")
    private String identifier;

    @NotBlank(message = "secret is required")
    @JsonProperty("secret")
    @JsonAlias("password")
    @ToString.Exclude
    private String secret;
}
