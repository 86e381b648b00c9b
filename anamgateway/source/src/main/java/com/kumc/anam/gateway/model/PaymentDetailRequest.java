package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One payment record by its receipt number.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentDetailRequest {

    @NotNull(message = "payment_number is required")
    @Positive(message = "payment_number must be positive")
    @JsonProperty("payment_number")
    @JsonAlias("mdrp_no")
    private Long paymentNumber;

    @JsonProperty("facility_code")
    @JsonAlias("hospital_code")
    private String facilityCode;
}
