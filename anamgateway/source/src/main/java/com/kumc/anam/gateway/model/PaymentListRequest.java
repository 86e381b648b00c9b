package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Completed payments in a date range for one division.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PaymentListRequest extends DateRangeRequest {

    public static final String OUTPATIENT = "O";
    public static final String INPATIENT = "I";

    @Pattern(regexp = "\\s*|[OI]", message = "code_division must be O (outpatient) or I (inpatient)")
    @JsonProperty("code_division")
    private String codeDivision = OUTPATIENT;

    public PaymentListRequest(Integer startDate, Integer endDate, String facilityCode, String codeDivision) {
        super(startDate, endDate, facilityCode);
        this.codeDivision = codeDivision;
    }
}
