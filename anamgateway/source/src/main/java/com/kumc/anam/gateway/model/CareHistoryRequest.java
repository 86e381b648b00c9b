package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Outpatient or hospitalization history in a date range.
 * <p>
 * {@code inquiry_type} is accepted for compatibility (2 outpatient, 3 inpatient) but the
 * endpoint decides which kind of history is queried.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CareHistoryRequest extends DateRangeRequest {

    @JsonProperty("inquiry_type")
    private Integer inquiryType;

    public CareHistoryRequest(Integer startDate, Integer endDate, String facilityCode, Integer inquiryType) {
        super(startDate, endDate, facilityCode);
        this.inquiryType = inquiryType;
    }
}
