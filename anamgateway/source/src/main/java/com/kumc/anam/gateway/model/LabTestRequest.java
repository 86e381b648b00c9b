package com.kumc.anam.gateway.model;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Diagnostic test results in a date range.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class LabTestRequest extends DateRangeRequest {

    public LabTestRequest(Integer startDate, Integer endDate, String facilityCode) {
        super(startDate, endDate, facilityCode);
    }
}
