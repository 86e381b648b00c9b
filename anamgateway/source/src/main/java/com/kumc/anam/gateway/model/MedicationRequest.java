package com.kumc.anam.gateway.model;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Prescription history in a date range.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class MedicationRequest extends DateRangeRequest {

    public MedicationRequest(Integer startDate, Integer endDate, String facilityCode) {
        super(startDate, endDate, facilityCode);
    }
}
