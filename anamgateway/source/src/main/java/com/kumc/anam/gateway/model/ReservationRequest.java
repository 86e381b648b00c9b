package com.kumc.anam.gateway.model;

import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Reservations in a date range.
 */
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReservationRequest extends DateRangeRequest {

    public ReservationRequest(Integer startDate, Integer endDate, String facilityCode) {
        super(startDate, endDate, facilityCode);
    }
}
