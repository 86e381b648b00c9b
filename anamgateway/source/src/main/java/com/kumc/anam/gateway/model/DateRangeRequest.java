package com.kumc.anam.gateway.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kumc.anam.gateway.validation.DateRange;
import com.kumc.anam.gateway.validation.ValidDateRange;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive date range query against one hospital.
 * A missing or blank {@code facility_code} means the configured default hospital.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ValidDateRange
public class DateRangeRequest implements DateRange {

    @NotNull(message = "start_date is required")
    @JsonProperty("start_date")
    private Integer startDate;

    @NotNull(message = "end_date is required")
    @JsonProperty("end_date")
    private Integer endDate;

    @JsonProperty("facility_code")
    @JsonAlias("hospital_code")
    private String facilityCode;
}
