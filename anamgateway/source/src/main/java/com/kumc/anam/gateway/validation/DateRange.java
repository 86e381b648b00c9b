package com.kumc.anam.gateway.validation;

/**
 * Inclusive range of 8-digit {@code yyyyMMdd} dates.
 */
public interface DateRange {

    Integer getStartDate();

    Integer getEndDate();
}
