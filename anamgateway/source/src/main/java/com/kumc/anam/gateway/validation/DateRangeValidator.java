package com.kumc.anam.gateway.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

public class DateRangeValidator implements ConstraintValidator<ValidDateRange, DateRange> {

    private static final DateTimeFormatter YYYYMMDD =
            DateTimeFormatter.BASIC_ISO_DATE.withResolverStyle(ResolverStyle.STRICT);

    @Override
    public boolean isValid(DateRange range, ConstraintValidatorContext context) {
        if (range == null) {
            return true;
        }
        context.disableDefaultConstraintViolation();

        boolean valid = true;
        LocalDate start = null;
        LocalDate end = null;

        if (range.getStartDate() != null) {
            start = parseDate(range.getStartDate());
            if (start == null) {
                reject(context, "startDate",
                        String.format("Invalid date: %d. Expected yyyyMMdd", range.getStartDate()));
                valid = false;
            }
        }
        if (range.getEndDate() != null) {
            end = parseDate(range.getEndDate());
            if (end == null) {
                reject(context, "endDate",
                        String.format("Invalid date: %d. Expected yyyyMMdd", range.getEndDate()));
                valid = false;
            }
        }

        if (start != null && end != null && end.isBefore(start)) {
            reject(context, "endDate", "end_date cannot be before start_date");
            valid = false;
        }
        return valid;
    }

    static LocalDate parseDate(int yyyymmdd) {
        String text = Integer.toString(yyyymmdd);
        if (text.length() != 8) {
            return null;
        }
        try {
            return LocalDate.parse(text, YYYYMMDD);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static void reject(ConstraintValidatorContext context, String field, String message) {
        context.buildConstraintViolationWithTemplate(message)
                .addPropertyNode(field)
                .addConstraintViolation();
    }
}
