package com.reconengine.common;

import com.reconengine.common.exception.InvalidReconciliationRequestException;
import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive range of booking dates a reconciliation run covers.
 */
@Value
public class DateRange {

    LocalDate start;
    LocalDate end;

    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new InvalidReconciliationRequestException("Start and end date are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidReconciliationRequestException(
                String.format("Start date %s is after end date %s", start, end));
        }
        return new DateRange(start, end);
    }
}
