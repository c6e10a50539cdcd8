package com.flagship.split_ledger.ledger;

import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive, optionally open-ended range of calendar dates.
 * A null bound leaves that side of the window unbounded.
 */
@Value
public class DateWindow {
    LocalDate start;
    LocalDate end;

    public static DateWindow unbounded() {
        return new DateWindow(null, null);
    }

    public static DateWindow between(LocalDate start, LocalDate end) {
        return new DateWindow(start, end);
    }

    public boolean contains(LocalDate date) {
        if (start != null && date.isBefore(start)) {
            return false;
        }
        return end == null || !date.isAfter(end);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }
}
