package com.finforecast.facts;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * One dated observation of a concept, read from a record mapping. Accepts the statement layout
 * ({@code period.startDate / period.endDate / period.instant}) and the company-facts layout
 * ({@code start / end} on the record itself).
 */
public final class CandidateFact {
    public final Double value;
    public final Integer startYear;
    public final Integer endYear;
    public final String endDate;
    public final boolean instant;
    public final LocalDate filed;
    public final int ordinal;

    CandidateFact(Double value, Integer startYear, Integer endYear, String endDate, boolean instant, LocalDate filed, int ordinal) {
        this.value = value;
        this.startYear = startYear;
        this.endYear = endYear;
        this.endDate = endDate;
        this.instant = instant;
        this.filed = filed;
        this.ordinal = ordinal;
    }

    public static CandidateFact fromRecord(MappingNode record, int ordinal) {
        String start = null;
        String end = null;
        boolean instant = false;

        FactNode periodNode = record.get("period");
        if (periodNode instanceof MappingNode) {
            MappingNode period = (MappingNode) periodNode;
            start = period.text("startDate");
            end = period.text("endDate");
            if (end == null) {
                end = period.text("instant");
                instant = end != null;
            }
        } else {
            start = record.text("start");
            end = record.text("end");
            if (end == null) {
                end = record.text("instant");
                instant = end != null;
            }
        }

        return new CandidateFact(
                ValueNormalizer.normalize(record),
                yearOf(start),
                yearOf(end),
                end,
                instant,
                dateOf(record.text("filed")),
                ordinal
        );
    }

    /**
     * Whole years between start and end; 0 for an instant or a missing start.
     */
    public int durationYears() {
        if (instant || startYear == null || endYear == null) {
            return 0;
        }
        return endYear - startYear;
    }

    public boolean usable() {
        return value != null && endYear != null && durationYears() >= 0;
    }

    static Integer yearOf(String date) {
        if (date == null || date.length() < 4) {
            return null;
        }
        try {
            return Integer.parseInt(date.substring(0, 4));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static LocalDate dateOf(String date) {
        if (date == null || date.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(date.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "CandidateFact{value=" + value
                + ", endDate=" + endDate
                + ", duration=" + durationYears()
                + ", filed=" + filed + "}";
    }
}
