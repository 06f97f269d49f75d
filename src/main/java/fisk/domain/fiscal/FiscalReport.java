package fisk.domain.fiscal;

import org.joda.time.LocalDate;

/**
 * Fiscal memory report for a date range
 * @since 14/10/2026
 */
public record FiscalReport(LocalDate startDate, LocalDate endDate, EReportType type) {

    public FiscalReport {
        if (type == null) {
            type = EReportType.BRIEF;
        }
    }
}
