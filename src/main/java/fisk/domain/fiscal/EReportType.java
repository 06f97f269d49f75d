package fisk.domain.fiscal;

/**
 * @since 14/10/2026
 */
public enum EReportType {
    BRIEF,
    DETAILED
}
