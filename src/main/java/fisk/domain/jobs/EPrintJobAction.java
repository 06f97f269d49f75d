package fisk.domain.jobs;

/**
 * Printer operation carried by a print job, with the document type it expects
 * @since 16/10/2026
 */
public enum EPrintJobAction {
    CHECK_STATUS,
    SET_DATE_TIME,
    PRINT_RECEIPT,
    PRINT_REVERSAL_RECEIPT,
    PRINT_MONEY_DEPOSIT,
    PRINT_MONEY_WITHDRAW,
    PRINT_X_REPORT,
    PRINT_Z_REPORT,
    PRINT_DUPLICATE,
    PRINT_FISCAL_REPORT,
    RESET
}
