package fisk.domain.fiscal.driver;

/**
 * Receipt life-cycle as tracked by {@link ReceiptOrchestrator}
 * @since 15/10/2026
 */
public enum EReceiptState {
    IDLE,
    OPENED,
    SELLING,
    PAYING,
    CLOSED,
    ABORTED
}
