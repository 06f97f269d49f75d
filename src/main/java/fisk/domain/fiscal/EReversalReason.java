package fisk.domain.fiscal;

/**
 * @since 14/10/2026
 */
public enum EReversalReason {
    OPERATOR_ERROR,
    REFUND,
    TAX_BASE_REDUCTION
}
