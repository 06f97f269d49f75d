package fisk.domain.fiscal;

/**
 * @since 14/10/2026
 */
public enum EItemType {
    SALE,
    COMMENT,
    FOOTER_COMMENT,
    SURCHARGE_AMOUNT,
    DISCOUNT_AMOUNT
}
