package fisk.domain.fiscal;

/**
 * @since 14/10/2026
 */
public enum EPriceModifierType {
    NONE,
    DISCOUNT_PERCENT,
    DISCOUNT_AMOUNT,
    SURCHARGE_PERCENT,
    SURCHARGE_AMOUNT;

    public boolean isPercent() {
        return this == DISCOUNT_PERCENT || this == SURCHARGE_PERCENT;
    }

    public boolean isDiscount() {
        return this == DISCOUNT_PERCENT || this == DISCOUNT_AMOUNT;
    }
}
