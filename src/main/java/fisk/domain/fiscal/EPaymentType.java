package fisk.domain.fiscal;

/**
 * Payment types. {@link #CHANGE} only describes change returned to the customer
 * and is never sent to the device.
 * @since 14/10/2026
 */
public enum EPaymentType {
    CASH,
    CHECK,
    COUPONS,
    EXT_COUPONS,
    PACKAGING,
    INTERNAL_USAGE,
    DAMAGE,
    CARD,
    BANK,
    RESERVED_1,
    RESERVED_2,
    CHANGE
}
