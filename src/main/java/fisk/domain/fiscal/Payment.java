package fisk.domain.fiscal;

import java.math.BigDecimal;

/**
 * @since 14/10/2026
 */
public record Payment(BigDecimal amount, EPaymentType paymentType) {

    public Payment {
        if (paymentType == null) {
            paymentType = EPaymentType.CASH;
        }
    }
}
