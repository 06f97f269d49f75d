package fisk.domain.fiscal;

import java.math.BigDecimal;

/**
 * Cash deposit or withdraw request
 * @since 14/10/2026
 */
public record TransferAmount(String operator, String operatorPassword, BigDecimal amount) {

    public TransferAmount withAmount(BigDecimal newAmount) {
        return new TransferAmount(operator, operatorPassword, newAmount);
    }
}
