package fisk.domain.fiscal;

import java.util.ArrayList;
import java.util.List;

/**
 * Fiscal receipt document
 * @since 14/10/2026
 */
public class Receipt {
    private String uniqueSaleNumber = "";
    private String operator = "";
    private String operatorPassword = "";
    private List<Item> items = new ArrayList<>();
    private List<Payment> payments = new ArrayList<>();

    public String getUniqueSaleNumber() {
        return uniqueSaleNumber == null ? "" : uniqueSaleNumber;
    }
    public void setUniqueSaleNumber(String uniqueSaleNumber) {
        this.uniqueSaleNumber = uniqueSaleNumber;
    }

    public String getOperator() {
        return operator == null ? "" : operator;
    }
    public void setOperator(String operator) {
        this.operator = operator;
    }

    public String getOperatorPassword() {
        return operatorPassword == null ? "" : operatorPassword;
    }
    public void setOperatorPassword(String operatorPassword) {
        this.operatorPassword = operatorPassword;
    }

    public List<Item> getItems() {
        return items == null ? List.of() : items;
    }
    public void setItems(List<Item> items) {
        this.items = items;
    }

    public List<Payment> getPayments() {
        return payments == null ? List.of() : payments;
    }
    public void setPayments(List<Payment> payments) {
        this.payments = payments;
    }
}
