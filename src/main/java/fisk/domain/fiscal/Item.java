package fisk.domain.fiscal;

import java.math.BigDecimal;

/**
 * Receipt line. Sale lines use text, department, unit price, tax group, quantity
 * and the optional price modifier; subtotal surcharge/discount lines use amount;
 * comment lines use text only.
 * @since 14/10/2026
 */
public class Item {
    private EItemType type = EItemType.SALE;
    private String text = "";
    private int department;
    private BigDecimal unitPrice = BigDecimal.ZERO;
    private ETaxGroup taxGroup;
    private BigDecimal quantity = BigDecimal.ZERO;
    private BigDecimal priceModifierValue = BigDecimal.ZERO;
    private EPriceModifierType priceModifierType = EPriceModifierType.NONE;
    private BigDecimal amount = BigDecimal.ZERO;

    public Item() {
    }

    public static Item sale(String text, BigDecimal unitPrice, ETaxGroup taxGroup, BigDecimal quantity) {
        Item item = new Item();
        item.type = EItemType.SALE;
        item.text = text;
        item.unitPrice = unitPrice;
        item.taxGroup = taxGroup;
        item.quantity = quantity;
        return item;
    }

    public static Item comment(String text) {
        Item item = new Item();
        item.type = EItemType.COMMENT;
        item.text = text;
        return item;
    }

    public static Item footerComment(String text) {
        Item item = new Item();
        item.type = EItemType.FOOTER_COMMENT;
        item.text = text;
        return item;
    }

    public static Item surcharge(BigDecimal amount) {
        Item item = new Item();
        item.type = EItemType.SURCHARGE_AMOUNT;
        item.amount = amount;
        return item;
    }

    public static Item discount(BigDecimal amount) {
        Item item = new Item();
        item.type = EItemType.DISCOUNT_AMOUNT;
        item.amount = amount;
        return item;
    }

    public EItemType getType() {
        return type;
    }
    public void setType(EItemType type) {
        this.type = type;
    }

    public String getText() {
        return text == null ? "" : text;
    }
    public void setText(String text) {
        this.text = text;
    }

    public int getDepartment() {
        return department;
    }
    public void setDepartment(int department) {
        this.department = department;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice == null ? BigDecimal.ZERO : unitPrice;
    }
    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }

    public ETaxGroup getTaxGroup() {
        return taxGroup;
    }
    public void setTaxGroup(ETaxGroup taxGroup) {
        this.taxGroup = taxGroup;
    }

    public BigDecimal getQuantity() {
        return quantity == null ? BigDecimal.ZERO : quantity;
    }
    public void setQuantity(BigDecimal quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getPriceModifierValue() {
        return priceModifierValue == null ? BigDecimal.ZERO : priceModifierValue;
    }
    public void setPriceModifierValue(BigDecimal priceModifierValue) {
        this.priceModifierValue = priceModifierValue;
    }

    public EPriceModifierType getPriceModifierType() {
        return priceModifierType == null ? EPriceModifierType.NONE : priceModifierType;
    }
    public void setPriceModifierType(EPriceModifierType priceModifierType) {
        this.priceModifierType = priceModifierType;
    }

    public BigDecimal getAmount() {
        return amount == null ? BigDecimal.ZERO : amount;
    }
    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    @Override
    public String toString() {
        return String.format("Item{type=%s, text='%s', unitPrice=%s, quantity=%s}",
                type, text, unitPrice, quantity);
    }
}
