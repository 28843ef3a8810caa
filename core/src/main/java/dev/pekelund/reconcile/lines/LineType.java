package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.errors.ValidationException;
import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * What an invoice line represents, which decides whether it feeds inventory and accounting.
 */
public enum LineType {
    PRODUCT("product", true, true),
    DEPOSIT("deposit", false, false),
    FEE("fee", false, true),
    CREDIT("credit", false, true),
    ZERO("zero", false, false);

    private static final Pattern DEPOSIT_PATTERN = Pattern.compile(
        "consign|dépôt|depot|deposit|bottle fee|contenan|container|emballage|récup",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern FEE_PATTERN = Pattern.compile(
        "delivery|livraison|freight|shipping|\\bfrais\\b|transport|service charge|surcharge|fuel",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final String wireValue;
    private final boolean forInventory;
    private final boolean forAccounting;

    LineType(String wireValue, boolean forInventory, boolean forAccounting) {
        this.wireValue = wireValue;
        this.forInventory = forInventory;
        this.forAccounting = forAccounting;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean forInventory() {
        return forInventory;
    }

    public boolean forAccounting() {
        return forAccounting;
    }

    public boolean isDeposit() {
        return this == DEPOSIT;
    }

    /**
     * Classifies a line from its description and amounts. Negative amounts are credits; deposit and fee
     * lines are recognised by keywords; a line with zero quantity and zero total is {@link #ZERO}.
     */
    public static LineType detect(String description, BigDecimal quantity, BigDecimal totalPrice) {
        if ((totalPrice != null && totalPrice.signum() < 0) || (quantity != null && quantity.signum() < 0)) {
            return CREDIT;
        }
        String text = description != null ? description : "";
        if (DEPOSIT_PATTERN.matcher(text).find()) {
            return DEPOSIT;
        }
        if (FEE_PATTERN.matcher(text).find()) {
            return FEE;
        }
        if (quantity != null && quantity.signum() == 0 && totalPrice != null && totalPrice.signum() == 0) {
            return ZERO;
        }
        return PRODUCT;
    }

    public static LineType fromWire(String value) {
        for (LineType type : values()) {
            if (type.wireValue.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("Unknown line type: " + value);
    }
}
