package dev.pekelund.reconcile.profile;

/**
 * Raw values of an invoice line kept as an example of a vendor's layout.
 */
public record SampleLine(
    String itemCode,
    String description,
    String quantity,
    String weight,
    String unitPrice,
    String totalPrice
) {
}
