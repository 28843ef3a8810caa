package dev.pekelund.reconcile.processor.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Gemini {@code responseSchema} for the extracted invoice document. Every line cell is a nullable
 * string so the model copies values as printed instead of converting them.
 */
public final class InvoiceResponseSchema {

    static final String[] LINE_FIELDS = {
        "description", "quantity", "unitPrice", "total", "unit", "sku", "weight", "format"
    };

    private InvoiceResponseSchema() {
    }

    public static ObjectNode create(ObjectMapper mapper) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "OBJECT");
        ObjectNode props = schema.putObject("properties");

        ObjectNode vendor = props.putObject("vendor");
        vendor.put("type", "OBJECT");
        vendor.put("nullable", true);
        ObjectNode vendorProps = vendor.putObject("properties");
        nullableString(vendorProps, "name", "Vendor name as printed in the invoice header.");
        nullableString(vendorProps, "address", null);
        nullableString(vendorProps, "phone", null);

        nullableString(props, "invoiceNumber", null);
        nullableString(props, "invoiceDate", "Invoice date as an ISO-8601 date (yyyy-MM-dd).");
        nullableString(props, "total", "Invoice grand total as printed.");

        ObjectNode lines = props.putObject("lines");
        lines.put("type", "ARRAY");
        lines.put("description", "One entry per line item row, top to bottom.");
        ObjectNode line = lines.putObject("items");
        line.put("type", "OBJECT");
        ObjectNode lineProps = line.putObject("properties");
        for (String field : LINE_FIELDS) {
            nullableString(lineProps, field, null);
        }
        ObjectNode columns = lineProps.putObject("columns");
        columns.put("type", "ARRAY");
        columns.put("description", "Cells of the row from left to right.");
        columns.putObject("items").put("type", "STRING");

        ArrayNode required = schema.putArray("required");
        required.add("lines");
        return schema;
    }

    private static void nullableString(ObjectNode properties, String name, String description) {
        ObjectNode field = properties.putObject(name);
        field.put("type", "STRING");
        field.put("nullable", true);
        if (description != null) {
            field.put("description", description);
        }
    }
}
