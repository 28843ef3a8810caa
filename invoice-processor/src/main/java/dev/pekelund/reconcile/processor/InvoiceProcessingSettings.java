package dev.pekelund.reconcile.processor;

import com.google.cloud.ServiceOptions;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore location and collection names resolved from the process environment.
 */
public record InvoiceProcessingSettings(
    String projectId,
    String databaseId,
    String invoicesCollection,
    String lineItemsCollection,
    String profilesCollection,
    String inventoryCollection,
    String priceHistoryCollection
) {

    public static final String DEFAULT_DATABASE_ID = "invoices-db";
    public static final String DEFAULT_INVOICES_COLLECTION = "invoices";
    public static final String DEFAULT_LINE_ITEMS_COLLECTION = "invoiceLineItems";
    public static final String DEFAULT_PROFILES_COLLECTION = "vendorParsingProfiles";
    public static final String DEFAULT_INVENTORY_COLLECTION = "inventoryItems";
    public static final String DEFAULT_PRICE_HISTORY_COLLECTION = "inventoryPriceHistory";

    private static final String DEFAULT_LOCAL_PROJECT_ID = "invoices-local";

    public static InvoiceProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static InvoiceProcessingSettings fromEnvironment(Map<String, String> env,
        Supplier<String> defaultProjectSupplier) {

        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String invoices = env.getOrDefault("INVOICE_FIRESTORE_COLLECTION", DEFAULT_INVOICES_COLLECTION);
        String lineItems = env.getOrDefault("INVOICE_FIRESTORE_LINE_COLLECTION", DEFAULT_LINE_ITEMS_COLLECTION);
        String profiles = env.getOrDefault("INVOICE_FIRESTORE_PROFILE_COLLECTION", DEFAULT_PROFILES_COLLECTION);
        String inventory = env.getOrDefault("INVOICE_FIRESTORE_INVENTORY_COLLECTION", DEFAULT_INVENTORY_COLLECTION);
        String priceHistory = env.getOrDefault("INVOICE_FIRESTORE_PRICE_HISTORY_COLLECTION",
            DEFAULT_PRICE_HISTORY_COLLECTION);
        String databaseId = firstNonEmpty(
            env.get("FIRESTORE_DATABASE_ID"),
            env.get("FIRESTORE_DATABASE_NAME"),
            DEFAULT_DATABASE_ID);
        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);

        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while"
                + " running on Cloud Run. Update the deployment environment to use the production project id.",
                projectId));
        }

        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }

        return new InvoiceProcessingSettings(projectId, databaseId, invoices, lineItems, profiles, inventory,
            priceHistory);
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
