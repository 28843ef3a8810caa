package dev.pekelund.reconcile.processor.firestore;

import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.await;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.bool;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.decimal;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.instant;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.intValue;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.map;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.maps;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.string;
import static dev.pekelund.reconcile.processor.firestore.FirestoreValues.timestamp;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import dev.pekelund.reconcile.pricing.PricingModel;
import dev.pekelund.reconcile.profile.ColumnCorrection;
import dev.pekelund.reconcile.profile.ColumnMapping;
import dev.pekelund.reconcile.profile.ItemCorrection;
import dev.pekelund.reconcile.profile.PackageFormatKind;
import dev.pekelund.reconcile.profile.PackageFormatSetting;
import dev.pekelund.reconcile.profile.ParsingProfile;
import dev.pekelund.reconcile.profile.ParsingProfileRepository;
import dev.pekelund.reconcile.profile.ProfileStats;
import dev.pekelund.reconcile.profile.QuirkFlag;
import dev.pekelund.reconcile.profile.SampleLine;
import dev.pekelund.reconcile.profile.SemanticField;
import dev.pekelund.reconcile.profile.VendorQuirks;
import dev.pekelund.reconcile.units.MeasurementUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Stores one profile document per vendor, using the vendor id as document id. Item corrections are
 * stored as a list because their keys are free text.
 */
public class FirestoreParsingProfileRepository implements ParsingProfileRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreParsingProfileRepository.class);

    private final Firestore firestore;
    private final String collectionName;

    public FirestoreParsingProfileRepository(Firestore firestore, String collectionName) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        LOGGER.info("FirestoreParsingProfileRepository using collection '{}'", collectionName);
    }

    @Override
    public Optional<ParsingProfile> findByVendorId(String vendorId) {
        if (!StringUtils.hasText(vendorId)) {
            return Optional.empty();
        }
        DocumentSnapshot snapshot = await(firestore.collection(collectionName).document(vendorId).get(),
            "load parsing profile of vendor " + vendorId);
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.of(fromDocument(snapshot.getId(), snapshot.getData()));
    }

    @Override
    public ParsingProfile save(ParsingProfile profile) {
        Objects.requireNonNull(profile, "profile");
        await(firestore.collection(collectionName).document(profile.vendorId()).set(toDocument(profile)),
            "store parsing profile of vendor " + profile.vendorId());
        LOGGER.info("Stored parsing profile of vendor {} (version {}, {} column corrections)", profile.vendorId(),
            profile.version(), profile.columnCorrections().size());
        return profile;
    }

    @Override
    public void deleteByVendorId(String vendorId) {
        await(firestore.collection(collectionName).document(vendorId).delete(),
            "delete parsing profile of vendor " + vendorId);
        LOGGER.info("Deleted parsing profile of vendor {}", vendorId);
    }

    static Map<String, Object> toDocument(ParsingProfile profile) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("vendorId", profile.vendorId());
        payload.put("vendorName", profile.vendorName());
        payload.put("version", profile.version());
        payload.put("pricingModel", profile.pricingModel());

        Map<String, Object> columns = new HashMap<>();
        profile.columns().forEach((field, mapping) -> {
            Map<String, Object> column = new HashMap<>();
            column.put("index", mapping.index());
            column.put("aiOriginal", mapping.aiOriginal() != null ? mapping.aiOriginal().wireValue() : null);
            column.put("wasChanged", mapping.wasChanged());
            column.put("sampleValue", mapping.sampleValue());
            columns.put(field.wireValue(), column);
        });
        payload.put("columns", columns);

        payload.put("weightUnit", profile.weightUnit() != null ? profile.weightUnit().symbol() : null);
        Map<String, Object> packageFormat = new HashMap<>();
        packageFormat.put("enabled", profile.packageFormat().enabled());
        packageFormat.put("kind", profile.packageFormat().kind() != null
            ? profile.packageFormat().kind().wireValue() : null);
        payload.put("packageFormat", packageFormat);
        payload.put("quirks", profile.quirks().flags().stream().map(QuirkFlag::wireValue).toList());

        List<Map<String, Object>> corrections = new ArrayList<>();
        for (ColumnCorrection correction : profile.columnCorrections()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("field", correction.field());
            entry.put("index", correction.index());
            entry.put("aiDetected", correction.aiDetected());
            entry.put("userCorrected", correction.userCorrected());
            entry.put("sampleValue", correction.sampleValue());
            entry.put("correctedAt", timestamp(correction.correctedAt()));
            corrections.add(entry);
        }
        payload.put("columnCorrections", corrections);

        List<Map<String, Object>> itemCorrections = new ArrayList<>();
        for (ItemCorrection correction : profile.itemCorrections().values()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("key", correction.key());
            entry.put("pricingModel", correction.pricingModel().wireValue());
            entry.put("value", FirestoreValues.decimal(correction.value()));
            entry.put("unit", correction.unit());
            entry.put("correctedAt", timestamp(correction.correctedAt()));
            itemCorrections.add(entry);
        }
        payload.put("itemCorrections", itemCorrections);

        List<Map<String, Object>> samples = new ArrayList<>();
        for (SampleLine sample : profile.sampleLines()) {
            Map<String, Object> entry = new HashMap<>();
            entry.put("itemCode", sample.itemCode());
            entry.put("description", sample.description());
            entry.put("quantity", sample.quantity());
            entry.put("weight", sample.weight());
            entry.put("unitPrice", sample.unitPrice());
            entry.put("totalPrice", sample.totalPrice());
            samples.add(entry);
        }
        payload.put("sampleLines", samples);

        ProfileStats stats = profile.stats();
        Map<String, Object> statsPayload = new HashMap<>();
        statsPayload.put("timesUsed", stats.timesUsed());
        statsPayload.put("lastUsed", timestamp(stats.lastUsed()));
        statsPayload.put("successRate", stats.successRate());
        statsPayload.put("columnCorrections", stats.columnCorrections());
        statsPayload.put("lineCorrections", stats.lineCorrections());
        statsPayload.put("successesSinceCorrection", stats.successesSinceCorrection());
        payload.put("stats", statsPayload);

        payload.put("confidenceAdjustment", FirestoreValues.decimal(profile.confidenceAdjustment()));
        payload.put("promptHints", profile.promptHints());
        payload.put("createdAt", timestamp(profile.createdAt()));
        payload.put("updatedAt", timestamp(profile.updatedAt()));
        return payload;
    }

    static ParsingProfile fromDocument(String vendorId, Map<String, Object> data) {
        Map<String, Object> values = data != null ? data : Map.of();

        Map<SemanticField, ColumnMapping> columns = new EnumMap<>(SemanticField.class);
        map(values.get("columns")).forEach((field, value) -> {
            Map<String, Object> column = map(value);
            String aiOriginal = string(column.get("aiOriginal"));
            columns.put(SemanticField.fromWire(field), new ColumnMapping(intValue(column.get("index")),
                aiOriginal != null ? SemanticField.fromWire(aiOriginal) : null, bool(column.get("wasChanged")),
                string(column.get("sampleValue"))));
        });

        Map<String, Object> packageFormat = map(values.get("packageFormat"));
        String kind = string(packageFormat.get("kind"));
        PackageFormatSetting packageSetting = bool(packageFormat.get("enabled")) && kind != null
            ? PackageFormatSetting.of(PackageFormatKind.fromWire(kind))
            : PackageFormatSetting.DISABLED;

        List<QuirkFlag> quirks = FirestoreValues.strings(values.get("quirks")).stream()
            .map(QuirkFlag::fromWire)
            .toList();

        List<ColumnCorrection> corrections = maps(values.get("columnCorrections")).stream()
            .map(entry -> new ColumnCorrection(string(entry.get("field")), FirestoreValues.integer(entry.get("index")),
                string(entry.get("aiDetected")), string(entry.get("userCorrected")), string(entry.get("sampleValue")),
                instant(entry.get("correctedAt"))))
            .toList();

        Map<String, ItemCorrection> itemCorrections = new LinkedHashMap<>();
        for (Map<String, Object> entry : maps(values.get("itemCorrections"))) {
            ItemCorrection correction = new ItemCorrection(string(entry.get("key")),
                PricingModel.fromWire(string(entry.get("pricingModel"))), decimal(entry.get("value")),
                string(entry.get("unit")), instant(entry.get("correctedAt")));
            itemCorrections.put(correction.key(), correction);
        }

        List<SampleLine> samples = maps(values.get("sampleLines")).stream()
            .map(entry -> new SampleLine(string(entry.get("itemCode")), string(entry.get("description")),
                string(entry.get("quantity")), string(entry.get("weight")), string(entry.get("unitPrice")),
                string(entry.get("totalPrice"))))
            .toList();

        Map<String, Object> stats = map(values.get("stats"));
        ProfileStats profileStats = stats.isEmpty()
            ? ProfileStats.initial()
            : new ProfileStats(intValue(stats.get("timesUsed")), instant(stats.get("lastUsed")),
                FirestoreValues.doubleValue(stats.get("successRate"), 100.0), intValue(stats.get("columnCorrections")),
                intValue(stats.get("lineCorrections")), intValue(stats.get("successesSinceCorrection")));

        String weightUnit = string(values.get("weightUnit"));
        return ParsingProfile.builder()
            .vendorId(vendorId)
            .vendorName(string(values.get("vendorName")))
            .version(intValue(values.get("version")))
            .pricingModel(string(values.get("pricingModel")))
            .columns(columns)
            .weightUnit(weightUnit != null ? MeasurementUnit.find(weightUnit).orElse(null) : null)
            .packageFormat(packageSetting)
            .quirks(VendorQuirks.of(quirks))
            .columnCorrections(corrections)
            .itemCorrections(itemCorrections)
            .sampleLines(samples)
            .stats(profileStats)
            .promptHints(string(values.get("promptHints")))
            .createdAt(instant(values.get("createdAt")))
            .updatedAt(instant(values.get("updatedAt")))
            .build();
    }
}
