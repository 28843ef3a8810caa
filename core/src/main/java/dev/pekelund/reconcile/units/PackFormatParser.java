package dev.pekelund.reconcile.units;

import dev.pekelund.reconcile.units.PackFormat.CountPack;
import dev.pekelund.reconcile.units.PackFormat.NeedsReview;
import dev.pekelund.reconcile.units.PackFormat.NestedUnits;
import dev.pekelund.reconcile.units.PackFormat.PackWeight;
import dev.pekelund.reconcile.units.PackFormat.RollCount;
import dev.pekelund.reconcile.units.PackFormat.SimpleCase;
import dev.pekelund.reconcile.units.PackFormat.SimpleMeasure;
import dev.pekelund.reconcile.units.PackFormat.Unrecognized;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Parses vendor pack and container notations ({@code 4/5LB}, {@code 10/100}, {@code 6/RL},
 * {@code 12CT}, {@code Caisse 5lb}) with an ordered list of {@link PackFormatRule}s. Additional vendor
 * notations are supported by passing extra rules ahead of the defaults.
 */
public class PackFormatParser {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String NUMBER = "(\\d+(?:\\.\\d+)?)";

    /**
     * Largest pack or unit count accepted. Bigger counts are left for review.
     */
    static final int MAX_COUNT = 100_000;

    private static final Pattern PACK_WEIGHT = Pattern.compile("^(\\d+)\\s*/\\s*" + NUMBER + "\\s*(\\p{L}+)\\.?$", FLAGS);
    private static final Pattern MULTIPLIER = Pattern.compile("^(\\d+)\\s*[x×]\\s*" + NUMBER + "\\s*(\\p{L}+)\\.?$", FLAGS);
    private static final Pattern ROLL = Pattern.compile("^(\\d+)\\s*/\\s*(?:RL|ROLL|ROLLS|ROULEAU|ROULEAUX)$", FLAGS);
    private static final Pattern CONTAINER = Pattern.compile("^(\\d+)\\s*/\\s*(\\d+)$", FLAGS);
    private static final Pattern COUNT_PACK = Pattern.compile("^(\\d+)\\s*(CT|PK|PCS|UN|DZ|DZN|DOZ)\\.?$", FLAGS);
    private static final Pattern SIMPLE_MEASURE = Pattern.compile("^(?:(\\p{L}+)\\s+)?" + NUMBER + "\\s*(\\p{L}+)\\.?$", FLAGS);
    private static final Pattern BARE_NUMBER = Pattern.compile("^(?:(\\p{L}+)\\s+)?" + NUMBER + "$", FLAGS);

    private final List<PackFormatRule> rules;

    public PackFormatParser() {
        this(defaultRules());
    }

    public PackFormatParser(List<PackFormatRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Parses the notation. Blank input yields an empty result, anything else yields a format
     * (falling back to {@link PackFormat.Kind#UNRECOGNIZED}).
     */
    public Optional<PackFormat> parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        String normalized = normalize(raw);
        for (PackFormatRule rule : rules) {
            Optional<PackFormat> result = rule.apply(normalized, raw);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.of(new Unrecognized(raw));
    }

    public static List<PackFormatRule> defaultRules() {
        return List.of(
            PackFormatRule.matching(PACK_WEIGHT, (matcher, raw) -> packWeight(matcher, raw, false)),
            PackFormatRule.matching(MULTIPLIER, (matcher, raw) -> packWeight(matcher, raw, true)),
            PackFormatRule.matching(ROLL, PackFormatParser::rollCount),
            PackFormatRule.matching(CONTAINER, PackFormatParser::container),
            PackFormatRule.matching(COUNT_PACK, PackFormatParser::countPack),
            PackFormatRule.matching(SIMPLE_MEASURE, PackFormatParser::simpleMeasure),
            PackFormatRule.matching(BARE_NUMBER, (matcher, raw) -> Optional.of(new NeedsReview(raw,
                new BigDecimal(matcher.group(2)),
                "Package value '" + raw.trim() + "' has no unit; confirm whether it is a unit count or a weight"))));
    }

    static String normalize(String raw) {
        String collapsed = raw.trim().replaceAll("\\s+", " ");
        return collapsed.replaceAll("(\\d),(\\d)", "$1.$2");
    }

    private static Optional<PackFormat> packWeight(Matcher matcher, String raw, boolean multiplier) {
        Optional<MeasurementUnit> unit = MeasurementUnit.find(matcher.group(3)).filter(MeasurementUnit::isMeasurable);
        if (unit.isEmpty()) {
            return Optional.empty();
        }
        Integer packCount = count(matcher.group(1));
        if (packCount == null) {
            return outOfRange(raw);
        }
        BigDecimal unitValue = new BigDecimal(matcher.group(2));
        return Optional.of(new PackWeight(raw, multiplier, packCount, unitValue, unit.get()));
    }

    private static Optional<PackFormat> rollCount(Matcher matcher, String raw) {
        Integer count = count(matcher.group(1));
        return count != null ? Optional.of(new RollCount(raw, count)) : outOfRange(raw);
    }

    private static Optional<PackFormat> container(Matcher matcher, String raw) {
        Integer outer = count(matcher.group(1));
        Integer inner = count(matcher.group(2));
        if (outer == null || inner == null) {
            return outOfRange(raw);
        }
        if (outer > 1) {
            return Optional.of(new NestedUnits(raw, outer, inner));
        }
        return Optional.of(new SimpleCase(raw, inner));
    }

    private static Optional<PackFormat> countPack(Matcher matcher, String raw) {
        Integer count = count(matcher.group(1));
        String suffix = matcher.group(2).toUpperCase(Locale.ROOT);
        if (count != null && suffix.startsWith("D")) {
            count = count <= MAX_COUNT / 12 ? count * 12 : null;
        }
        return count != null ? Optional.of(new CountPack(raw, count)) : outOfRange(raw);
    }

    /**
     * @return the count, or null when it exceeds {@link #MAX_COUNT}
     */
    private static Integer count(String digits) {
        String significant = digits.replaceFirst("^0+(?=\\d)", "");
        if (significant.length() > 6) {
            return null;
        }
        int value = Integer.parseInt(significant);
        return value <= MAX_COUNT ? value : null;
    }

    private static Optional<PackFormat> outOfRange(String raw) {
        return Optional.of(new NeedsReview(raw, null,
            "Pack notation '" + raw.trim() + "' has a count above " + MAX_COUNT + "; confirm the package size"));
    }

    private static Optional<PackFormat> simpleMeasure(Matcher matcher, String raw) {
        Optional<MeasurementUnit> unit = MeasurementUnit.find(matcher.group(3)).filter(MeasurementUnit::isMeasurable);
        if (unit.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SimpleMeasure(raw, matcher.group(1), new BigDecimal(matcher.group(2)), unit.get()));
    }
}
