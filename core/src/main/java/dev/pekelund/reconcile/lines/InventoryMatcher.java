package dev.pekelund.reconcile.lines;

import dev.pekelund.reconcile.inventory.InventoryItem;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Scores inventory items against an invoice line description.
 *
 * <p>Scores out of 100, first rule that applies wins:
 * <ul>
 *   <li>100 - normalized description equals the item name</li>
 *   <li>95 - the item SKU appears in the description, or an alias equals it</li>
 *   <li>90 - one of name and description starts with the other</li>
 *   <li>85 - one contains the other</li>
 *   <li>80 - an alias contains the description or the other way round</li>
 *   <li>otherwise up to 70 for shared words of three letters or more</li>
 * </ul>
 */
public class InventoryMatcher {

    public static final int DEFAULT_THRESHOLD = 80;

    /**
     * Items fetched from inventory for one line.
     */
    public static final int SEARCH_LIMIT = 10;

    /**
     * Candidates kept on the line for review.
     */
    public static final int KEPT_CANDIDATES = 5;

    private static final Pattern ACCENTS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int threshold;

    public InventoryMatcher() {
        this(DEFAULT_THRESHOLD);
    }

    public InventoryMatcher(int threshold) {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be between 0 and 100");
        }
        this.threshold = threshold;
    }

    public int threshold() {
        return threshold;
    }

    /**
     * Lower case, accents removed, whitespace collapsed.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value.toLowerCase(Locale.ROOT).trim(), Normalizer.Form.NFD);
        return WHITESPACE.matcher(ACCENTS.matcher(decomposed).replaceAll("")).replaceAll(" ");
    }

    /**
     * Normalized words of three letters or more, in order and without repeats.
     */
    public static List<String> words(String value) {
        String normalized = normalize(value);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(normalized.split(" "))
            .filter(word -> word.length() > 2)
            .distinct()
            .toList();
    }

    public int confidence(String description, InventoryItem item) {
        if (!StringUtils.hasText(description) || item == null) {
            return 0;
        }
        String desc = normalize(description);
        String name = normalize(item.name());
        if (desc.equals(name)) {
            return 100;
        }
        if (StringUtils.hasText(item.sku())
            && description.toLowerCase(Locale.ROOT).contains(item.sku().toLowerCase(Locale.ROOT))) {
            return 95;
        }
        if (!name.isEmpty() && (name.startsWith(desc) || desc.startsWith(name))) {
            return 90;
        }
        if (!name.isEmpty() && (name.contains(desc) || desc.contains(name))) {
            return 85;
        }
        for (String alias : item.aliases()) {
            String normalizedAlias = normalize(alias);
            if (normalizedAlias.isEmpty()) {
                continue;
            }
            if (normalizedAlias.equals(desc)) {
                return 95;
            }
            if (normalizedAlias.contains(desc) || desc.contains(normalizedAlias)) {
                return 80;
            }
        }
        return wordOverlap(words(description), words(item.name()));
    }

    private static int wordOverlap(List<String> descWords, List<String> nameWords) {
        if (descWords.isEmpty() || nameWords.isEmpty()) {
            return 0;
        }
        long matched = descWords.stream()
            .filter(word -> nameWords.stream().anyMatch(other -> other.contains(word) || word.contains(other)))
            .count();
        return (int) Math.round(matched * 70.0 / Math.max(descWords.size(), nameWords.size()));
    }

    /**
     * Scores the items and returns the best {@link #KEPT_CANDIDATES}, highest score first.
     */
    public List<MatchCandidate> rank(String description, List<InventoryItem> items) {
        return items.stream()
            .map(item -> new MatchCandidate(item.id(), item.name(), item.sku(), confidence(description, item)))
            .sorted(Comparator.comparingInt(MatchCandidate::score).reversed())
            .limit(KEPT_CANDIDATES)
            .toList();
    }

    /**
     * The top candidate when it scores at least the threshold.
     */
    public Optional<MatchCandidate> choose(List<MatchCandidate> ranked) {
        if (ranked.isEmpty() || ranked.get(0).score() < threshold) {
            return Optional.empty();
        }
        return Optional.of(ranked.get(0));
    }

    /**
     * Whether a search for {@code query} should return the item: a name or alias word shares a word
     * with the query, or the item's SKU appears in it.
     */
    public static boolean isSearchHit(String query, InventoryItem item) {
        if (!StringUtils.hasText(query) || item == null) {
            return false;
        }
        if (StringUtils.hasText(item.sku())
            && query.toLowerCase(Locale.ROOT).contains(item.sku().toLowerCase(Locale.ROOT))) {
            return true;
        }
        List<String> queryWords = words(query);
        return searchWords(item).stream().anyMatch(queryWords::contains);
    }

    /**
     * Words of the item's name and aliases a search can hit.
     */
    public static List<String> searchWords(InventoryItem item) {
        String name = item.name() != null ? item.name() : "";
        return words(name + " " + String.join(" ", item.aliases()));
    }
}
