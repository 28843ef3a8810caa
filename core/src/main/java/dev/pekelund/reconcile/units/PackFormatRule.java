package dev.pekelund.reconcile.units;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One production of the pack notation grammar. Rules are tried in order and the first one that
 * produces a result wins.
 */
@FunctionalInterface
public interface PackFormatRule {

    /**
     * @param normalized the notation trimmed, with inner whitespace collapsed and decimal commas replaced
     * @param raw the notation as it appeared on the invoice
     * @return the parsed format, or empty when this rule does not apply
     */
    Optional<PackFormat> apply(String normalized, String raw);

    static PackFormatRule matching(Pattern pattern, MatchHandler handler) {
        return (normalized, raw) -> {
            Matcher matcher = pattern.matcher(normalized);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            return handler.handle(matcher, raw);
        };
    }

    @FunctionalInterface
    interface MatchHandler {

        Optional<PackFormat> handle(Matcher matcher, String raw);
    }
}
