package org.iceforge.tilecut.archive;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses archive file names against a {@link NamingRules.Rule}.
 */
public final class FileNameParser {

    private static final Pattern GRAMMAR = Pattern.compile("^(.+?)_TILE([^-_]+)-([^_]+)_(.+)\\.fits$");

    private FileNameParser() {}

    /**
     * Channel information recovered from one file name.
     *
     * @param instrumentCode code of the instrument as written in the name, e.g. {@code NIR}
     * @param bandCode       band part, equal to {@code instrumentCode} for single-channel instruments
     */
    public record ParsedName(String tileId, String instrumentCode, String bandCode) {

        /** {@code NIR-Y}, {@code DES-G}, or just {@code VIS} for single-channel instruments. */
        public String fullBand() {
            return instrumentCode.equals(bandCode) ? bandCode : instrumentCode + "-" + bandCode;
        }
    }

    public static Optional<ParsedName> parse(String fileName, NamingRules.Rule rule) {
        if (fileName == null || NamingRules.isExcluded(fileName)) {
            return Optional.empty();
        }
        Matcher m = GRAMMAR.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        String stem = m.group(1);
        if (!stem.startsWith(rule.prefix()) || !stem.endsWith(rule.suffix())
                || stem.length() <= rule.prefix().length() + rule.suffix().length()) {
            return Optional.empty();
        }
        String channel = stem.substring(rule.prefix().length(), stem.length() - rule.suffix().length());
        String[] tokens = channel.split("-");
        if (tokens.length == 0 || Arrays.stream(tokens).anyMatch(String::isEmpty)) {
            return Optional.empty();
        }
        String instrument = tokens[0];
        String band = tokens.length == 1 ? instrument : String.join("-", Arrays.copyOfRange(tokens, 1, tokens.length));
        return Optional.of(new ParsedName(m.group(2), instrument, band));
    }
}
