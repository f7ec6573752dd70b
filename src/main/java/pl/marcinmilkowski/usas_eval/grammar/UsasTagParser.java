package pl.marcinmilkowski.usas_eval.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for USAS tag strings as written by the USAS tagger and by human annotators.
 *
 * Grammar of a single tag (an atom):
 * - Code: one uppercase letter, digits, optional {@code .digits} groups, e.g. {@code A1.1.1}
 * - Or the literal {@code PUNCT}
 * - Intensity: a run of {@code +} or {@code -}, e.g. {@code X5.2++}, {@code O4.2-}
 * - Gender: {@code m}, {@code f}, {@code n}; antecedents: {@code c}
 * - Rarity: {@code %}, {@code @}
 *
 * A tag group joins atoms with {@code /} ({@code Z2/S2mf}); a tag-group string
 * separates groups with whitespace ({@code L1 E3- Z2/S2mf}).
 *
 * Marker characters after the code are tested for presence only, so unknown
 * trailing characters are accepted.
 */
public final class UsasTagParser {

    public static final String MULTI_TAG_SEPARATOR = "/";

    private static final Pattern TAG_CODE_PATTERN = Pattern.compile("^[A-Z]\\d+(\\.\\d+)*");
    private static final Pattern PUNCT_PATTERN = Pattern.compile("^" + UsasTag.PUNCT);
    private static final Pattern POSITIVE_MARKERS_PATTERN = Pattern.compile("\\++");
    private static final Pattern NEGATIVE_MARKERS_PATTERN = Pattern.compile("-+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private UsasTagParser() {
    }

    /**
     * Parse one tag atom, e.g. {@code X5.2+}. The atom must not contain {@code /}.
     *
     * @throws UsasFormatException if no tag code can be found at the start of the atom
     */
    public static UsasTag parseTag(String tagText) {
        if (tagText == null) {
            throw new UsasFormatException("Cannot find the tag for a null USAS tag text");
        }

        String code;
        String remainder;
        Matcher codeMatcher = TAG_CODE_PATTERN.matcher(tagText);
        Matcher punctMatcher = PUNCT_PATTERN.matcher(tagText);
        if (codeMatcher.find()) {
            code = codeMatcher.group();
            remainder = tagText.substring(codeMatcher.end());
        } else if (punctMatcher.find()) {
            code = punctMatcher.group();
            remainder = tagText.substring(punctMatcher.end());
        } else {
            throw new UsasFormatException("Cannot find the tag for this USAS tag text: " + tagText);
        }

        int positiveMarkers = 0;
        Matcher positiveMatcher = POSITIVE_MARKERS_PATTERN.matcher(remainder);
        if (positiveMatcher.find()) {
            positiveMarkers = positiveMatcher.group().length();
            remainder = positiveMatcher.replaceAll("");
        }

        int negativeMarkers = 0;
        Matcher negativeMatcher = NEGATIVE_MARKERS_PATTERN.matcher(remainder);
        if (negativeMatcher.find()) {
            negativeMarkers = negativeMatcher.group().length();
            remainder = negativeMatcher.replaceAll("");
        }

        return new UsasTag(
            code,
            positiveMarkers,
            negativeMarkers,
            remainder.indexOf('%') >= 0,
            remainder.indexOf('@') >= 0,
            remainder.indexOf('m') >= 0,
            remainder.indexOf('f') >= 0,
            remainder.indexOf('c') >= 0,
            remainder.indexOf('n') >= 0,
            false
        );
    }

    /**
     * Parse a whitespace separated string of tag groups, e.g.
     * {@code L1 E3- O4.2- Z2/S2mf}. Blank input gives an empty list.
     *
     * @throws UsasFormatException if any tag within any group cannot be parsed
     */
    public static List<UsasTagGroup> parseTagGroups(String tagGroupsText) {
        List<UsasTagGroup> groups = new ArrayList<>();
        if (tagGroupsText == null || tagGroupsText.isBlank()) {
            return groups;
        }

        for (String groupText : WHITESPACE.split(tagGroupsText.strip())) {
            List<UsasTag> tags = new ArrayList<>();
            for (String tagText : groupText.split(MULTI_TAG_SEPARATOR, -1)) {
                try {
                    tags.add(parseTag(tagText));
                } catch (UsasFormatException e) {
                    throw new UsasFormatException("Cannot parse USAS tag '" + tagText
                        + "' within tag group '" + groupText + "'", e);
                }
            }
            groups.add(new UsasTagGroup(tags));
        }
        return groups;
    }

    /**
     * Parse a tag-spec that must hold exactly one tag group, e.g. the label of a
     * single token.
     *
     * @throws UsasFormatException if the text is blank, holds more than one group, or does not parse
     */
    public static UsasTagGroup parseSingleTagGroup(String tagGroupText) {
        List<UsasTagGroup> groups = parseTagGroups(tagGroupText);
        if (groups.size() != 1) {
            throw new UsasFormatException("Expected exactly one USAS tag group but found "
                + groups.size() + " in: '" + tagGroupText + "'");
        }
        return groups.get(0);
    }

    /**
     * Whether the whole text parses as USAS tag groups. Used to reject token
     * texts that are really tags shifted into the token column.
     */
    public static boolean isTagGroup(String text) {
        try {
            parseTagGroups(text);
            return true;
        } catch (UsasFormatException e) {
            return false;
        }
    }
}
