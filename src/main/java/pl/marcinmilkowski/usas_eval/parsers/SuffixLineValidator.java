package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.dataset.EvaluationText;
import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;
import pl.marcinmilkowski.usas_eval.grammar.UsasTag;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagGroup;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;

import java.util.List;
import java.util.Set;

/**
 * Validates lines whose tokens have the form {@code <token>_<usas-tag>(_i)?},
 * where a trailing {@code _i} marks the token as part of a multi word expression.
 * Bare punctuation tokens without a tag are allowed.
 *
 * Example: {@code Vac_F2/O2_i pot_F2/O2_i is_A3+ good_A13.3_i day_A13.3_i}
 * gives the MWE sets {@code [{1}, {1}, {}, {2}, {2}]}: every contiguous run of
 * {@code _i} tokens is one expression, numbered in line order. Discontinuous
 * expressions cannot be written in this format.
 */
public final class SuffixLineValidator {

    static final String MWE_FLAG = "i";

    static final Set<String> PUNCTUATION_TOKENS = Set.of("-", ".", ",", "!", ":", "(", ")", "\"", "?");

    private SuffixLineValidator() {
    }

    /**
     * Validate a line and assemble its tokens, tags and MWE sets. Lemmas and POS
     * tags are not part of the format and are left null.
     *
     * @throws UsasFormatException if the line is blank or any token is malformed
     */
    public static EvaluationText validate(String text) {
        String line = text == null ? "" : text.strip();
        if (line.isEmpty()) {
            throw new UsasFormatException("Error the text string is empty: `" + line + "`");
        }

        EvaluationText.Builder builder = EvaluationText.builder().text(line);
        int mweIndex = 0;
        boolean inMwe = false;

        for (String unit : line.split("\\s+")) {
            String[] segments = unit.split(BracketLineValidator.TOKEN_SEPARATOR, -1);
            String token = segments[0];
            String tagText;

            switch (segments.length) {
                case 1:
                    if (!PUNCTUATION_TOKENS.contains(token)) {
                        throw new UsasFormatException("Error the text string is not valid: `" + line
                            + "` contains a single token " + token + " that is not punctuation "
                            + PUNCTUATION_TOKENS + ".");
                    }
                    tagText = UsasTag.PUNCT;
                    inMwe = false;
                    break;
                case 2:
                    tagText = segments[1];
                    inMwe = false;
                    break;
                case 3:
                    tagText = segments[1];
                    if (!MWE_FLAG.equals(segments[2])) {
                        throw new UsasFormatException("Error the text string is not valid: `" + line
                            + "` as the MWE index token should be `i` and not " + segments[2]
                            + " for the token " + token + ".");
                    }
                    if (!inMwe) {
                        mweIndex++;
                    }
                    inMwe = true;
                    break;
                default:
                    throw new UsasFormatException("Error the text string is not valid: `" + line
                        + "` as the token " + unit + " contains more than two underscores.");
            }

            if (token.isBlank()) {
                throw new UsasFormatException("Error the text string is not valid: `" + line
                    + "` as the token in " + unit + " is empty.");
            }

            String semanticTag = UsasTag.PUNCT.equals(tagText) && segments.length == 1
                ? UsasTag.PUNCT
                : toSemanticTag(tagText, token, line);
            builder.addToken(token, semanticTag, inMwe ? Set.of(mweIndex) : Set.of());
        }

        return builder.build();
    }

    private static String toSemanticTag(String tagText, String token, String line) {
        if (tagText.isEmpty()) {
            throw new UsasFormatException("USAS tag is empty for the token " + token + " in text: " + line);
        }
        try {
            List<UsasTagGroup> groups = UsasTagParser.parseTagGroups(tagText);
            return groups.get(0).joinedCodes();
        } catch (UsasFormatException e) {
            throw new UsasFormatException("Invalid USAS tag '" + tagText + "' in token: " + token
                + " for text: " + line, e);
        }
    }
}
