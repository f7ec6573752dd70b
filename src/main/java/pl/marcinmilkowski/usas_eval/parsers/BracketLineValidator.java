package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;
import pl.marcinmilkowski.usas_eval.grammar.UsasTag;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagGroup;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates lines whose tokens have the form {@code <token>_<usas-tag><mwe>?},
 * where the optional MWE marker looks like {@code [i86.2.1}.
 *
 * Example line:
 * {@code Turkish_F2/O4.5[i86.2.1 grind_F2/O4.5[i86.2.2 -_- extremely_A13.3 ,_PUNC}
 *
 * The MWE markers themselves are checked by {@link BracketMweReconstructor}.
 */
public final class BracketLineValidator {

    static final String TOKEN_SEPARATOR = "_";
    static final String MWE_MARKER_START = "[i";

    /** Tag texts the annotators used for punctuation; all become {@code PUNCT}. */
    static final Set<String> PUNCTUATION_TAGS = Set.of("PUNC", "-", ".", ",", "!");

    private BracketLineValidator() {
    }

    /**
     * A line that passed format validation.
     *
     * @param text         the line as given
     * @param tokens       token texts in line order
     * @param semanticTags {@code /} joined tag codes, or {@code PUNCT}, one per token
     */
    public record ValidatedLine(String text, List<String> tokens, List<String> semanticTags) {
        public ValidatedLine {
            tokens = List.copyOf(tokens);
            semanticTags = List.copyOf(semanticTags);
        }
    }

    /**
     * @throws UsasFormatException if the line is blank or any token is malformed
     */
    public static ValidatedLine validate(String text) {
        if (text == null || text.isBlank()) {
            throw new UsasFormatException("Empty or whitespace-only text string: '" + text + "'");
        }

        List<String> tokenTexts = new ArrayList<>();
        List<String> semanticTags = new ArrayList<>();

        for (String token : text.strip().split("\\s+")) {
            String[] parts = token.split(TOKEN_SEPARATOR, -1);
            if (parts.length != 2) {
                throw new UsasFormatException("Invalid token format in text: " + text
                    + ", expected exactly one underscore in token: " + token);
            }

            String tokenText = parts[0];
            String tagAndMwe = parts[1];
            if (tokenText.isEmpty()) {
                throw new UsasFormatException("Token text is empty in token: " + token + " for text: " + text);
            }

            int mweStart = tagAndMwe.indexOf(MWE_MARKER_START);
            if (mweStart == 0) {
                throw new UsasFormatException("Token has MWE but no USAS tag: " + token + " for text: " + text);
            }
            String tagText = mweStart == -1 ? tagAndMwe : tagAndMwe.substring(0, mweStart);

            tokenTexts.add(tokenText);
            semanticTags.add(toSemanticTag(tagText, token, text));
        }

        return new ValidatedLine(text, tokenTexts, semanticTags);
    }

    private static String toSemanticTag(String tagText, String token, String text) {
        // punctuation labels are not valid USAS tags, so check them before parsing
        if (PUNCTUATION_TAGS.contains(tagText)) {
            return UsasTag.PUNCT;
        }
        if (tagText.isEmpty()) {
            throw new UsasFormatException("USAS tag is empty in token: " + token + " for text: " + text);
        }
        try {
            List<UsasTagGroup> groups = UsasTagParser.parseTagGroups(tagText);
            return groups.get(0).joinedCodes();
        } catch (UsasFormatException e) {
            throw new UsasFormatException("Invalid USAS tag '" + tagText + "' in token: " + token
                + " for text: " + text, e);
        }
    }
}
