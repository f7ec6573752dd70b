package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.dataset.EvaluationText;
import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;

import java.util.regex.Pattern;

/**
 * Parser for the Welsh CorCenCC corpus of human annotated USAS tags. The corpus
 * has no MWEs.
 *
 * Each token is written as seven {@code |} separated fields:
 * {@code Token|Lemma|CorePOS|BasicPOS|PredictedEnrichedPOS|PredictedBasicPOS|USAS},
 * e.g. {@code A|a|pron|Rha|Rhaperth|Rha|Z5}. Only the token and the USAS tag are
 * kept. The text of each sentence is its tokens joined by a single space.
 */
public class CorcenccParser extends LineCorpusParser {

    public static final String NAME = "Corcencc";

    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\\|");
    private static final int FIELD_COUNT = 7;
    private static final int TOKEN_FIELD = 0;
    private static final int USAS_FIELD = 6;

    /** Broadcaster name that looks like a USAS tag. */
    private static final String TAG_LIKE_TOKEN = "S4C";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected EvaluationText parseLine(String line, LabelRules labelRules) {
        EvaluationText.Builder builder = EvaluationText.builder();
        for (String tokenData : line.split("\\s+")) {
            String[] fields = FIELD_SEPARATOR.split(tokenData, -1);
            if (fields.length != FIELD_COUNT) {
                throw new UsasFormatException("CorCenCC data is not in the expected format, expected "
                    + FIELD_COUNT + " columns but found " + fields.length + " columns in: " + tokenData);
            }

            String token = fields[TOKEN_FIELD].strip();
            String usasLabel = fields[USAS_FIELD].strip();

            String semanticTag = labelRules.apply(UsasTagParser.parseSingleTagGroup(usasLabel).joinedCodes());

            if (token.isEmpty()) {
                throw new UsasFormatException("Error expected token not to be empty in: " + tokenData);
            }
            if (!TAG_LIKE_TOKEN.equals(token)) {
                requireNotATag(token);
            }
            builder.addToken(token, semanticTag);
        }
        return builder.build();
    }
}
