package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.dataset.EvaluationText;

import java.util.List;
import java.util.Set;

/**
 * Parser for the English Benedict corpus of human annotated USAS tags.
 *
 * Tokens are written {@code <token>_<usas-tag><mwe>?}, e.g.
 * {@code Turkish_F2/O4.5[i86.2.1 grind_F2/O4.5[i86.2.2 -_- extremely_A13.3}.
 * The tags {@code PUNC}, {@code -}, {@code .}, {@code ,} and {@code !} become
 * {@code PUNCT}. The text of each sentence is the original line, markers included.
 */
public class BenedictEnglishParser extends LineCorpusParser {

    public static final String NAME = "Benedict English";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected EvaluationText parseLine(String line, LabelRules labelRules) {
        BracketLineValidator.ValidatedLine validated = BracketLineValidator.validate(line);
        for (String token : validated.tokens()) {
            requireNotATag(token);
        }
        List<String> semanticTags = labelRules.applyAll(validated.semanticTags());
        List<Set<Integer>> mweIndexes = BracketMweReconstructor.reconstruct(validated.text());

        return new EvaluationText(validated.text(), validated.tokens(), null, null, semanticTags, mweIndexes);
    }
}
