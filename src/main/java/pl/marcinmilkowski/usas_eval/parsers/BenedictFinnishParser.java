package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.dataset.EvaluationText;

/**
 * Parser for the Finnish Benedict corpus of human annotated USAS tags.
 *
 * Tokens are written {@code <token>_<usas-tag>(_i)?}, e.g.
 * {@code Vac_F2/O2_i pot_F2/O2_i on_A3+}. Punctuation tokens without a tag get
 * {@code PUNCT}. The text of each sentence is the original line.
 */
public class BenedictFinnishParser extends LineCorpusParser {

    public static final String NAME = "Benedict Finnish";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected EvaluationText parseLine(String line, LabelRules labelRules) {
        EvaluationText validated = SuffixLineValidator.validate(line);
        for (String token : validated.tokens()) {
            requireNotATag(token);
        }
        return new EvaluationText(validated.text(), validated.tokens(), null, null,
            labelRules.applyAll(validated.semanticTags()), validated.mweIndexes());
    }
}
