package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.dataset.EvaluationDataset;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for parsers that convert an annotated corpus file into an evaluation dataset.
 */
public interface CorpusParser {

    /**
     * Parse the corpus at the given path.
     *
     * If a label is filtered out its semantic tag becomes the empty string, which
     * is never reported by label validation. {@code PUNCT} does not need to be in
     * the validation set.
     *
     * @param datasetPath path to the corpus file
     * @param labelRules  label validation and filtering to apply
     * @return the parsed dataset
     * @throws IOException if the file cannot be read
     * @throws pl.marcinmilkowski.usas_eval.grammar.UsasFormatException if the data is malformed
     *         or a label fails validation
     */
    EvaluationDataset parse(Path datasetPath, LabelRules labelRules) throws IOException;

    /**
     * Parse without label validation or filtering.
     */
    default EvaluationDataset parse(Path datasetPath) throws IOException {
        return parse(datasetPath, LabelRules.none());
    }

    /**
     * Get the dataset name this parser produces, e.g. {@code Benedict English}.
     */
    String getName();
}
