package pl.marcinmilkowski.usas_eval.parsers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.usas_eval.dataset.EvaluationDataset;
import pl.marcinmilkowski.usas_eval.dataset.EvaluationText;
import pl.marcinmilkowski.usas_eval.dataset.TextLevel;
import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for corpora with one sentence per line. Blank lines are skipped;
 * line indexes in error messages are 0-based and count blank lines.
 */
public abstract class LineCorpusParser implements CorpusParser {

    private static final Logger logger = LoggerFactory.getLogger(LineCorpusParser.class);

    @Override
    public EvaluationDataset parse(Path datasetPath, LabelRules labelRules) throws IOException {
        String datasetName = getName();
        logger.info("Parsing the {} dataset found at: {}", datasetName, datasetPath);
        logger.info("Using label validation: {}", labelRules.isValidating());
        logger.info("Using label filtering: {}", labelRules.isFiltering());

        List<EvaluationText> texts = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(datasetPath, StandardCharsets.UTF_8)) {
            String line;
            int lineIndex = -1;
            while ((line = reader.readLine()) != null) {
                lineIndex++;
                line = line.strip();
                if (line.isEmpty()) {
                    continue;
                }
                logger.debug("Line index: {}", lineIndex);

                EvaluationText text;
                try {
                    text = parseLine(line, labelRules);
                } catch (UsasFormatException e) {
                    throw new UsasFormatException("Error parsing the " + datasetName
                        + " dataset at line: " + lineIndex + ": `" + line + "`", e);
                }
                logger.debug("Number of tokens in line: {}", text.tokenCount());
                texts.add(text);
            }
        }

        logger.info("Finished parsing the {} dataset: {} texts", datasetName, texts.size());
        return new EvaluationDataset(datasetName, TextLevel.SENTENCE, labelRules.labelFilter(), texts);
    }

    /**
     * Parse one stripped, non-empty line.
     *
     * @throws UsasFormatException if the line is malformed or fails label validation
     */
    protected abstract EvaluationText parseLine(String line, LabelRules labelRules);

    /**
     * Reject token texts that are themselves USAS tags, a sign of shifted columns.
     */
    protected static void requireNotATag(String token) {
        if (UsasTagParser.isTagGroup(token)) {
            throw new UsasFormatException("Error expected token is a tag: " + token);
        }
    }
}
