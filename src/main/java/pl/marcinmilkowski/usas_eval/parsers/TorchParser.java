package pl.marcinmilkowski.usas_eval.parsers;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.usas_eval.dataset.EvaluationDataset;
import pl.marcinmilkowski.usas_eval.dataset.EvaluationText;
import pl.marcinmilkowski.usas_eval.dataset.TextLevel;
import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;
import pl.marcinmilkowski.usas_eval.grammar.UsasTag;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parser for the Chinese ToRCH corpus of human annotated USAS tags. The corpus
 * has no MWEs.
 *
 * The corpus is a CSV file with one token per row and at least the columns:
 * - {@code Token}: the token text
 * - {@code Corrected-USAS}: one or more USAS tags, only the first is kept
 * - {@code sentence-break}: {@code true} when the token ends a sentence
 *
 * When {@code Corrected-USAS} is empty and the optional {@code Predicted-USAS}
 * column holds {@code PUNCT}, the token is tagged {@code PUNCT}. The text of each
 * sentence is its tokens joined by a single space.
 */
public class TorchParser implements CorpusParser {

    private static final Logger logger = LoggerFactory.getLogger(TorchParser.class);

    public static final String NAME = "Torch";

    static final String TOKEN_COLUMN = "Token";
    static final String CORRECTED_USAS_COLUMN = "Corrected-USAS";
    static final String PREDICTED_USAS_COLUMN = "Predicted-USAS";
    static final String SENTENCE_BREAK_COLUMN = "sentence-break";

    private static final Set<String> REQUIRED_COLUMNS = Set.of(TOKEN_COLUMN, CORRECTED_USAS_COLUMN, SENTENCE_BREAK_COLUMN);

    private static final String FULL_WIDTH_SEMICOLON = "；";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Row number of the first data row, the header being row 1. */
    private static final int FIRST_DATA_ROW = 2;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public EvaluationDataset parse(Path datasetPath, LabelRules labelRules) throws IOException {
        logger.info("Parsing the {} dataset found at: {}", NAME, datasetPath);
        logger.info("Using label validation: {}", labelRules.isValidating());
        logger.info("Using label filtering: {}", labelRules.isFiltering());

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

        List<EvaluationText> texts = new ArrayList<>();
        EvaluationText.Builder sentence = EvaluationText.builder();

        try (Reader reader = Files.newBufferedReader(datasetPath, StandardCharsets.UTF_8);
             CSVParser csvParser = new CSVParser(reader, csvFormat)) {

            List<String> headerNames = csvParser.getHeaderNames();
            if (headerNames == null || !headerNames.containsAll(REQUIRED_COLUMNS)) {
                throw new UsasFormatException("Error expected at least the following field names: "
                    + REQUIRED_COLUMNS + " but got: " + headerNames);
            }

            int rowIndex = FIRST_DATA_ROW;
            for (CSVRecord record : csvParser) {
                try {
                    String token = column(record, TOKEN_COLUMN).strip();
                    String semanticTag = labelRules.apply(firstLabel(correctedLabel(record)));
                    validateToken(token);
                    sentence.addToken(token, semanticTag);

                    if (isSentenceBreak(column(record, SENTENCE_BREAK_COLUMN))) {
                        texts.add(sentence.build());
                        sentence = EvaluationText.builder();
                    }
                } catch (UsasFormatException e) {
                    throw new UsasFormatException("Error parsing the " + NAME + " dataset at row: "
                        + rowIndex + " with " + record.toMap(), e);
                }
                rowIndex++;
            }
        }
        if (sentence.size() > 0) {
            texts.add(sentence.build());
        }

        logger.info("Finished parsing the {} dataset: {} texts", NAME, texts.size());
        return new EvaluationDataset(NAME, TextLevel.SENTENCE, labelRules.labelFilter(), texts);
    }

    private static String column(CSVRecord record, String name) {
        if (!record.isSet(name)) {
            throw new UsasFormatException("Missing value for column: " + name);
        }
        return record.get(name);
    }

    private static String correctedLabel(CSVRecord record) {
        String corrected = column(record, CORRECTED_USAS_COLUMN).strip();
        if (corrected.isEmpty() && record.isSet(PREDICTED_USAS_COLUMN)
                && UsasTag.PUNCT.equals(record.get(PREDICTED_USAS_COLUMN).strip())) {
            return UsasTag.PUNCT;
        }
        return corrected;
    }

    /**
     * Split the annotated label string and parse its first label. Labels are
     * separated by a full width semicolon, else a comma, else whitespace.
     */
    static String firstLabel(String labelString) {
        String[] labels;
        if (labelString.contains(FULL_WIDTH_SEMICOLON)) {
            labels = labelString.split(FULL_WIDTH_SEMICOLON);
        } else if (labelString.contains(",")) {
            labels = labelString.split(",");
        } else {
            labels = WHITESPACE.split(labelString);
        }

        for (String label : labels) {
            String cleaned = label.strip();
            if (!cleaned.isEmpty()) {
                return UsasTagParser.parseSingleTagGroup(cleaned).joinedCodes();
            }
        }
        throw new UsasFormatException("Error expected at least one label in: '" + labelString + "'");
    }

    private static void validateToken(String token) {
        if (token.isEmpty()) {
            throw new UsasFormatException("Error expected token not to be empty");
        }
        if (UsasTagParser.isTagGroup(token)) {
            throw new UsasFormatException("Error expected token is a tag: " + token);
        }
    }

    private static boolean isSentenceBreak(String value) {
        switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new UsasFormatException("Invalid sentence-break value: " + value);
        }
    }
}
