package pl.marcinmilkowski.usas_eval;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.usas_eval.dataset.EvaluationDataset;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagGroup;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;
import pl.marcinmilkowski.usas_eval.parsers.CorpusParser;
import pl.marcinmilkowski.usas_eval.parsers.CorpusParserFactory;
import pl.marcinmilkowski.usas_eval.parsers.LabelRules;
import pl.marcinmilkowski.usas_eval.taxonomy.UsasTaxonomyLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Main entry point for the USAS evaluation tools.
 *
 * Commands:
 *   parse --format benedict-english --input corpus.txt --output dataset.json
 *   tags "L1 E3- Z2/S2mf"
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase();

            switch (command) {
                case "parse":
                    handleParseCommand(args);
                    break;
                case "tags":
                    handleTagsCommand(args);
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar usas-evaluation.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  parse --format <name> --input <file> [--output <file.json>]");
        System.out.println("      Parse an annotated corpus into an evaluation dataset");
        System.out.println("      Options:");
        System.out.println("        --format <name>      One of: " + String.join(", ", CorpusParserFactory.available()));
        System.out.println("        --taxonomy <file>    USAS taxonomy YAML, its tags become the validation set");
        System.out.println("        --filter <a,b,...>   Tags to replace with an empty label");
        System.out.println("        --output <file>      Output JSON file (default: stdout)");
        System.out.println();
        System.out.println("  tags <tag-spec>");
        System.out.println("      Print the parsed USAS tag groups as JSON");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar usas-evaluation.jar parse --format torch \\");
        System.out.println("    --input torch.csv --taxonomy usas_mapper.yaml --filter Z99 --output torch.json");
        System.out.println();
        System.out.println("  java -jar usas-evaluation.jar tags \"L1 E3- Z2/S2mf\"");
    }

    private static void handleParseCommand(String[] args) throws IOException {
        String format = null;
        String inputPath = null;
        String outputPath = null;
        String taxonomyPath = null;
        Set<String> labelFilter = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--format":
                case "-f":
                    format = optionValue(args, ++i);
                    break;
                case "--input":
                case "-i":
                    inputPath = optionValue(args, ++i);
                    break;
                case "--output":
                case "-o":
                    outputPath = optionValue(args, ++i);
                    break;
                case "--taxonomy":
                    taxonomyPath = optionValue(args, ++i);
                    break;
                case "--filter":
                    labelFilter = parseTagList(optionValue(args, ++i));
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (format == null || inputPath == null) {
            System.err.println("Error: --format and --input are required");
            return;
        }

        CorpusParser parser = CorpusParserFactory.create(format);

        Set<String> labelValidation = null;
        if (taxonomyPath != null) {
            labelValidation = new UsasTaxonomyLoader(Paths.get(taxonomyPath)).getTagCodes();
        }

        EvaluationDataset dataset = parser.parse(Paths.get(inputPath), new LabelRules(labelValidation, labelFilter));

        if (outputPath == null) {
            System.out.println(dataset.toJsonString());
        } else {
            Path output = Paths.get(outputPath);
            dataset.writeJson(output);
            System.out.println("Wrote " + dataset.texts().size() + " texts, "
                + dataset.tokenCount() + " tokens to " + output);
        }
    }

    private static void handleTagsCommand(String[] args) {
        if (args.length < 2) {
            System.err.println("Error: a USAS tag string is required");
            return;
        }
        String tagSpec = String.join(" ", Arrays.copyOfRange(args, 1, args.length));

        JSONArray groups = new JSONArray();
        for (UsasTagGroup group : UsasTagParser.parseTagGroups(tagSpec)) {
            groups.add(group.toJson());
        }
        System.out.println(JSON.toJSONString(groups, JSONWriter.Feature.PrettyFormat));
    }

    /**
     * Value of the option whose name is at {@code valueIndex - 1}.
     *
     * @throws IllegalArgumentException if the option is the last argument
     */
    static String optionValue(String[] args, int valueIndex) {
        if (valueIndex >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[valueIndex - 1]);
        }
        return args[valueIndex];
    }

    static Set<String> parseTagList(String value) {
        Set<String> tags = new LinkedHashSet<>();
        for (String tag : value.split(",")) {
            String cleaned = tag.strip();
            if (!cleaned.isEmpty()) {
                tags.add(cleaned);
            }
        }
        return tags;
    }
}
