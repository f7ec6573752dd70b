package pl.marcinmilkowski.usas_eval.parsers;

import java.util.List;
import java.util.Locale;

/**
 * Factory for creating CorpusParser instances by format name.
 *
 * Supported formats:
 * - {@code benedict-english}: English Benedict, bracket MWE markers
 * - {@code benedict-finnish}: Finnish Benedict, {@code _i} MWE suffix
 * - {@code corcencc}: Welsh CorCenCC, pipe separated token fields
 * - {@code torch}: Chinese ToRCH, CSV with a header row
 */
public final class CorpusParserFactory {

    public static final String BENEDICT_ENGLISH = "benedict-english";
    public static final String BENEDICT_FINNISH = "benedict-finnish";
    public static final String CORCENCC = "corcencc";
    public static final String TORCH = "torch";

    private CorpusParserFactory() {
    }

    /**
     * Create the parser for the given format name (case-insensitive).
     *
     * @throws IllegalArgumentException if the format is unknown
     */
    public static CorpusParser create(String format) {
        if (format == null) {
            throw new IllegalArgumentException("Corpus format must not be null, expected one of: " + available());
        }
        return switch (format.strip().toLowerCase(Locale.ROOT)) {
            case BENEDICT_ENGLISH -> new BenedictEnglishParser();
            case BENEDICT_FINNISH -> new BenedictFinnishParser();
            case CORCENCC -> new CorcenccParser();
            case TORCH -> new TorchParser();
            default -> throw new IllegalArgumentException(
                "Unknown corpus format: " + format + ", expected one of: " + available());
        };
    }

    public static List<String> available() {
        return List.of(BENEDICT_ENGLISH, BENEDICT_FINNISH, CORCENCC, TORCH);
    }
}
