package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers multi word expressions from the bracket markers of a validated line.
 *
 * A marker {@code [i<ID>.<TOTAL>.<INDEX>} says the token is the INDEX-th of TOTAL
 * tokens of expression ID, e.g. {@code [i86.2.1}. Members of one expression do
 * not have to be adjacent. Nested expressions (two markers on one token) are not
 * supported.
 *
 * Raw ids are renumbered 1, 2, 3... in ascending raw id order, not in order of
 * first appearance.
 */
public final class BracketMweReconstructor {

    private static final Pattern MWE_MARKER_PATTERN = Pattern.compile("\\[i(\\d+)\\.(\\d+)\\.(\\d+)");

    private BracketMweReconstructor() {
    }

    /**
     * Raw marker data collected for one expression id.
     */
    private static final class MweData {
        private final long totalTokens;
        private final List<Integer> tokenIndices = new ArrayList<>();

        private MweData(long totalTokens) {
            this.totalTokens = totalTokens;
        }
    }

    /**
     * One MWE set per whitespace separated token; an empty set means the token is
     * not part of an expression. Blank text gives an empty list.
     *
     * @throws UsasFormatException if a token or marker is malformed, a token carries
     *         more than one marker, or an expression's token count does not match its marker
     */
    public static List<Set<Integer>> reconstruct(String text) {
        List<Set<Integer>> result = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return result;
        }

        String[] tokens = text.strip().split("\\s+");
        // TreeMap keeps the raw ids sorted for the renumbering below
        Map<Long, MweData> mweData = new TreeMap<>();
        List<Long> tokenMweIds = new ArrayList<>(tokens.length);

        for (int tokenIndex = 0; tokenIndex < tokens.length; tokenIndex++) {
            String token = tokens[tokenIndex];
            String[] parts = token.split(BracketLineValidator.TOKEN_SEPARATOR, -1);
            if (parts.length != 2) {
                throw new UsasFormatException("Invalid token format in text: " + text
                    + ", expected a single underscore in token: " + token
                    + " that separates the token and the USAS tag / MWE information");
            }
            String tagAndMwe = parts[1];

            Matcher matcher = MWE_MARKER_PATTERN.matcher(tagAndMwe);
            if (!matcher.find()) {
                if (tagAndMwe.contains(BracketLineValidator.MWE_MARKER_START) && !tagAndMwe.endsWith("]")) {
                    throw new UsasFormatException("Invalid MWE format in token: " + token + " for text: " + text);
                }
                tokenMweIds.add(null);
                continue;
            }

            long mweId;
            long totalTokens;
            try {
                mweId = Long.parseLong(matcher.group(1));
                totalTokens = Long.parseLong(matcher.group(2));
                Long.parseLong(matcher.group(3));
            } catch (NumberFormatException e) {
                // the pattern only matches digits, so the number is too large
                throw new UsasFormatException("Invalid MWE format - number out of range in: " + token
                    + " for text: " + text, e);
            }

            if (matcher.find()) {
                throw new UsasFormatException("Multiple MWE assignments not supported in token: " + token
                    + " for text: " + text);
            }

            long declaredTotal = totalTokens;
            mweData.computeIfAbsent(mweId, id -> new MweData(declaredTotal)).tokenIndices.add(tokenIndex);
            tokenMweIds.add(mweId);
        }

        Map<Long, Integer> sequentialIds = new TreeMap<>();
        for (Map.Entry<Long, MweData> entry : mweData.entrySet()) {
            MweData data = entry.getValue();
            int actualTokenCount = data.tokenIndices.size();
            if (actualTokenCount != data.totalTokens) {
                throw new UsasFormatException("MWE " + entry.getKey() + " has " + actualTokenCount
                    + " tokens but expected " + data.totalTokens + " for text: " + text);
            }
            sequentialIds.put(entry.getKey(), sequentialIds.size() + 1);
        }

        for (Long mweId : tokenMweIds) {
            result.add(mweId == null ? Set.of() : Set.of(sequentialIds.get(mweId)));
        }
        return result;
    }
}
