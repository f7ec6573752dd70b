package pl.marcinmilkowski.usas_eval.dataset;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * One unit of text (sentence, paragraph or document) with its tokens and the
 * optional per-token annotations. Every annotation list that is present has
 * one entry per token.
 *
 * An empty MWE set means the token is not part of a multi word expression;
 * tokens sharing an id in their sets make up one expression.
 */
public record EvaluationText(
    String text,
    List<String> tokens,
    List<String> lemmas,
    List<String> posTags,
    List<String> semanticTags,
    List<Set<Integer>> mweIndexes
) {
    public EvaluationText {
        if (text == null) {
            throw new IllegalArgumentException("Text must not be null");
        }
        tokens = tokens == null ? Collections.emptyList() : List.copyOf(tokens);
        lemmas = lemmas == null ? null : List.copyOf(lemmas);
        posTags = posTags == null ? null : List.copyOf(posTags);
        semanticTags = semanticTags == null ? null : List.copyOf(semanticTags);
        if (mweIndexes != null) {
            List<Set<Integer>> copied = new ArrayList<>(mweIndexes.size());
            for (Set<Integer> mweSet : mweIndexes) {
                copied.add(Set.copyOf(mweSet));
            }
            mweIndexes = Collections.unmodifiableList(copied);
        }

        int numberTokens = tokens.size();
        checkLength(numberTokens, lemmas, "lemmas");
        checkLength(numberTokens, posTags, "POS tags");
        checkLength(numberTokens, semanticTags, "semantic tags");
        checkLength(numberTokens, mweIndexes, "MWE indexes");
    }

    private static void checkLength(int numberTokens, List<?> values, String name) {
        if (values != null && values.size() != numberTokens) {
            throw new IllegalArgumentException("The number of tokens: " + numberTokens
                + " and " + name + " must be the same: " + values.size());
        }
    }

    public int tokenCount() {
        return tokens.size();
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("text", text);
        obj.put("tokens", new JSONArray(tokens));
        obj.put("lemmas", lemmas == null ? null : new JSONArray(lemmas));
        obj.put("pos_tags", posTags == null ? null : new JSONArray(posTags));
        obj.put("semantic_tags", semanticTags == null ? null : new JSONArray(semanticTags));
        if (mweIndexes == null) {
            obj.put("mwe_indexes", null);
        } else {
            JSONArray mweArray = new JSONArray();
            for (Set<Integer> mweSet : mweIndexes) {
                mweArray.add(new JSONArray(new ArrayList<>(new TreeSet<>(mweSet))));
            }
            obj.put("mwe_indexes", mweArray);
        }
        return obj;
    }

    /**
     * Builder for texts assembled token by token.
     */
    public static class Builder {
        private String text;
        private final List<String> tokens = new ArrayList<>();
        private final List<String> semanticTags = new ArrayList<>();
        private final List<Set<Integer>> mweIndexes = new ArrayList<>();

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder addToken(String token, String semanticTag, Set<Integer> mweIndex) {
            tokens.add(token);
            semanticTags.add(semanticTag);
            mweIndexes.add(mweIndex);
            return this;
        }

        public Builder addToken(String token, String semanticTag) {
            return addToken(token, semanticTag, Set.of());
        }

        public int size() {
            return tokens.size();
        }

        /**
         * Builds the text; when no text was set the tokens joined by a single space are used.
         */
        public EvaluationText build() {
            String resolvedText = text != null ? text : String.join(" ", tokens);
            return new EvaluationText(resolvedText, tokens, null, null, semanticTags, mweIndexes);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
