package pl.marcinmilkowski.usas_eval.parsers;

import pl.marcinmilkowski.usas_eval.grammar.UsasFormatException;
import pl.marcinmilkowski.usas_eval.grammar.UsasTag;
import pl.marcinmilkowski.usas_eval.grammar.UsasTagParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Label filtering and validation applied to the semantic tags of a parsed corpus.
 *
 * Filtering matches the whole joined tag, so a filter of {@code F2} removes
 * {@code F2} but leaves {@code F2/O2} untouched. A filtered tag becomes the
 * empty string. Validation runs after filtering and checks every {@code /}
 * separated sub-tag; {@code PUNCT} and empty tags are always valid.
 *
 * @param labelValidation allowed tag codes, or null to skip validation
 * @param labelFilter     tags to replace with the empty string, or null to keep all
 */
public record LabelRules(Set<String> labelValidation, Set<String> labelFilter) {

    private static final LabelRules NONE = new LabelRules(null, null);

    public LabelRules {
        labelValidation = labelValidation == null ? null : Set.copyOf(labelValidation);
        labelFilter = labelFilter == null ? null : Set.copyOf(labelFilter);
    }

    public static LabelRules none() {
        return NONE;
    }

    public static LabelRules validating(Set<String> labelValidation) {
        return new LabelRules(labelValidation, null);
    }

    public static LabelRules filtering(Set<String> labelFilter) {
        return new LabelRules(null, labelFilter);
    }

    public boolean isValidating() {
        return labelValidation != null;
    }

    public boolean isFiltering() {
        return labelFilter != null;
    }

    /**
     * Filter then validate one semantic tag.
     *
     * @return the tag, or the empty string if it was filtered out
     * @throws UsasFormatException if a sub-tag is not in the validation set
     */
    public String apply(String semanticTag) {
        String tag = semanticTag;
        if (labelFilter != null && labelFilter.contains(tag)) {
            tag = "";
        }
        if (labelValidation != null && !tag.isEmpty() && !UsasTag.PUNCT.equals(tag)) {
            for (String subTag : tag.split(UsasTagParser.MULTI_TAG_SEPARATOR)) {
                if (!labelValidation.contains(subTag)) {
                    throw new UsasFormatException("Semantic tag is not in the label validation set: " + subTag);
                }
            }
        }
        return tag;
    }

    public List<String> applyAll(List<String> semanticTags) {
        List<String> result = new ArrayList<>(semanticTags.size());
        for (String semanticTag : semanticTags) {
            result.add(apply(semanticTag));
        }
        return result;
    }
}
