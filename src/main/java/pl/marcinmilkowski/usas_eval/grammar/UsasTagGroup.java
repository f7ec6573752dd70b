package pl.marcinmilkowski.usas_eval.grammar;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more USAS tags assigned together to a single token, e.g. {@code F2/O2}.
 * The token is an equal member of every tag in the group; in some corpora the
 * first tag is the primary one, so order is kept.
 */
public record UsasTagGroup(List<UsasTag> tags) {

    public UsasTagGroup {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("A USAS tag group needs at least one tag");
        }
        tags = List.copyOf(tags);
    }

    public static UsasTagGroup of(UsasTag... tags) {
        return new UsasTagGroup(List.of(tags));
    }

    public UsasTag primary() {
        return tags.get(0);
    }

    public List<String> codes() {
        return tags.stream().map(UsasTag::code).collect(Collectors.toList());
    }

    /**
     * Tag codes joined with {@code /}, markers removed, e.g. {@code Z2/S2}.
     */
    public String joinedCodes() {
        return String.join(UsasTagParser.MULTI_TAG_SEPARATOR, codes());
    }

    public JSONObject toJson() {
        JSONArray tagsArray = new JSONArray();
        for (UsasTag tag : tags) {
            tagsArray.add(tag.toJson());
        }
        JSONObject obj = new JSONObject();
        obj.put("tags", tagsArray);
        return obj;
    }
}
