package pl.marcinmilkowski.usas_eval.grammar;

import com.alibaba.fastjson2.JSONObject;

/**
 * One decoded USAS semantic tag, e.g. {@code X5.2+} or {@code S2mf}.
 *
 * @param code            taxonomy code such as {@code A1.1.1}, or {@code PUNCT}
 * @param positiveMarkers number of {@code +} markers
 * @param negativeMarkers number of {@code -} markers
 * @param rarityMarker1   rarity marker {@code %}
 * @param rarityMarker2   rarity marker {@code @}
 * @param male            marker {@code m}
 * @param female          marker {@code f}
 * @param antecedents     potential antecedents of conceptual anaphors, marker {@code c}
 * @param neuter          marker {@code n}
 * @param idiom           idioms are not detected, always false
 */
public record UsasTag(
    String code,
    int positiveMarkers,
    int negativeMarkers,
    boolean rarityMarker1,
    boolean rarityMarker2,
    boolean male,
    boolean female,
    boolean antecedents,
    boolean neuter,
    boolean idiom
) {
    public static final String PUNCT = "PUNCT";

    public UsasTag {
        if (code == null || code.isEmpty()) {
            throw new IllegalArgumentException("USAS tag code must not be empty");
        }
        if (positiveMarkers < 0 || negativeMarkers < 0) {
            throw new IllegalArgumentException("Marker counts must not be negative for tag: " + code);
        }
        if (idiom) {
            throw new IllegalArgumentException("Idiom markers are not supported: " + code);
        }
    }

    /**
     * A tag with no markers.
     */
    public static UsasTag of(String code) {
        return new UsasTag(code, 0, 0, false, false, false, false, false, false, false);
    }

    /**
     * A tag with only intensity markers.
     */
    public static UsasTag of(String code, int positiveMarkers, int negativeMarkers) {
        return new UsasTag(code, positiveMarkers, negativeMarkers,
            false, false, false, false, false, false, false);
    }

    public boolean isPunctuation() {
        return PUNCT.equals(code);
    }

    /**
     * Code followed by its {@code +} and {@code -} markers, e.g. {@code E3--}.
     * Gender and rarity markers are dropped.
     */
    public String toIntensityForm() {
        return code + "+".repeat(positiveMarkers) + "-".repeat(negativeMarkers);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("tag", code);
        obj.put("number_positive_markers", positiveMarkers);
        obj.put("number_negative_markers", negativeMarkers);
        obj.put("rarity_marker_1", rarityMarker1);
        obj.put("rarity_marker_2", rarityMarker2);
        obj.put("female", female);
        obj.put("male", male);
        obj.put("antecedents", antecedents);
        obj.put("neuter", neuter);
        obj.put("idiom", idiom);
        return obj;
    }
}
