package pl.marcinmilkowski.usas_eval.dataset;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A parsed corpus holding either gold or predicted labels, ready for evaluation.
 *
 * @param name          dataset name, e.g. {@code Benedict English}
 * @param textLevel     granularity of {@code texts}
 * @param labelsRemoved labels filtered out while parsing, or null when nothing was filtered
 * @param texts         the parsed texts in corpus order
 */
public record EvaluationDataset(
    String name,
    TextLevel textLevel,
    Set<String> labelsRemoved,
    List<EvaluationText> texts
) {
    public EvaluationDataset {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dataset name must not be empty");
        }
        if (textLevel == null) {
            throw new IllegalArgumentException("Text level must not be null for dataset: " + name);
        }
        labelsRemoved = labelsRemoved == null ? null : Set.copyOf(labelsRemoved);
        texts = texts == null ? Collections.emptyList() : List.copyOf(texts);
    }

    public int tokenCount() {
        return texts.stream().mapToInt(EvaluationText::tokenCount).sum();
    }

    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("name", name);
        root.put("text_level", textLevel.value());
        root.put("labels_removed", labelsRemoved == null ? null : new JSONArray(new TreeSet<>(labelsRemoved)));
        JSONArray textsArray = new JSONArray();
        for (EvaluationText text : texts) {
            textsArray.add(text.toJson());
        }
        root.put("texts", textsArray);
        return root;
    }

    public String toJsonString() {
        return JSON.toJSONString(toJson(), JSONWriter.Feature.PrettyFormat, JSONWriter.Feature.WriteNulls);
    }

    /**
     * Write the dataset as pretty-printed UTF-8 JSON.
     */
    public void writeJson(Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJsonString(), StandardCharsets.UTF_8);
    }
}
