package pl.marcinmilkowski.usas_eval.taxonomy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads the USAS tag taxonomy ({@code usas_mapper.yaml}) and flattens it to
 * tag code -> description.
 *
 * Expected YAML structure:
 * <pre>
 * A:
 *   title: General and abstract terms
 *   description: ...
 *   A1:
 *     title: General
 *     description: ...
 *     A1.1.1:
 *       title: General actions, making etc.
 *       description: ...
 * </pre>
 *
 * A node with both {@code title} and {@code description} becomes the entry
 * {@code "title: <title> description: <description>"}. Every other key of a node
 * is a child node.
 */
public class UsasTaxonomyLoader {
    private static final Logger logger = LoggerFactory.getLogger(UsasTaxonomyLoader.class);

    private static final String TITLE_KEY = "title";
    private static final String DESCRIPTION_KEY = "description";

    private final Map<String, String> descriptions;

    /**
     * Load the taxonomy from the specified path.
     *
     * @param taxonomyPath     path to the taxonomy YAML file
     * @param tagsToFilterOut  tag codes to drop after loading, may be null
     * @throws NoSuchFileException      if the file does not exist
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the path is not a file or the taxonomy is invalid
     */
    public UsasTaxonomyLoader(Path taxonomyPath, Set<String> tagsToFilterOut) throws IOException {
        if (!Files.exists(taxonomyPath)) {
            throw new NoSuchFileException("USAS taxonomy file not found at: " + taxonomyPath);
        }
        if (!Files.isRegularFile(taxonomyPath)) {
            throw new IllegalArgumentException("USAS taxonomy file is not a file: " + taxonomyPath);
        }

        Object root;
        try (Reader reader = Files.newBufferedReader(taxonomyPath, StandardCharsets.UTF_8)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("Invalid YAML in USAS taxonomy file: " + taxonomyPath, e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty USAS taxonomy file: " + taxonomyPath);
        }
        if (!(root instanceof Map)) {
            throw new IllegalArgumentException("Expected a mapping of USAS tags at the top of: " + taxonomyPath);
        }
        Map<?, ?> rootMap = (Map<?, ?>) root;
        if (rootMap.isEmpty()) {
            throw new IllegalArgumentException("Empty USAS taxonomy file: " + taxonomyPath);
        }

        Map<String, String> collected = flatten(rootMap);
        if (tagsToFilterOut != null) {
            collected.keySet().removeAll(tagsToFilterOut);
        }
        this.descriptions = Collections.unmodifiableMap(collected);

        logger.info("Loaded {} USAS tags from {}", descriptions.size(), taxonomyPath);
    }

    public UsasTaxonomyLoader(Path taxonomyPath) throws IOException {
        this(taxonomyPath, null);
    }

    /**
     * Walk the tree in document order with an explicit stack.
     */
    static Map<String, String> flatten(Map<?, ?> root) {
        Map<String, String> collected = new LinkedHashMap<>();
        Deque<Map.Entry<String, Object>> pending = new ArrayDeque<>();
        pushChildren(pending, root, null);

        while (!pending.isEmpty()) {
            Map.Entry<String, Object> entry = pending.pop();
            String tagName = entry.getKey();
            if (!(entry.getValue() instanceof Map)) {
                throw new IllegalArgumentException("Expected a mapping for USAS tag: " + tagName
                    + " but found: " + entry.getValue());
            }
            Map<?, ?> node = (Map<?, ?>) entry.getValue();

            boolean hasTitle = node.containsKey(TITLE_KEY);
            boolean hasDescription = node.containsKey(DESCRIPTION_KEY);
            if (hasTitle && hasDescription) {
                if (collected.containsKey(tagName)) {
                    throw new IllegalArgumentException("Duplicate USAS tag name found: " + tagName
                        + " when reading: " + node);
                }
                String titleDescription = "title: " + node.get(TITLE_KEY)
                    + " description: " + node.get(DESCRIPTION_KEY);
                collected.put(tagName, titleDescription.strip());
            } else if (hasTitle) {
                throw new IllegalArgumentException("No description key found when it is expected for: "
                    + tagName + " " + node);
            } else if (hasDescription) {
                throw new IllegalArgumentException("No title key found when it is expected for: "
                    + tagName + " " + node);
            }

            pushChildren(pending, node, tagName);
        }
        return collected;
    }

    private static void pushChildren(Deque<Map.Entry<String, Object>> pending, Map<?, ?> node, String parentName) {
        List<Map.Entry<String, Object>> children = new ArrayList<>();
        for (Map.Entry<?, ?> child : node.entrySet()) {
            // YAML keys such as 1 or true are not strings
            String childName = String.valueOf(child.getKey());
            if (parentName != null && (TITLE_KEY.equals(childName) || DESCRIPTION_KEY.equals(childName))) {
                continue;
            }
            children.add(new AbstractMap.SimpleImmutableEntry<>(childName, child.getValue()));
        }
        // reversed so the first child is popped first
        Collections.reverse(children);
        for (Map.Entry<String, Object> child : children) {
            pending.push(child);
        }
    }

    /**
     * All tag codes mapped to their {@code title: ... description: ...} text.
     */
    public Map<String, String> getDescriptions() {
        return descriptions;
    }

    public Set<String> getTagCodes() {
        return descriptions.keySet();
    }

    public Optional<String> getDescription(String tagCode) {
        return Optional.ofNullable(descriptions.get(tagCode));
    }

    public boolean contains(String tagCode) {
        return descriptions.containsKey(tagCode);
    }
}
