package pl.marcinmilkowski.usas_eval.taxonomy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UsasTaxonomyLoader.
 */
class UsasTaxonomyLoaderTest {

    private static final String VALID_TAXONOMY = """
        A:
          title: General and abstract terms
          description: Terms relating to general and abstract phenomena
          A1:
            title: General
            description: General actions
            A1.1.1:
              title: General actions, making etc.
              description: Making things
            A1.1.2:
              title: Damaging and destroying
              description: Breaking things
        Z:
          title: Names and grammatical words
          description: Closed class words
          Z5:
            title: Grammatical bin
            description: Function words
          Z99:
            title: Unmatched
            description: Unrecognised words
        """;

    private static Path write(Path dir, String content) throws IOException {
        Path path = dir.resolve("usas_mapper.yaml");
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path;
    }

    @Test
    @DisplayName("Nested taxonomy is flattened in document order")
    void loadValidTaxonomy(@TempDir Path tempDir) throws IOException {
        UsasTaxonomyLoader loader = new UsasTaxonomyLoader(write(tempDir, VALID_TAXONOMY));

        assertEquals(List.of("A", "A1", "A1.1.1", "A1.1.2", "Z", "Z5", "Z99"),
            List.copyOf(loader.getTagCodes()));
        assertEquals(Optional.of("title: Grammatical bin description: Function words"),
            loader.getDescription("Z5"));
        assertTrue(loader.contains("A1.1.2"));
        assertFalse(loader.contains("B1"));
        assertEquals(Optional.empty(), loader.getDescription("B1"));
    }

    @Test
    @DisplayName("Tags can be filtered out after loading")
    void loadWithFilter(@TempDir Path tempDir) throws IOException {
        UsasTaxonomyLoader loader = new UsasTaxonomyLoader(write(tempDir, VALID_TAXONOMY), Set.of("Z99", "A"));

        assertFalse(loader.contains("Z99"));
        assertFalse(loader.contains("A"));
        assertTrue(loader.contains("A1"));
        assertEquals(5, loader.getDescriptions().size());
    }

    @Test
    @DisplayName("Loaded descriptions are read-only")
    void readOnly(@TempDir Path tempDir) throws IOException {
        UsasTaxonomyLoader loader = new UsasTaxonomyLoader(write(tempDir, VALID_TAXONOMY));
        assertThrows(UnsupportedOperationException.class, () -> loader.getDescriptions().put("B", "b"));
    }

    @Test
    @DisplayName("Duplicate tag names at different depths are rejected")
    void duplicateTag(@TempDir Path tempDir) throws IOException {
        Path path = write(tempDir, """
            A:
              title: a
              description: a
              A1: {title: a1, description: a1}
            B:
              title: b
              description: b
              A1: {title: b1, description: b1}
            """);
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(path));
        assertTrue(e.getMessage().contains("A1"));
    }

    @Test
    @DisplayName("Title without description is rejected")
    void missingDescription(@TempDir Path tempDir) throws IOException {
        Path path = write(tempDir, "A:\n  title: a\n");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(path));
    }

    @Test
    @DisplayName("Description without title is rejected")
    void missingTitle(@TempDir Path tempDir) throws IOException {
        Path path = write(tempDir, "A:\n  description: a\n");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(path));
    }

    @Test
    @DisplayName("Scalar nodes are rejected")
    void nonObjectNode(@TempDir Path tempDir) throws IOException {
        Path path = write(tempDir, "A: General\n");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(path));
    }

    @Test
    @DisplayName("Empty taxonomy is rejected")
    void emptyTaxonomy(@TempDir Path tempDir) throws IOException {
        Path path = write(tempDir, "");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(path));
        Path emptyMapping = write(tempDir, "{}\n");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(emptyMapping));
    }

    @Test
    @DisplayName("Malformed YAML and non-mapping documents are rejected")
    void malformedYaml(@TempDir Path tempDir) throws IOException {
        Path unclosed = write(tempDir, "A: [General\n");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(unclosed));
        Path list = write(tempDir, "- A\n- B\n");
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(list));
    }

    @Test
    @DisplayName("Missing file and directory paths")
    void badPaths(@TempDir Path tempDir) {
        assertThrows(NoSuchFileException.class,
            () -> new UsasTaxonomyLoader(tempDir.resolve("missing.yaml")));
        assertThrows(IllegalArgumentException.class, () -> new UsasTaxonomyLoader(tempDir));
    }
}
