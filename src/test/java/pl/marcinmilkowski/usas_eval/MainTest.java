package pl.marcinmilkowski.usas_eval;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the command-line entry point.
 */
class MainTest {

    @Test
    @DisplayName("Filter option is split on commas")
    void parseTagList() {
        assertEquals(Set.of("Z99", "F2"), Main.parseTagList("Z99, F2,,"));
        assertTrue(Main.parseTagList(" ").isEmpty());
    }

    @Test
    @DisplayName("Option given as the last argument reports its missing value")
    void missingOptionValue() {
        String[] args = {"parse", "--input", "corpus.txt", "--format"};
        assertEquals("corpus.txt", Main.optionValue(args, 2));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Main.optionValue(args, 4));
        assertEquals("Missing value for option: --format", e.getMessage());
    }

    @Test
    @DisplayName("Parse command writes the dataset JSON")
    void parseCommand(@TempDir Path tempDir) throws Exception {
        Path input = tempDir.resolve("corpus.txt");
        Files.writeString(input, "The_Z5 coffee_F2\n", StandardCharsets.UTF_8);
        Path taxonomy = tempDir.resolve("usas_mapper.yaml");
        Files.writeString(taxonomy, """
            F:
              title: Food and farming
              description: Terms relating to food and farming
              F2:
                title: Drinks
                description: Terms relating to drinks
            Z:
              title: Names and grammatical words
              description: Closed class words
              Z5:
                title: Grammatical bin
                description: Function words
            """, StandardCharsets.UTF_8);
        Path output = tempDir.resolve("dataset.json");

        Main.main(new String[] {
            "parse", "--format", "benedict-english", "--input", input.toString(),
            "--taxonomy", taxonomy.toString(), "--filter", "F2", "--output", output.toString()
        });

        JSONObject json = JSON.parseObject(Files.readString(output, StandardCharsets.UTF_8));
        assertEquals("Benedict English", json.getString("name"));
        assertEquals(List.of("F2"), json.getJSONArray("labels_removed").toJavaList(String.class));
        assertEquals(List.of("Z5", ""),
            json.getJSONArray("texts").getJSONObject(0).getJSONArray("semantic_tags").toJavaList(String.class));
    }

    @Test
    @DisplayName("Failures are reported without writing output")
    void parseCommandFailure(@TempDir Path tempDir) throws Exception {
        Path input = tempDir.resolve("corpus.txt");
        Files.writeString(input, "The history_Z5\n", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("dataset.json");

        Main.main(new String[] {
            "parse", "--format", "benedict-english", "--input", input.toString(), "--output", output.toString()
        });

        assertFalse(Files.exists(output));
    }
}
