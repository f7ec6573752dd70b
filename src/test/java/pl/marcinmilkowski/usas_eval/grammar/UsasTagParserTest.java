package pl.marcinmilkowski.usas_eval.grammar;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UsasTagParser.
 */
class UsasTagParserTest {

    @Test
    @DisplayName("Plain code without markers")
    void parsePlainCode() {
        assertEquals(UsasTag.of("A1.1.1"), UsasTagParser.parseTag("A1.1.1"));
        assertEquals(UsasTag.of("Z5"), UsasTagParser.parseTag("Z5"));
    }

    @Test
    @DisplayName("Intensity markers are counted")
    void parseIntensityMarkers() {
        assertEquals(UsasTag.of("X5.2", 2, 0), UsasTagParser.parseTag("X5.2++"));
        assertEquals(UsasTag.of("O4.2", 0, 1), UsasTagParser.parseTag("O4.2-"));
        assertEquals(UsasTag.of("E3", 0, 3), UsasTagParser.parseTag("E3---"));
    }

    @Test
    @DisplayName("Only the first run of plus markers is counted")
    void parseSplitPositiveRuns() {
        UsasTag tag = UsasTagParser.parseTag("A1++m+");
        assertEquals(2, tag.positiveMarkers());
        assertTrue(tag.male());
    }

    @Test
    @DisplayName("Gender, antecedent and rarity markers")
    void parseOtherMarkers() {
        UsasTag tag = UsasTagParser.parseTag("S2mf");
        assertEquals("S2", tag.code());
        assertTrue(tag.male());
        assertTrue(tag.female());
        assertFalse(tag.neuter());

        UsasTag rare = UsasTagParser.parseTag("Z99%@cn");
        assertTrue(rare.rarityMarker1());
        assertTrue(rare.rarityMarker2());
        assertTrue(rare.antecedents());
        assertTrue(rare.neuter());
        assertFalse(rare.idiom());
    }

    @Test
    @DisplayName("PUNCT is accepted as a code")
    void parsePunct() {
        UsasTag tag = UsasTagParser.parseTag("PUNCT");
        assertEquals(UsasTag.PUNCT, tag.code());
        assertTrue(tag.isPunctuation());
    }

    @Test
    @DisplayName("Intensity form re-parses to the same code and counts")
    void intensityFormRoundTrip() {
        for (String text : List.of("A1", "X5.2++", "E3---", "A13.3+-", "Z2")) {
            UsasTag tag = UsasTagParser.parseTag(text);
            UsasTag reparsed = UsasTagParser.parseTag(tag.toIntensityForm());
            assertEquals(tag.code(), reparsed.code());
            assertEquals(tag.positiveMarkers(), reparsed.positiveMarkers());
            assertEquals(tag.negativeMarkers(), reparsed.negativeMarkers());
        }
    }

    @Test
    @DisplayName("Invalid atoms are rejected")
    void parseInvalidTag() {
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseTag("invalid_tag"));
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseTag("123"));
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseTag(""));
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseTag("a1"));
    }

    @Test
    @DisplayName("Blank input gives no tag groups")
    void parseBlankGroups() {
        assertTrue(UsasTagParser.parseTagGroups("").isEmpty());
        assertTrue(UsasTagParser.parseTagGroups(" ").isEmpty());
        assertTrue(UsasTagParser.parseTagGroups("   ").isEmpty());
    }

    @Test
    @DisplayName("Multi tag group keeps tag order")
    void parseMultiTagGroup() {
        List<UsasTagGroup> groups = UsasTagParser.parseTagGroups("Z2/S2mf");
        assertEquals(1, groups.size());
        UsasTagGroup group = groups.get(0);
        assertEquals(List.of("Z2", "S2"), group.codes());
        assertEquals("Z2/S2", group.joinedCodes());
        assertEquals(UsasTag.of("Z2"), group.primary());
        assertTrue(group.tags().get(1).male());
        assertTrue(group.tags().get(1).female());
    }

    @Test
    @DisplayName("Whitespace separates tag groups")
    void parseSeveralGroups() {
        List<UsasTagGroup> groups = UsasTagParser.parseTagGroups("  L1 E3-\tO4.2-   Z2/S2mf ");
        assertEquals(4, groups.size());
        assertEquals("L1", groups.get(0).joinedCodes());
        assertEquals(1, groups.get(1).primary().negativeMarkers());
        assertEquals("O4.2", groups.get(2).joinedCodes());
        assertEquals("Z2/S2", groups.get(3).joinedCodes());
    }

    @Test
    @DisplayName("An invalid tag anywhere fails the whole string")
    void parseGroupsWithInvalidTag() {
        UsasFormatException e = assertThrows(UsasFormatException.class,
            () -> UsasTagParser.parseTagGroups("L1 invalid_tag"));
        assertTrue(e.getMessage().contains("invalid_tag"));
        assertNotNull(e.getCause());
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseTagGroups("Z2/"));
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseTagGroups("Z2//S2"));
    }

    @Test
    @DisplayName("Single tag group requires exactly one group")
    void parseSingleTagGroup() {
        assertEquals("N5.1/A5.4", UsasTagParser.parseSingleTagGroup("N5.1/A5.4").joinedCodes());
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseSingleTagGroup("A1 A2"));
        assertThrows(UsasFormatException.class, () -> UsasTagParser.parseSingleTagGroup(""));
    }

    @Test
    @DisplayName("Tag group detection")
    void isTagGroup() {
        assertTrue(UsasTagParser.isTagGroup("Z5"));
        assertTrue(UsasTagParser.isTagGroup("F2/O4.5"));
        assertFalse(UsasTagParser.isTagGroup("Coffee"));
        assertFalse(UsasTagParser.isTagGroup("18日"));
        assertFalse(UsasTagParser.isTagGroup("."));
    }
}
