package im.arun.mdblocks.parser;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineClassifierTest {

    @Nested
    class Classify {
        @Test
        void whitespaceOnly_isBlank() {
            assertEquals(LineKind.BLANK, LineClassifier.classify(""));
            assertEquals(LineKind.BLANK, LineClassifier.classify("   \t"));
        }

        @Test
        void fenceWinsOverEverythingElse() {
            assertEquals(LineKind.FENCE, LineClassifier.classify("```java"));
            assertEquals(LineKind.FENCE, LineClassifier.classify("   ```"));
        }

        @Test
        void headings_needHashesAtColumnZeroAndText() {
            assertEquals(LineKind.HEADING, LineClassifier.classify("# Title"));
            assertEquals(LineKind.HEADING, LineClassifier.classify("###### Six"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("####### Seven"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("#hashtag"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify(" # indented"));
        }

        @Test
        void horizontalRules_acceptMixedCharacters() {
            assertEquals(LineKind.HORIZONTAL_RULE, LineClassifier.classify("---"));
            assertEquals(LineKind.HORIZONTAL_RULE, LineClassifier.classify("***"));
            assertEquals(LineKind.HORIZONTAL_RULE, LineClassifier.classify("  ___  "));
            assertEquals(LineKind.HORIZONTAL_RULE, LineClassifier.classify("-*-"));
            assertNotEquals(LineKind.HORIZONTAL_RULE, LineClassifier.classify("--"));
        }

        @Test
        void blockquote() {
            assertEquals(LineKind.BLOCKQUOTE, LineClassifier.classify("> quoted"));
            assertEquals(LineKind.BLOCKQUOTE, LineClassifier.classify("  >nested"));
        }

        @Test
        void checkboxWinsOverBullet() {
            assertEquals(LineKind.CHECKBOX, LineClassifier.classify("- [ ] task"));
            assertEquals(LineKind.CHECKBOX, LineClassifier.classify("* [x] done"));
            assertEquals(LineKind.BULLET, LineClassifier.classify("- [y] not a box"));
        }

        @Test
        void listMarkersNeedWhitespaceAndText() {
            assertEquals(LineKind.BULLET, LineClassifier.classify("+ item"));
            assertEquals(LineKind.NUMBERED, LineClassifier.classify("12. item"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("-item"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("1.item"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("3.14 is pi"));
        }

        @Test
        void capitalizedMarkers_needThreeCharacters() {
            assertEquals(LineKind.MARKER, LineClassifier.classify("DONE finished"));
            assertEquals(LineKind.MARKER, LineClassifier.classify("IN-PROGRESS work"));
            assertEquals(LineKind.MARKER, LineClassifier.classify("STEP1 first"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("CA region"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("Done lowercase"));
            assertEquals(LineKind.PARAGRAPH, LineClassifier.classify("NOTE"));
        }
    }

    @Nested
    class IndentDepth {
        @Test
        void spacesCountOneTabsCountTwo() {
            assertEquals(0, LineClassifier.indentDepth("- a"));
            assertEquals(1, LineClassifier.indentDepth("  - a"));
            assertEquals(1, LineClassifier.indentDepth("\t- a"));
            assertEquals(2, LineClassifier.indentDepth("\t  - a"));
        }

        @Test
        void oddIndentation_floorsToGrid() {
            assertEquals(0, LineClassifier.indentDepth(" - a"));
            assertEquals(1, LineClassifier.indentDepth("   - a"));
        }
    }

    @Nested
    class MatchListItem {
        @Test
        void bulletAndNumberedMarkers_areDropped() {
            assertEquals("item", LineClassifier.matchListItem("- item").getContent());
            assertEquals("first step", LineClassifier.matchListItem("1. first step").getContent());
        }

        @Test
        void checkboxes_becomeTaskMarkers() {
            assertEquals("TODO task", LineClassifier.matchListItem("- [ ] task").getContent());
            assertEquals("DONE task", LineClassifier.matchListItem("- [x] task").getContent());
            assertEquals("DONE task", LineClassifier.matchListItem("- [X] task").getContent());
        }

        @Test
        void redundantStatusPrefix_isStripped() {
            assertEquals("TODO buy milk", LineClassifier.matchListItem("- [ ] TODO: buy milk").getContent());
            assertEquals("DONE ship it", LineClassifier.matchListItem("- [x] DONE: ship it").getContent());
        }

        @Test
        void markerToken_isKept() {
            ListItem item = LineClassifier.matchListItem("  LATER review notes");
            assertEquals(LineKind.MARKER, item.getKind());
            assertEquals("LATER review notes", item.getContent());
            assertEquals(1, item.getDepth());
        }

        @Test
        void plainText_isNotAnItem() {
            assertNull(LineClassifier.matchListItem("just words"));
            assertNull(LineClassifier.matchListItem("- "));
        }
    }

    @Test
    void fenceEnd_allowsOnlyTrailingWhitespace() {
        assertTrue(LineClassifier.isFenceEnd("```"));
        assertTrue(LineClassifier.isFenceEnd("  ```  "));
        assertFalse(LineClassifier.isFenceEnd("```python"));
    }
}
