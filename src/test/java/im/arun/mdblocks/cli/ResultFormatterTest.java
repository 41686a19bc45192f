package im.arun.mdblocks.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.mdblocks.service.PageSummary;
import im.arun.mdblocks.service.PageUpdateResult;
import im.arun.mdblocks.service.UpdateMode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private List<JsonNode> blocks(String json) throws Exception {
        List<JsonNode> list = new ArrayList<>();
        mapper.readTree(json).forEach(list::add);
        return list;
    }

    @Test
    void emptyPage_rendersSingleDash() {
        assertEquals("-", ResultFormatter.formatBlockTree(List.of(), -1));
    }

    @Test
    void maxDepthZero_showsRootsOnly() throws Exception {
        List<JsonNode> tree = blocks("[{\"content\":\"a\",\"children\":[{\"content\":\"b\"}]},{\"content\":\"c\"}]");
        assertEquals("- a\n- c", ResultFormatter.formatBlockTree(tree, 0));
    }

    @Test
    void uuidReferencesInChildren_areSkipped() throws Exception {
        List<JsonNode> tree = blocks("[{\"content\":\"a\",\"children\":[[\"uuid\",\"abc\"]]}]");
        assertEquals("- a", ResultFormatter.formatBlockTree(tree, -1));
    }

    @Test
    void pages_markJournals() {
        String text = ResultFormatter.formatPages(
                List.of(new PageSummary("Jan 1st, 2024", true), new PageSummary("notes", false)), true);
        assertTrue(text.startsWith("- Jan 1st, 2024 [journal]\n- notes\n"));
        assertTrue(text.endsWith("Total: 2 pages"));
    }

    @Test
    void update_summarizesChanges() {
        PageUpdateResult result = new PageUpdateResult("Notes", UpdateMode.REPLACE);
        result.setCleared(true);
        result.setBlocksAdded(3);

        assertEquals("Updated page 'Notes'\n  - Existing content cleared\n  - 3 block(s) added\nMode: replace",
                ResultFormatter.formatUpdate(result));
    }

    @Test
    void search_cleansSnippetsAndTruncates() throws Exception {
        String longContent = "x".repeat(200);
        JsonNode result = mapper.readTree("{\"blocks\":[{\"block/content\":\"" + longContent + "\"}],"
                + "\"pages-content\":[{\"block/snippet\":\"$pfts_2lqh>$hit$<pfts_2lqh$ here\"}],\"has-more?\":true}");

        String text = ResultFormatter.formatSearch("hit", result, 10, true, true, false);

        assertTrue(text.contains("1. " + "x".repeat(150) + "..."));
        assertTrue(text.contains("1. hit here"));
        assertTrue(text.contains("More results available"));
    }

    @Test
    void search_withoutResults() {
        assertEquals("No search results found for 'q'", ResultFormatter.formatSearch("q", null, 5, true, true, true));
    }
}
