package im.arun.mdblocks.cli;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.mdblocks.service.PageCreateResult;
import im.arun.mdblocks.service.PageSummary;
import im.arun.mdblocks.service.PageUpdateResult;
import im.arun.mdblocks.service.UpdateMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text rendering of command results.
 */
final class ResultFormatter {
    private static final int MAX_BLOCK_RESULT_LENGTH = 150;
    private static final int MAX_SNIPPET_LENGTH = 200;
    private static final String SNIPPET_OPEN = "$pfts_2lqh>$";
    private static final String SNIPPET_CLOSE = "$<pfts_2lqh$";

    private ResultFormatter() {
    }

    /**
     * Render root blocks as an indented outline, two spaces per level.
     *
     * @param maxDepth deepest level printed (0 = roots only), negative for unlimited
     */
    static String formatBlockTree(List<JsonNode> blocks, int maxDepth) {
        if (blocks == null || blocks.isEmpty()) {
            return "-";
        }
        List<String> lines = new ArrayList<>();
        for (JsonNode block : blocks) {
            appendBlock(lines, block, 0, maxDepth);
        }
        return String.join("\n", lines);
    }

    private static void appendBlock(List<String> lines, JsonNode block, int level, int maxDepth) {
        String content = block.path("content").asText("");
        lines.add("  ".repeat(level) + "- " + content);

        JsonNode children = block.path("children");
        if (children.isArray() && (maxDepth < 0 || level < maxDepth)) {
            for (JsonNode child : children) {
                // Collapsed children come back as ["uuid", "..."] references
                if (child.isObject()) {
                    appendBlock(lines, child, level + 1, maxDepth);
                }
            }
        }
    }

    static String formatPages(List<PageSummary> pages, boolean includeJournals) {
        List<String> lines = new ArrayList<>();
        for (PageSummary page : pages) {
            lines.add(page.isJournal() ? "- " + page.getName() + " [journal]" : "- " + page.getName());
        }
        lines.add("");
        lines.add("Total: " + pages.size() + " pages" + (includeJournals ? "" : " (excluding journal pages)"));
        return String.join("\n", lines);
    }

    static String formatCreate(PageCreateResult result) {
        return "Created page '" + result.getTitle() + "' with " + result.getBlockCount() + " block(s) and "
                + result.getPropertyCount() + " property/ies";
    }

    static String formatUpdate(PageUpdateResult result) {
        List<String> lines = new ArrayList<>();
        lines.add("Updated page '" + result.getPageName() + "'");
        if (result.isCleared()) {
            lines.add("  - Existing content cleared");
        }
        if (result.getBlocksAdded() > 0) {
            String verb = result.getMode() == UpdateMode.REPLACE ? "added" : "appended";
            lines.add("  - " + result.getBlocksAdded() + " block(s) " + verb);
        }
        if (!result.getProperties().isEmpty()) {
            lines.add("  - " + result.getProperties().size() + " property/ies updated");
        }
        lines.add("Mode: " + result.getMode().name().toLowerCase());
        return String.join("\n", lines);
    }

    static String formatSearch(String query, JsonNode result, int limit,
                               boolean includeBlocks, boolean includePages, boolean includeFiles) {
        if (result == null || result.isNull() || result.isEmpty()) {
            return "No search results found for '" + query + "'";
        }

        List<String> lines = new ArrayList<>();
        lines.add("Search results for '" + query + "'");
        lines.add("");

        JsonNode blocks = result.path("blocks");
        if (includeBlocks && blocks.isArray() && blocks.size() > 0) {
            lines.add("Blocks (" + blocks.size() + " found)");
            int index = 0;
            for (JsonNode block : blocks) {
                if (index >= limit) {
                    break;
                }
                index++;
                String content = block.path("block/content").asText("").strip();
                if (!content.isEmpty()) {
                    lines.add(index + ". " + truncate(content, MAX_BLOCK_RESULT_LENGTH));
                }
            }
            lines.add("");
        }

        JsonNode snippets = result.path("pages-content");
        if (includeBlocks && snippets.isArray() && snippets.size() > 0) {
            lines.add("Page snippets (" + snippets.size() + " found)");
            int index = 0;
            for (JsonNode snippet : snippets) {
                if (index >= limit) {
                    break;
                }
                index++;
                String text = snippet.path("block/snippet").asText("").strip()
                        .replace(SNIPPET_OPEN, "")
                        .replace(SNIPPET_CLOSE, "");
                if (!text.isEmpty()) {
                    lines.add(index + ". " + truncate(text, MAX_SNIPPET_LENGTH));
                }
            }
            lines.add("");
        }

        JsonNode pages = result.path("pages");
        if (includePages && pages.isArray() && pages.size() > 0) {
            lines.add("Pages (" + pages.size() + " found)");
            for (JsonNode page : pages) {
                lines.add("- " + page.asText());
            }
            lines.add("");
        }

        JsonNode files = result.path("files");
        if (includeFiles && files.isArray() && files.size() > 0) {
            lines.add("Files (" + files.size() + " found)");
            for (JsonNode file : files) {
                lines.add("- " + file.asText());
            }
            lines.add("");
        }

        if (result.path("has-more?").asBoolean(false)) {
            lines.add("More results available, increase --limit to see them");
        }

        int total = blocks.size() + pages.size() + files.size();
        lines.add("Total results: " + total);
        return String.join("\n", lines);
    }

    private static String truncate(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
