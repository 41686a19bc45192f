package im.arun.mdblocks.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.mdblocks.logseq.LogseqClient;
import im.arun.mdblocks.model.BlockNode;
import im.arun.mdblocks.model.ParsedDocument;
import im.arun.mdblocks.parser.BlockSerializer;
import im.arun.mdblocks.parser.MarkdownBlockParser;
import im.arun.mdblocks.parser.PropertyValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Imports parsed markdown into Logseq pages.
 *
 * <p>Logseq keeps page properties on the first block of a page, so properties
 * are always written after the blocks are in place.
 */
public class LogseqPageService {
    private static final Logger logger = LoggerFactory.getLogger(LogseqPageService.class);
    private static final Set<String> LIST_PROPERTIES = Set.of("tags", "alias", "aliases");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<LinkedHashMap<String, Object>>() {};

    private final LogseqClient client;
    private final MarkdownBlockParser parser;
    private final ObjectMapper objectMapper;

    public LogseqPageService(LogseqClient client) {
        this(client, new MarkdownBlockParser());
    }

    public LogseqPageService(LogseqClient client, MarkdownBlockParser parser) {
        this.client = client;
        this.parser = parser;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Create a page from markdown. Frontmatter properties are merged with
     * {@code explicitProperties}, the explicit ones winning on conflicts.
     */
    public PageCreateResult createPage(String title, String content, Map<String, Object> explicitProperties) {
        requireName(title, "Page title");
        ParsedDocument parsed = parser.parse(content);
        List<BlockNode> blocks = parsed.getBlocks();
        Map<String, Object> properties = mergeProperties(parsed.getProperties(), explicitProperties);
        logWarnings(title, parsed);

        logger.info("Creating page '{}' with {} blocks", title, blocks.size());
        JsonNode page = client.createPage(title, new LinkedHashMap<>(), true);

        if (!blocks.isEmpty()) {
            List<JsonNode> pageBlocks = client.getPageBlocksTree(title);
            String placeholderUuid = pageBlocks.isEmpty() ? null : uuidOf(pageBlocks.get(0));
            if (placeholderUuid != null) {
                client.insertBatchBlock(placeholderUuid, BlockSerializer.toBatch(blocks), true);
                client.removeBlock(placeholderUuid);
            } else {
                logger.warn("Page '{}' has no first block, appending blocks one by one", title);
                for (BlockNode block : blocks) {
                    appendBlock(title, block);
                }
            }
        }

        if (!properties.isEmpty()) {
            writeProperties(title, properties);
        }

        logger.info("Created page '{}'", title);
        return new PageCreateResult(title, page, blocks.size(), properties.size());
    }

    /**
     * Add markdown content and/or properties to an existing page.
     *
     * @throws IllegalArgumentException when neither content nor properties are
     *                                  given, or the page does not exist
     */
    public PageUpdateResult updatePage(String pageName, String content, Map<String, Object> explicitProperties,
                                       UpdateMode mode) {
        requireName(pageName, "Page name");
        boolean hasContent = content != null && !content.isEmpty();
        boolean hasProperties = explicitProperties != null && !explicitProperties.isEmpty();
        if (!hasContent && !hasProperties) {
            throw new IllegalArgumentException("Either content or properties must be provided for update");
        }
        requireExistingPage(pageName);

        UpdateMode effectiveMode = mode != null ? mode : UpdateMode.APPEND;
        ParsedDocument parsed = hasContent ? parser.parse(content) : ParsedDocument.empty();
        List<BlockNode> blocks = parsed.getBlocks();
        Map<String, Object> properties = mergeProperties(parsed.getProperties(), explicitProperties);
        logWarnings(pageName, parsed);

        logger.info("Updating page '{}' with {} blocks (mode={})", pageName, blocks.size(), effectiveMode);
        PageUpdateResult result = new PageUpdateResult(pageName, effectiveMode);

        if (effectiveMode == UpdateMode.REPLACE) {
            clearPageContent(pageName);
            result.setCleared(true);
            if (!blocks.isEmpty()) {
                replaceBlocks(pageName, blocks);
            }
        } else if (!blocks.isEmpty()) {
            appendBlocks(pageName, blocks);
        }
        result.setBlocksAdded(blocks.size());

        if (!properties.isEmpty()) {
            Map<String, Object> toWrite = properties;
            if (effectiveMode == UpdateMode.APPEND) {
                toWrite = new LinkedHashMap<>(firstBlockProperties(client.getPageBlocksTree(pageName)));
                toWrite.putAll(properties);
            }
            writeProperties(pageName, toWrite);
            result.setProperties(toWrite);
        }

        return result;
    }

    /**
     * @return the page with its block tree, or null when no such page exists
     */
    public PageContent getPageContent(String pageName) {
        requireName(pageName, "Page name");
        JsonNode page = client.getPage(pageName);
        if (page == null) {
            logger.debug("Page '{}' not found", pageName);
            return null;
        }
        List<JsonNode> blocks = client.getPageBlocksTree(pageName);
        return new PageContent(page, blocks, firstBlockProperties(blocks));
    }

    /**
     * List page names in alphabetical order (case-insensitive).
     */
    public List<PageSummary> listPages(boolean includeJournals) {
        List<PageSummary> pages = new ArrayList<>();
        for (JsonNode page : client.getAllPages()) {
            String name = pageName(page);
            if (name == null) {
                continue;
            }
            boolean journal = page.path("journal?").asBoolean(false);
            if (journal && !includeJournals) {
                continue;
            }
            pages.add(new PageSummary(name, journal));
        }
        pages.sort(Comparator.comparing(PageSummary::getName, String.CASE_INSENSITIVE_ORDER));
        logger.debug("Listed {} pages (includeJournals={})", pages.size(), includeJournals);
        return pages;
    }

    public void deletePage(String pageName) {
        requireName(pageName, "Page name");
        requireExistingPage(pageName);
        client.deletePage(pageName);
        logger.info("Deleted page '{}'", pageName);
    }

    /**
     * Remove every root block of a page; children go with their parents.
     */
    public void clearPageContent(String pageName) {
        List<JsonNode> blocks = client.getPageBlocksTree(pageName);
        int removed = 0;
        for (JsonNode block : blocks) {
            String uuid = uuidOf(block);
            if (uuid != null) {
                client.removeBlock(uuid);
                removed++;
            }
        }
        logger.debug("Cleared {} blocks from page '{}'", removed, pageName);
    }

    /**
     * @return the raw search result, or null when Logseq found nothing
     */
    public JsonNode search(String query, int limit) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Search query must not be empty");
        }
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("limit", limit);
        JsonNode result = client.search(query, options);
        return result == null || result.isNull() ? null : result;
    }

    // =========================================================================
    // Block placement
    // =========================================================================

    private void replaceBlocks(String pageName, List<BlockNode> blocks) {
        BlockNode first = blocks.get(0);
        JsonNode anchor = client.appendBlockInPage(pageName, first.getContent(), propertiesOf(first));
        String anchorUuid = uuidOf(anchor);
        if (anchorUuid == null) {
            logger.warn("No anchor block returned for page '{}', only the first block was written", pageName);
            return;
        }
        if (first.hasChildren()) {
            client.insertBatchBlock(anchorUuid, BlockSerializer.toBatch(first.getChildren()), false);
        }
        if (blocks.size() > 1) {
            client.insertBatchBlock(anchorUuid, BlockSerializer.toBatch(blocks.subList(1, blocks.size())), true);
        }
    }

    private void appendBlocks(String pageName, List<BlockNode> blocks) {
        List<JsonNode> pageBlocks = client.getPageBlocksTree(pageName);
        String lastUuid = pageBlocks.isEmpty() ? null : uuidOf(pageBlocks.get(pageBlocks.size() - 1));
        if (lastUuid != null) {
            client.insertBatchBlock(lastUuid, BlockSerializer.toBatch(blocks), true);
            return;
        }
        for (BlockNode block : blocks) {
            appendBlock(pageName, block);
        }
    }

    private void appendBlock(String pageName, BlockNode block) {
        JsonNode appended = client.appendBlockInPage(pageName, block.getContent(), propertiesOf(block));
        if (!block.hasChildren()) {
            return;
        }
        String uuid = uuidOf(appended);
        if (uuid != null) {
            client.insertBatchBlock(uuid, BlockSerializer.toBatch(block.getChildren()), false);
        } else {
            logger.warn("Appended block has no uuid, adding its {} children at page level", block.getChildren().size());
            for (BlockNode child : block.getChildren()) {
                appendBlock(pageName, child);
            }
        }
    }

    // =========================================================================
    // Properties
    // =========================================================================

    private void writeProperties(String pageName, Map<String, Object> properties) {
        List<JsonNode> pageBlocks = client.getPageBlocksTree(pageName);
        String firstUuid = pageBlocks.isEmpty() ? null : uuidOf(pageBlocks.get(0));
        if (firstUuid == null) {
            logger.warn("Page '{}' has no blocks, cannot set properties", pageName);
            return;
        }
        properties.forEach((key, value) -> client.upsertBlockProperty(firstUuid, key, normalizePropertyValue(key, value)));
        logger.info("Updated {} properties on page '{}'", properties.size(), pageName);
    }

    /**
     * {@code tags}, {@code alias} and {@code aliases} given as a map become the
     * list of keys whose values are truthy; other values pass through JSON-safe.
     */
    static Object normalizePropertyValue(String key, Object value) {
        if (LIST_PROPERTIES.contains(key) && value instanceof Map) {
            List<String> keys = new ArrayList<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (isTruthy(entry.getValue())) {
                    keys.add(String.valueOf(entry.getKey()));
                }
            }
            return keys;
        }
        return PropertyValues.toJsonSafe(value);
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    private Map<String, Object> mergeProperties(Map<String, Object> fromFrontmatter, Map<String, Object> explicit) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (fromFrontmatter != null) {
            merged.putAll(fromFrontmatter);
        }
        if (explicit != null) {
            merged.putAll(PropertyValues.toJsonSafe(explicit));
        }
        return merged;
    }

    private Map<String, Object> firstBlockProperties(List<JsonNode> blocks) {
        if (blocks.isEmpty()) {
            return new LinkedHashMap<>();
        }
        JsonNode properties = blocks.get(0).get("properties");
        if (properties == null || !properties.isObject()) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(properties, MAP_TYPE);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void requireExistingPage(String pageName) {
        if (client.getPage(pageName) == null) {
            throw new IllegalArgumentException("Page '" + pageName + "' does not exist");
        }
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
    }

    private void logWarnings(String pageName, ParsedDocument parsed) {
        for (String warning : parsed.getWarnings()) {
            logger.warn("Page '{}': {}", pageName, warning);
        }
    }

    private static String pageName(JsonNode page) {
        String original = page.path("originalName").asText(null);
        if (original != null && !original.isEmpty()) {
            return original;
        }
        String name = page.path("name").asText(null);
        return name == null || name.isEmpty() ? null : name;
    }

    private static String uuidOf(JsonNode block) {
        if (block == null || block.isNull()) {
            return null;
        }
        String uuid = block.path("uuid").asText(null);
        return uuid == null || uuid.isEmpty() ? null : uuid;
    }

    private static Map<String, Object> propertiesOf(BlockNode block) {
        return block.hasProperties() ? new LinkedHashMap<>(block.getProperties()) : null;
    }
}
