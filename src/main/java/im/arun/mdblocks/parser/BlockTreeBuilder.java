package im.arun.mdblocks.parser;

import im.arun.mdblocks.model.BlockNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass builder turning markdown lines into a forest of {@link BlockNode}s.
 *
 * <p>Handles:
 * <ul>
 *   <li>Headings (H1-H6), nested by level through an open-heading stack</li>
 *   <li>Bullet, numbered, checkbox and capitalized-marker items, nested by indentation</li>
 *   <li>Fenced code blocks, kept whole in one block</li>
 *   <li>Runs of blockquote lines, kept whole in one block</li>
 *   <li>Horizontal rules</li>
 *   <li>Paragraphs, with soft line breaks joined by spaces</li>
 * </ul>
 *
 * A builder holds per-document state and is used for one document only.
 */
public class BlockTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(BlockTreeBuilder.class);
    static final String HORIZONTAL_RULE_CONTENT = "---";

    private final List<String> lines;
    private final List<BlockNode> roots = new ArrayList<>();
    private final List<BlockNode> headingStack = new ArrayList<>();
    private boolean built;

    public BlockTreeBuilder(List<String> lines) {
        this.lines = lines;
    }

    /**
     * Scan every line and return the root-level blocks in document order.
     */
    public List<BlockNode> build() {
        if (built) {
            throw new IllegalStateException("BlockTreeBuilder instances build a single document");
        }
        built = true;

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            LineKind kind = LineClassifier.classify(line);

            switch (kind) {
                case BLANK:
                    i++;
                    break;
                case FENCE:
                    i = parseFencedCode(i);
                    break;
                case HEADING:
                    parseHeading(line);
                    i++;
                    break;
                case HORIZONTAL_RULE:
                    attach(new BlockNode(HORIZONTAL_RULE_CONTENT, 0));
                    i++;
                    break;
                case BLOCKQUOTE:
                    i = parseBlockquote(i);
                    break;
                case CHECKBOX:
                case BULLET:
                case NUMBERED:
                case MARKER:
                    ItemResult item = parseListItem(i);
                    attach(item.node);
                    i = item.next;
                    break;
                default:
                    i = parseParagraph(i);
            }
        }

        logger.debug("Built {} root blocks from {} lines", roots.size(), lines.size());
        return roots;
    }

    private void parseHeading(String line) {
        int level = LineClassifier.headingLevel(line);
        BlockNode heading = new BlockNode(line.strip(), level);

        // Close sections of the same or deeper level
        while (!headingStack.isEmpty() && top().getLevel() >= level) {
            headingStack.remove(headingStack.size() - 1);
        }

        if (headingStack.isEmpty()) {
            roots.add(heading);
        } else {
            top().addChild(heading);
        }
        headingStack.add(heading);
    }

    /**
     * Collect the opening fence, the body and the closing fence into one block.
     * An unterminated fence runs to the end of the input.
     *
     * @return index of the line after the closing fence
     */
    private int parseFencedCode(int start) {
        List<String> codeLines = new ArrayList<>();
        codeLines.add(lines.get(start));

        int i = start + 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            codeLines.add(line);
            i++;
            if (LineClassifier.isFenceEnd(line)) {
                break;
            }
        }

        attach(new BlockNode(String.join("\n", codeLines), 0));
        return i;
    }

    /**
     * Contiguous blockquote lines become one block with their {@code >} prefixes
     * kept. A blank or non-quote line ends the run.
     */
    private int parseBlockquote(int start) {
        List<String> quoteLines = new ArrayList<>();
        int i = start;
        while (i < lines.size() && LineClassifier.isBlockquote(lines.get(i))) {
            quoteLines.add(lines.get(i).stripTrailing());
            i++;
        }

        attach(new BlockNode(String.join("\n", quoteLines), 0));
        return i;
    }

    /**
     * Parse a list item and everything indented beneath it. The same descent
     * serves top-level and nested items: deeper list lines recurse, other deeper
     * lines become plain children, and any line at the item's depth or shallower
     * ends the item.
     */
    private ItemResult parseListItem(int start) {
        ListItem item = LineClassifier.matchListItem(lines.get(start));
        int depth = item.getDepth();
        BlockNode node = new BlockNode(item.getContent(), depth);

        int i = start + 1;
        while (i < lines.size()) {
            String line = lines.get(i);
            LineKind kind = LineClassifier.classify(line);

            if (kind == LineKind.BLANK) {
                i++;
                continue;
            }

            int lineDepth = LineClassifier.indentDepth(line);
            if (lineDepth <= depth || kind.interruptsList()) {
                break;
            }

            if (kind.isListLike()) {
                ItemResult child = parseListItem(i);
                node.addChild(child.node);
                i = child.next;
            } else {
                node.addChild(new BlockNode(line.strip(), lineDepth));
                i++;
            }
        }

        return new ItemResult(node, i);
    }

    /**
     * Join consecutive plain lines into one paragraph block.
     */
    private int parseParagraph(int start) {
        List<String> paragraphLines = new ArrayList<>();
        int i = start;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (i > start && LineClassifier.classify(line).interruptsParagraph()) {
                break;
            }
            paragraphLines.add(line.strip());
            i++;
        }

        attach(new BlockNode(String.join(" ", paragraphLines), 0));
        return i;
    }

    /**
     * Content goes under the innermost open heading, or to the roots before the
     * first heading.
     */
    private void attach(BlockNode block) {
        if (headingStack.isEmpty()) {
            roots.add(block);
        } else {
            top().addChild(block);
        }
    }

    private BlockNode top() {
        return headingStack.get(headingStack.size() - 1);
    }

    private static class ItemResult {
        private final BlockNode node;
        private final int next;

        ItemResult(BlockNode node, int next) {
            this.node = node;
            this.next = next;
        }
    }
}
