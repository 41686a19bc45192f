package im.arun.mdblocks.parser;

import im.arun.mdblocks.model.BlockNode;
import im.arun.mdblocks.model.ParsedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point of the markdown parser: frontmatter extraction, then block tree
 * construction over the remaining body.
 *
 * <p>Instances are stateless between calls and can be shared across threads;
 * each call builds with a fresh {@link BlockTreeBuilder}.
 */
public class MarkdownBlockParser {
    private static final Logger logger = LoggerFactory.getLogger(MarkdownBlockParser.class);

    private final FrontmatterExtractor frontmatterExtractor;

    public MarkdownBlockParser() {
        this(new FrontmatterExtractor());
    }

    public MarkdownBlockParser(FrontmatterExtractor frontmatterExtractor) {
        this.frontmatterExtractor = frontmatterExtractor;
    }

    /**
     * Parse markdown with optional frontmatter.
     *
     * @param content full markdown content
     * @return frontmatter properties and the block tree
     */
    public ParsedDocument parse(String content) {
        if (content == null || content.isBlank()) {
            return ParsedDocument.empty();
        }

        FrontmatterExtractor.Result frontmatter = frontmatterExtractor.extract(content);
        List<BlockNode> blocks = parseBlocks(frontmatter.getBody());

        List<String> warnings = new ArrayList<>();
        if (frontmatter.hasWarning()) {
            warnings.add(frontmatter.getWarning());
        }

        logger.debug("Parsed document: {} properties, {} root blocks",
            frontmatter.getProperties().size(), blocks.size());
        return new ParsedDocument(frontmatter.getProperties(), blocks, warnings);
    }

    /**
     * Parse markdown that carries no frontmatter into root-level blocks.
     */
    public List<BlockNode> parseBlocks(String body) {
        if (body == null || body.isBlank()) {
            return new ArrayList<>();
        }
        return new BlockTreeBuilder(splitLines(body)).build();
    }

    static List<String> splitLines(String text) {
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
