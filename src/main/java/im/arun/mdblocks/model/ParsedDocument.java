package im.arun.mdblocks.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of parsing one markdown document: frontmatter properties plus the
 * root-level blocks in document order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParsedDocument {

    private Map<String, Object> properties = new LinkedHashMap<>();

    private List<BlockNode> blocks = new ArrayList<>();

    /** Diagnostics such as ignored malformed frontmatter; empty for clean input. */
    private List<String> warnings = new ArrayList<>();

    public static ParsedDocument empty() {
        return new ParsedDocument();
    }

    public boolean isEmpty() {
        return blocks.isEmpty() && properties.isEmpty();
    }
}
