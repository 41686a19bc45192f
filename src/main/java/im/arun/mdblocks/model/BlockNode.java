package im.arun.mdblocks.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single block of the outline document tree.
 * Every accepted markdown line (or grouped run of lines) becomes one block
 * that can own nested child blocks.
 */
@Data
@NoArgsConstructor
public class BlockNode {

    private String content;

    private List<BlockNode> children = new ArrayList<>();

    private Map<String, Object> properties = new LinkedHashMap<>();

    /**
     * Heading depth (1-6) for headings, indentation depth for list items.
     * Only used while building the tree; never serialized.
     */
    private int level;

    public BlockNode(String content, int level) {
        this.content = content;
        this.level = level;
    }

    public void addChild(BlockNode child) {
        children.add(child);
    }

    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    public boolean hasProperties() {
        return properties != null && !properties.isEmpty();
    }
}
