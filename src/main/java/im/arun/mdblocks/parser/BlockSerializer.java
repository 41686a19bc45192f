package im.arun.mdblocks.parser;

import im.arun.mdblocks.model.BlockNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts block trees into the batch-insert record shape of the Logseq API:
 * {@code {content, children?, properties?}}. Empty children and properties are
 * left out instead of being sent as empty containers.
 */
public final class BlockSerializer {

    public static final String CONTENT = "content";
    public static final String CHILDREN = "children";
    public static final String PROPERTIES = "properties";

    private BlockSerializer() {}

    public static List<Map<String, Object>> toBatch(List<BlockNode> blocks) {
        List<Map<String, Object>> records = new ArrayList<>(blocks.size());
        for (BlockNode block : blocks) {
            records.add(toRecord(block));
        }
        return records;
    }

    public static Map<String, Object> toRecord(BlockNode block) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(CONTENT, block.getContent());
        if (block.hasChildren()) {
            record.put(CHILDREN, toBatch(block.getChildren()));
        }
        if (block.hasProperties()) {
            record.put(PROPERTIES, new LinkedHashMap<>(block.getProperties()));
        }
        return record;
    }
}
