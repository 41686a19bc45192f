package im.arun.mdblocks.parser;

import im.arun.mdblocks.model.BlockNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockSerializerTest {

    @Test
    void leafBlock_hasOnlyContent() {
        Map<String, Object> record = BlockSerializer.toRecord(new BlockNode("leaf", 0));

        assertEquals(Map.of("content", "leaf"), record);
        assertFalse(record.containsKey("children"));
        assertFalse(record.containsKey("properties"));
    }

    @Test
    void nestedBlocks_serializeDepthFirstInOrder() {
        BlockNode root = new BlockNode("# Root", 1);
        BlockNode first = new BlockNode("first", 0);
        first.addChild(new BlockNode("grandchild", 1));
        root.addChild(first);
        root.addChild(new BlockNode("second", 0));

        List<Map<String, Object>> batch = BlockSerializer.toBatch(List.of(root));

        Map<String, Object> expected = Map.of(
                "content", "# Root",
                "children", List.of(
                        Map.of("content", "first",
                                "children", List.of(Map.of("content", "grandchild"))),
                        Map.of("content", "second")));
        assertEquals(List.of(expected), batch);
    }

    @Test
    void properties_areCopiedWhenPresent() {
        BlockNode block = new BlockNode("with props", 0);
        block.getProperties().put("status", "open");

        Map<String, Object> record = BlockSerializer.toRecord(block);
        assertEquals(Map.of("status", "open"), record.get("properties"));

        block.getProperties().put("later", "ignored");
        assertEquals(1, ((Map<?, ?>) record.get("properties")).size());
    }

    @Test
    void parsedDocument_serializesWithoutLevels() {
        List<Map<String, Object>> batch = BlockSerializer.toBatch(
                new MarkdownBlockParser().parse("## Section\n- item\n").getBlocks());

        assertEquals(List.of(Map.of("content", "## Section",
                "children", List.of(Map.of("content", "item")))), batch);
    }
}
