package im.arun.mdblocks.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A page as read back from Logseq: the page entity, its root blocks with
 * nested {@code children}, and the page properties held by the first block.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageContent {
    private JsonNode page;
    private List<JsonNode> blocks = new ArrayList<>();
    private Map<String, Object> properties = new LinkedHashMap<>();
}
