package im.arun.mdblocks.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageCreateResult {
    private String title;
    private JsonNode page;
    private int blockCount;
    private int propertyCount;
}
