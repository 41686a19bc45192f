package im.arun.mdblocks.service;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of what {@link LogseqPageService#updatePage} changed.
 */
@Data
@NoArgsConstructor
public class PageUpdateResult {
    private String pageName;
    private UpdateMode mode;
    private boolean cleared;
    private int blocksAdded;
    /** Properties written to the first block; empty when none were set. */
    private Map<String, Object> properties = new LinkedHashMap<>();

    public PageUpdateResult(String pageName, UpdateMode mode) {
        this.pageName = pageName;
        this.mode = mode;
    }
}
