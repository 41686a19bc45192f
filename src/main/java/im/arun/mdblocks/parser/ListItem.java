package im.arun.mdblocks.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A classified list-like line: its kind, the rewritten display content and
 * its indentation depth.
 */
@Data
@AllArgsConstructor
public class ListItem {
    private LineKind kind;
    private String content;
    private int depth;
}
