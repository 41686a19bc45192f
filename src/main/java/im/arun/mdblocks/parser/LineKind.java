package im.arun.mdblocks.parser;

/**
 * Structural category of a single markdown line, in classification priority order.
 */
public enum LineKind {
    BLANK,
    FENCE,
    HEADING,
    HORIZONTAL_RULE,
    BLOCKQUOTE,
    CHECKBOX,
    BULLET,
    NUMBERED,
    MARKER,
    PARAGRAPH;

    /**
     * Checkbox, bullet, numbered and capitalized-marker lines all open a list item.
     */
    public boolean isListLike() {
        return this == CHECKBOX || this == BULLET || this == NUMBERED || this == MARKER;
    }

    /**
     * Lines that close any open list item regardless of their indentation.
     */
    public boolean interruptsList() {
        return this == HEADING || this == FENCE || this == HORIZONTAL_RULE || this == BLOCKQUOTE;
    }

    /**
     * Lines that end a running paragraph. A capitalized marker does not: it
     * only opens a list item at the start of a block.
     */
    public boolean interruptsParagraph() {
        return this != PARAGRAPH && this != MARKER;
    }
}
