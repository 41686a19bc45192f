package im.arun.mdblocks.parser;

/**
 * Stateless line classification for the block tree builder.
 *
 * <p>Each line is tested against the structural patterns in a fixed priority
 * order (see {@link #classify(String)}), so overlapping patterns always resolve
 * the same way. Matching is done with explicit character scans rather than
 * regular expressions.
 */
public final class LineClassifier {

    static final String FENCE = "```";
    static final int MAX_HEADING_LEVEL = 6;
    static final int MIN_HORIZONTAL_RULE_LENGTH = 3;
    static final int MIN_MARKER_LENGTH = 3;
    static final int TAB_WIDTH = 2;
    static final int INDENT_WIDTH = 2;

    private static final String TODO = "TODO";
    private static final String DONE = "DONE";

    private LineClassifier() {}

    /**
     * Classify a line. Priority: blank, fence, heading, horizontal rule,
     * blockquote, checkbox, bullet, numbered, capitalized marker, paragraph.
     */
    public static LineKind classify(String line) {
        if (line.isBlank()) {
            return LineKind.BLANK;
        }
        if (isFenceStart(line)) {
            return LineKind.FENCE;
        }
        if (headingLevel(line) > 0) {
            return LineKind.HEADING;
        }
        if (isHorizontalRule(line)) {
            return LineKind.HORIZONTAL_RULE;
        }
        if (isBlockquote(line)) {
            return LineKind.BLOCKQUOTE;
        }
        ListItem item = matchListItem(line);
        if (item != null) {
            return item.getKind();
        }
        return LineKind.PARAGRAPH;
    }

    /**
     * Indentation depth: leading spaces count one, tabs count two, and the
     * total is floored to a two-column grid.
     */
    public static int indentDepth(String line) {
        int columns = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ' ') {
                columns++;
            } else if (c == '\t') {
                columns += TAB_WIDTH;
            } else {
                break;
            }
        }
        return columns / INDENT_WIDTH;
    }

    public static boolean isFenceStart(String line) {
        return line.startsWith(FENCE, skipWhitespace(line, 0));
    }

    public static boolean isFenceEnd(String line) {
        int start = skipWhitespace(line, 0);
        return line.startsWith(FENCE, start) && line.substring(start + FENCE.length()).isBlank();
    }

    /**
     * Heading level (1-6) for lines starting with {@code #} markers followed by
     * whitespace and text, or 0 when the line is not a heading.
     */
    public static int headingLevel(String line) {
        int level = 0;
        while (level < line.length() && line.charAt(level) == '#') {
            level++;
        }
        if (level == 0 || level > MAX_HEADING_LEVEL) {
            return 0;
        }
        String rest = line.substring(level);
        if (rest.length() < 2 || !Character.isWhitespace(rest.charAt(0))) {
            return 0;
        }
        return level;
    }

    public static boolean isHorizontalRule(String line) {
        int start = skipWhitespace(line, 0);
        int end = start;
        while (end < line.length() && "-*_".indexOf(line.charAt(end)) >= 0) {
            end++;
        }
        return end - start >= MIN_HORIZONTAL_RULE_LENGTH && line.substring(end).isBlank();
    }

    public static boolean isBlockquote(String line) {
        int start = skipWhitespace(line, 0);
        return start < line.length() && line.charAt(start) == '>';
    }

    /**
     * Match a list-like line and rewrite its content. Checkboxes win over plain
     * bullets, and capitalized markers are tried last.
     *
     * @return the matched item, or null when the line is not list-like
     */
    public static ListItem matchListItem(String line) {
        int depth = indentDepth(line);
        String content = matchCheckbox(line);
        if (content != null) {
            return new ListItem(LineKind.CHECKBOX, content, depth);
        }
        content = matchBullet(line);
        if (content != null) {
            return new ListItem(LineKind.BULLET, content, depth);
        }
        content = matchNumbered(line);
        if (content != null) {
            return new ListItem(LineKind.NUMBERED, content, depth);
        }
        content = matchMarker(line);
        if (content != null) {
            return new ListItem(LineKind.MARKER, content, depth);
        }
        return null;
    }

    /**
     * {@code - [ ] text} becomes {@code TODO text}, {@code - [x] text} becomes
     * {@code DONE text}. A redundant {@code TODO:} or {@code DONE:} prefix in the
     * text is dropped.
     */
    static String matchCheckbox(String line) {
        int bullet = skipWhitespace(line, 0);
        if (bullet >= line.length() || !isBulletChar(line.charAt(bullet))) {
            return null;
        }
        int open = skipWhitespace(line, bullet + 1);
        if (open == bullet + 1 || open + 2 >= line.length()) {
            return null;
        }
        char state = line.charAt(open + 1);
        if (line.charAt(open) != '[' || line.charAt(open + 2) != ']' || " xX".indexOf(state) < 0) {
            return null;
        }
        int afterBox = open + 3;
        if (afterBox >= line.length() || !Character.isWhitespace(line.charAt(afterBox))) {
            return null;
        }

        String status = state == ' ' ? TODO : DONE;
        String text = line.substring(afterBox).strip();
        if (text.startsWith(TODO + ":") || text.startsWith(DONE + ":")) {
            text = text.substring(text.indexOf(':') + 1).strip();
        }
        return text.isEmpty() ? status : status + " " + text;
    }

    static String matchBullet(String line) {
        int bullet = skipWhitespace(line, 0);
        if (bullet >= line.length() || !isBulletChar(line.charAt(bullet))) {
            return null;
        }
        return textAfterSeparator(line, bullet + 1);
    }

    static String matchNumbered(String line) {
        int start = skipWhitespace(line, 0);
        int end = start;
        while (end < line.length() && Character.isDigit(line.charAt(end))) {
            end++;
        }
        if (end == start || end >= line.length() || line.charAt(end) != '.') {
            return null;
        }
        return textAfterSeparator(line, end + 1);
    }

    /**
     * Capitalized status markers such as {@code DONE}, {@code IN-PROGRESS} or
     * {@code STEP1}. Two-letter tokens (region codes, abbreviations) never match.
     */
    static String matchMarker(String line) {
        int start = skipWhitespace(line, 0);
        if (start >= line.length() || !isUpperAscii(line.charAt(start))) {
            return null;
        }
        int end = start + 1;
        while (end < line.length() && isMarkerChar(line.charAt(end))) {
            end++;
        }
        if (end - start < MIN_MARKER_LENGTH) {
            return null;
        }
        String text = textAfterSeparator(line, end);
        if (text == null) {
            return null;
        }
        return line.substring(start, end) + " " + text;
    }

    /**
     * Requires at least one whitespace character at {@code from} followed by
     * non-blank text; returns that text.
     */
    private static String textAfterSeparator(String line, int from) {
        if (from >= line.length() || !Character.isWhitespace(line.charAt(from))) {
            return null;
        }
        int textStart = skipWhitespace(line, from);
        if (textStart >= line.length()) {
            return null;
        }
        return line.substring(textStart);
    }

    private static int skipWhitespace(String line, int from) {
        int i = from;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isBulletChar(char c) {
        return c == '-' || c == '*' || c == '+';
    }

    private static boolean isUpperAscii(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isMarkerChar(char c) {
        return isUpperAscii(c) || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }
}
