package im.arun.mdblocks.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts a YAML frontmatter block delimited by {@code ---} lines at the very
 * start of a markdown document.
 *
 * <p>Malformed frontmatter never fails the parse: the properties come back
 * empty and the original text is returned untouched, with a warning.
 */
public class FrontmatterExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FrontmatterExtractor.class);
    static final String DELIMITER = "---";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Split a document into frontmatter properties and body text.
     *
     * @param content raw markdown content
     * @return properties (possibly empty) and the remaining body
     */
    public Result extract(String content) {
        if (content == null) {
            return Result.of(new LinkedHashMap<>(), "");
        }
        if (!content.startsWith(DELIMITER)) {
            return Result.of(new LinkedHashMap<>(), content);
        }

        int firstLineEnd = content.indexOf('\n');
        if (firstLineEnd < 0 || !isDelimiter(content.substring(0, firstLineEnd))) {
            return Result.of(new LinkedHashMap<>(), content);
        }

        int yamlStart = firstLineEnd + 1;
        int lineStart = yamlStart;
        while (lineStart <= content.length()) {
            int lineEnd = content.indexOf('\n', lineStart);
            String line = lineEnd < 0 ? content.substring(lineStart) : content.substring(lineStart, lineEnd);

            if (isDelimiter(line)) {
                String yaml = lineStart > yamlStart ? content.substring(yamlStart, lineStart - 1) : "";
                String body = lineEnd < 0 ? "" : content.substring(lineEnd + 1);
                return parseYaml(yaml, body, content);
            }
            if (lineEnd < 0) {
                break;
            }
            lineStart = lineEnd + 1;
        }

        logger.debug("Opening frontmatter delimiter has no closing delimiter, treating as body");
        return Result.of(new LinkedHashMap<>(), content);
    }

    private Result parseYaml(String yaml, String body, String original) {
        if (yaml.isBlank()) {
            return Result.of(new LinkedHashMap<>(), body);
        }

        JsonNode node;
        try {
            compose(yaml);
            node = yamlMapper.readTree(yaml);
        } catch (YAMLException e) {
            return malformed(e.getMessage(), original);
        } catch (JsonProcessingException e) {
            return malformed(e.getOriginalMessage(), original);
        }

        if (node == null || node.isMissingNode() || node.isNull()) {
            return Result.of(new LinkedHashMap<>(), body);
        }
        if (!node.isObject()) {
            String warning = "Frontmatter is not a mapping, ignoring: " + node.getNodeType();
            logger.warn(warning);
            return new Result(new LinkedHashMap<>(), original, warning);
        }

        Map<String, Object> raw = yamlMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
        return Result.of(PropertyValues.toJsonSafe(YamlTimestamps.resolve(raw)), body);
    }

    /**
     * Compose the node graph with SnakeYAML, which rejects aliases to
     * undefined anchors that Jackson's reader lets through.
     */
    private static void compose(String yaml) {
        new Yaml(new SafeConstructor(new LoaderOptions())).compose(new StringReader(yaml));
    }

    private static Result malformed(String detail, String original) {
        String warning = "Failed to parse YAML frontmatter: " + detail;
        logger.warn(warning);
        return new Result(new LinkedHashMap<>(), original, warning);
    }

    private static boolean isDelimiter(String line) {
        return DELIMITER.equals(line.stripTrailing());
    }

    /**
     * Frontmatter extraction outcome. {@code warning} is null unless the
     * frontmatter block was present but unusable.
     */
    @Data
    @AllArgsConstructor
    public static class Result {
        private Map<String, Object> properties;
        private String body;
        private String warning;

        static Result of(Map<String, Object> properties, String body) {
            return new Result(properties, body, null);
        }

        public boolean hasWarning() {
            return warning != null;
        }
    }
}
