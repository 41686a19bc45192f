package im.arun.mdblocks.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.mdblocks.service.PageContent;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "get", description = "Print a page's block tree")
public class GetCommand implements Callable<Integer> {

    @ParentCommand
    private MdBlocksCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Page name")
    private String pageName;

    @Option(names = {"--format"}, description = "text or json", defaultValue = "text")
    private String format;

    @Option(names = {"--max-depth"}, description = "Deepest level to print, -1 for all", defaultValue = "-1")
    private int maxDepth;

    @Override
    public Integer call() throws Exception {
        String normalizedFormat = format.toLowerCase(Locale.ROOT);
        if (!"text".equals(normalizedFormat) && !"json".equals(normalizedFormat)) {
            throw new IllegalArgumentException("Unknown format '" + format + "', expected text or json");
        }

        PageContent content = parent.pageService().getPageContent(pageName);
        if (content == null) {
            throw new IllegalArgumentException("Page '" + pageName + "' not found");
        }

        PrintWriter out = spec.commandLine().getOut();
        if ("json".equals(normalizedFormat)) {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("page", content.getPage());
            output.put("properties", content.getProperties());
            output.put("blocks", content.getBlocks());
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(output));
        } else {
            out.println(ResultFormatter.formatBlockTree(content.getBlocks(), maxDepth));
        }
        out.flush();
        return 0;
    }
}
