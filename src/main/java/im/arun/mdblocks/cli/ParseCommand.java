package im.arun.mdblocks.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.mdblocks.model.ParsedDocument;
import im.arun.mdblocks.parser.BlockSerializer;
import im.arun.mdblocks.parser.MarkdownBlockParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parse a markdown file and print its properties and block tree as JSON")
public class ParseCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Markdown file to parse")
    private Path file;

    @Override
    public Integer call() throws Exception {
        ParsedDocument parsed = new MarkdownBlockParser().parse(MdBlocksCLI.readContent(file));

        PrintWriter err = spec.commandLine().getErr();
        for (String warning : parsed.getWarnings()) {
            err.println("Warning: " + warning);
        }
        err.flush();

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("properties", parsed.getProperties());
        output.put("blocks", BlockSerializer.toBatch(parsed.getBlocks()));

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        PrintWriter out = spec.commandLine().getOut();
        out.println(mapper.writeValueAsString(output));
        out.flush();
        return 0;
    }
}
