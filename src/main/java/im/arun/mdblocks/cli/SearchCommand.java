package im.arun.mdblocks.cli;

import com.fasterxml.jackson.databind.JsonNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "search", description = "Search blocks, pages and files")
public class SearchCommand implements Callable<Integer> {

    @ParentCommand
    private MdBlocksCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Search query")
    private String query;

    @Option(names = {"--limit"}, description = "Maximum number of results", defaultValue = "20")
    private int limit;

    @Option(names = {"--no-blocks"}, description = "Leave out block and snippet results")
    private boolean noBlocks;

    @Option(names = {"--no-pages"}, description = "Leave out page name results")
    private boolean noPages;

    @Option(names = {"--files"}, description = "Include file results")
    private boolean files;

    @Override
    public Integer call() {
        JsonNode result = parent.pageService().search(query, limit);
        PrintWriter out = spec.commandLine().getOut();
        out.println(ResultFormatter.formatSearch(query, result, limit, !noBlocks, !noPages, files));
        out.flush();
        return 0;
    }
}
