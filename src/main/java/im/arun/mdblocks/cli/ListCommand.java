package im.arun.mdblocks.cli;

import im.arun.mdblocks.service.PageSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", description = "List page names")
public class ListCommand implements Callable<Integer> {

    @ParentCommand
    private MdBlocksCLI parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"--include-journals"}, description = "Include journal pages")
    private boolean includeJournals;

    @Override
    public Integer call() {
        List<PageSummary> pages = parent.pageService().listPages(includeJournals);
        PrintWriter out = spec.commandLine().getOut();
        out.println(ResultFormatter.formatPages(pages, includeJournals));
        out.flush();
        return 0;
    }
}
