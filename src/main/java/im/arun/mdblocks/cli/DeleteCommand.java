package im.arun.mdblocks.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "delete", description = "Delete a page")
public class DeleteCommand implements Callable<Integer> {

    @ParentCommand
    private MdBlocksCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Page name")
    private String pageName;

    @Override
    public Integer call() {
        parent.pageService().deletePage(pageName);
        PrintWriter out = spec.commandLine().getOut();
        out.println("Deleted page '" + pageName + "'");
        out.flush();
        return 0;
    }
}
