package im.arun.mdblocks.cli;

import im.arun.mdblocks.service.PageUpdateResult;
import im.arun.mdblocks.service.UpdateMode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "update", description = "Append to or replace the content of an existing page")
public class UpdateCommand implements Callable<Integer> {

    @ParentCommand
    private MdBlocksCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Name of the page to update")
    private String pageName;

    @Option(names = {"--file"}, description = "Markdown file with the new content")
    private Path file;

    @Option(names = {"--mode"}, description = "append or replace", defaultValue = "append")
    private String mode;

    @Option(names = {"--property"}, description = "Page property as key=value")
    private Map<String, String> properties;

    @Override
    public Integer call() throws Exception {
        UpdateMode updateMode = UpdateMode.fromString(mode);
        String content = MdBlocksCLI.readContent(file);
        PageUpdateResult result = parent.pageService()
                .updatePage(pageName, content, MdBlocksCLI.toPropertyMap(properties), updateMode);

        PrintWriter out = spec.commandLine().getOut();
        out.println(ResultFormatter.formatUpdate(result));
        out.flush();
        return 0;
    }
}
