package im.arun.mdblocks.cli;

import im.arun.mdblocks.service.PageCreateResult;
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

@Command(name = "create", description = "Create a page from a markdown file")
public class CreateCommand implements Callable<Integer> {

    @ParentCommand
    private MdBlocksCLI parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Page title")
    private String title;

    @Option(names = {"--file"}, description = "Markdown file with the page content")
    private Path file;

    @Option(names = {"--property"}, description = "Page property as key=value, overrides frontmatter")
    private Map<String, String> properties;

    @Override
    public Integer call() throws Exception {
        String content = MdBlocksCLI.readContent(file);
        PageCreateResult result = parent.pageService()
                .createPage(title, content, MdBlocksCLI.toPropertyMap(properties));

        PrintWriter out = spec.commandLine().getOut();
        out.println(ResultFormatter.formatCreate(result));
        out.flush();
        return 0;
    }
}
