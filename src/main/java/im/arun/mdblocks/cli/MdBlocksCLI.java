package im.arun.mdblocks.cli;

import im.arun.mdblocks.config.ConfigLoader;
import im.arun.mdblocks.config.MdBlocksConfig;
import im.arun.mdblocks.logseq.LogseqClient;
import im.arun.mdblocks.service.LogseqPageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point. {@code parse} works offline; every other
 * subcommand talks to a running Logseq HTTP API server.
 */
@Command(
    name = "mdblocks",
    description = "Parse markdown into Logseq block trees and manage Logseq pages",
    mixinStandardHelpOptions = true,
    version = "mdblocks 1.0",
    subcommands = {
        ParseCommand.class,
        CreateCommand.class,
        UpdateCommand.class,
        GetCommand.class,
        ListCommand.class,
        DeleteCommand.class,
        SearchCommand.class
    }
)
public class MdBlocksCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MdBlocksCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--api-url"}, description = "Logseq API server URL (or set LOGSEQ_API_URL env var)")
    private String apiUrl;

    @Option(names = {"--api-token"}, description = "Logseq API token (or set LOGSEQ_API_TOKEN env var)")
    private String apiToken;

    private LogseqPageService pageService;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    MdBlocksConfig loadConfig() {
        Map<String, Object> userOptions = new LinkedHashMap<>();
        if (apiUrl != null) {
            userOptions.put("api_url", apiUrl);
        }
        if (apiToken != null) {
            userOptions.put("api_token", apiToken);
        }
        return new ConfigLoader(configPath).load(userOptions);
    }

    LogseqPageService pageService() {
        if (pageService == null) {
            MdBlocksConfig config = loadConfig();
            logger.debug("Using Logseq API at {}", config.getApiUrl());
            pageService = new LogseqPageService(new LogseqClient(config));
        }
        return pageService;
    }

    static String readContent(Path file) throws IOException {
        if (file == null) {
            return "";
        }
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("File not found: " + file);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    static Map<String, Object> toPropertyMap(Map<String, String> properties) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (properties != null) {
            result.putAll(properties);
        }
        return result;
    }

    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new MdBlocksCLI());
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            logger.debug("Command failed", ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            cmd.getErr().flush();
            return CommandLine.ExitCode.SOFTWARE;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
