package im.arun.mdblocks.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link MdBlocksConfig} from YAML, then applies environment variables
 * and explicit user options on top, in that order.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_RESOURCE = "mdblocks.yaml";
    static final String ENV_API_URL = "LOGSEQ_API_URL";
    static final String ENV_API_TOKEN = "LOGSEQ_API_TOKEN";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final MdBlocksConfig defaultConfig;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.environment = environment;
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private MdBlocksConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return orDefaults(yamlMapper.readValue(path.toFile(), MdBlocksConfig.class));
                }
                logger.warn("Config file {} not found", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CONFIG_RESOURCE);
            if (resourceStream != null) {
                try (InputStream in = resourceStream) {
                    return orDefaults(yamlMapper.readValue(in, MdBlocksConfig.class));
                }
            }

            logger.debug("No {} found, using default configuration", CONFIG_RESOURCE);
            return new MdBlocksConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new MdBlocksConfig();
        }
    }

    public MdBlocksConfig load() {
        return load(null);
    }

    public MdBlocksConfig load(Map<String, Object> userOptions) {
        MdBlocksConfig config = copyConfig(defaultConfig);
        applyEnvironment(config);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            try {
                switch (key) {
                    case "api_url":
                    case "apiUrl":
                        config.setApiUrl(value.toString());
                        break;
                    case "api_token":
                    case "apiToken":
                        config.setApiToken(value.toString());
                        break;
                    case "connect_timeout_seconds":
                    case "connectTimeoutSeconds":
                        config.setConnectTimeoutSeconds(parseInt(value));
                        break;
                    case "read_timeout_seconds":
                    case "readTimeoutSeconds":
                        config.setReadTimeoutSeconds(parseInt(value));
                        break;
                    case "max_retries":
                    case "maxRetries":
                        config.setMaxRetries(parseInt(value));
                        break;
                    case "retry_backoff_millis":
                    case "retryBackoffMillis":
                        config.setRetryBackoffMillis(parseInt(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (NumberFormatException e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private void applyEnvironment(MdBlocksConfig config) {
        String apiUrl = environment.get(ENV_API_URL);
        if (apiUrl != null && !apiUrl.isBlank()) {
            config.setApiUrl(apiUrl);
        }
        String apiToken = environment.get(ENV_API_TOKEN);
        if (apiToken != null && !apiToken.isBlank()) {
            config.setApiToken(apiToken);
        }
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    private MdBlocksConfig orDefaults(MdBlocksConfig loaded) {
        return loaded != null ? loaded : new MdBlocksConfig();
    }

    private MdBlocksConfig copyConfig(MdBlocksConfig source) {
        MdBlocksConfig copy = new MdBlocksConfig();
        copy.setApiUrl(source.getApiUrl());
        copy.setApiToken(source.getApiToken());
        copy.setConnectTimeoutSeconds(source.getConnectTimeoutSeconds());
        copy.setReadTimeoutSeconds(source.getReadTimeoutSeconds());
        copy.setMaxRetries(source.getMaxRetries());
        copy.setRetryBackoffMillis(source.getRetryBackoffMillis());
        return copy;
    }
}
