package im.arun.mdblocks.config;

import lombok.Data;

@Data
public class MdBlocksConfig {
    private String apiUrl = "http://127.0.0.1:12315";
    private String apiToken;
    private int connectTimeoutSeconds = 3;
    private int readTimeoutSeconds = 6;
    private int maxRetries = 2;
    private long retryBackoffMillis = 500;

    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }
}
