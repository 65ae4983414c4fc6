package io.ainavigator.ingestion.config;

import java.util.List;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        int pageTimeout,
        int maxRetries,
        int retryDelay,
        List<String> userAgents
) {
    static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/124.0.0.0 Safari/537.36";

    public HttpConfig {
        connectTimeout = connectTimeout > 0 ? connectTimeout : 10000;
        readTimeout = readTimeout > 0 ? readTimeout : 10000;
        pageTimeout = pageTimeout > 0 ? pageTimeout : 10000;
        maxRetries = maxRetries > 0 ? maxRetries : 3;
        retryDelay = retryDelay > 0 ? retryDelay : 1000;
        userAgents = userAgents == null || userAgents.isEmpty() ? List.of(DEFAULT_USER_AGENT) : List.copyOf(userAgents);
    }

    public static HttpConfig defaults() {
        return new HttpConfig(0, 0, 0, 0, 0, null);
    }
}
