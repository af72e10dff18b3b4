package com.stockpipe.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "fetch")
public class FetchProperties {
    private int concurrent = 4;
    private int timeoutSec = 30;
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        private int max = 2;
        private long backoffMs = 400L;
    }
}
