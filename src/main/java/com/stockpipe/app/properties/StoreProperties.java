package com.stockpipe.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "store")
public class StoreProperties {
    private String type = "local";
    private String root = "outputs/store";
}
