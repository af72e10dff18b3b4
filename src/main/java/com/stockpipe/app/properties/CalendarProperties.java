package com.stockpipe.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {
    private String baseUrl = "https://api.jquants.com/v1";
    private String idToken = "";
    private int lookaroundDays = 10;
    private int requestTimeoutSec = 20;
    private boolean skipCheck = false;
}
