package com.stockpipe.data.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装 JDK HttpClient 的 GET 调用，统一 User-Agent、超时与非 2xx 状态码的异常转换。
 * 使用建议：调用方根据 HttpStatusException.isRetryable 区分可重试与不可重试失败。
 */
public class HttpClientEx {
    private static final String USER_AGENT = "StockPipe/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        return getText(url, Map.of(), timeoutSeconds);
    }

    public String getText(String url, Map<String, String> headers, int timeoutSeconds)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .GET()
                .header("User-Agent", USER_AGENT);
        if (headers != null) {
            headers.forEach(builder::header);
        }
        HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new HttpStatusException(resp.statusCode(), url);
    }
}
