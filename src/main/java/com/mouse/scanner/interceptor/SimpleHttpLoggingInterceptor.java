package com.mouse.scanner.interceptor;

import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Logs every outgoing call with its timing. Bot tokens in the path and credential query parameters are
 * masked before they reach the log.
 */
@Slf4j
public class SimpleHttpLoggingInterceptor implements Interceptor {

    private static final Pattern BOT_TOKEN = Pattern.compile("/bot[^/]+/");
    private static final Pattern SECRET_PARAM = Pattern.compile("((?:key|api_key|token|password)=)[^&]*",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        String url = redact(request.url().toString());

        log.debug("→ {} {}", request.method(), url);
        long startNs = System.nanoTime();

        Response response;
        try {
            response = chain.proceed(request);
        } catch (IOException e) {
            long failedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
            log.warn("← FAILED {} {} after {}ms: {}", request.method(), url, failedMs, e.getMessage());
            throw e;
        }

        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        ResponseBody body = response.body();
        long contentLength = body != null ? body.contentLength() : -1;

        if (response.isSuccessful()) {
            log.debug("← {} {} | {}ms | {} bytes", response.code(), url, tookMs, contentLength);
        } else {
            log.warn("← {} {} | {}ms", response.code(), url, tookMs);
        }
        return response;
    }

    static String redact(String url) {
        String masked = BOT_TOKEN.matcher(url).replaceAll("/bot***/");
        return SECRET_PARAM.matcher(masked).replaceAll("$1***");
    }
}
