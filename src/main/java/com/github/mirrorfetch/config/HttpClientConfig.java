package com.github.mirrorfetch.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final MirrorFetchProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        return buildClient(properties.getTransfer());
    }

    /**
     * Client used for mirror transfers. Timeouts apply per network operation.
     * Retries are decided per attempt by the failure classifier, not by the client.
     */
    public static OkHttpClient buildClient(MirrorFetchProperties.Transfer transfer) {
        log.debug("Building HTTP client (connect={}s, read={}s)",
                transfer.getConnectTimeoutSeconds(), transfer.getReadTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(transfer.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(transfer.getReadTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(transfer.getWriteTimeoutSeconds()))
                .addInterceptor(new MirrorHeadersInterceptor(transfer.getUserAgent()))
                .retryOnConnectionFailure(false)
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    /**
     * Adds identifying headers to every mirror request.
     */
    private static class MirrorHeadersInterceptor implements Interceptor {

        private final String userAgent;

        MirrorHeadersInterceptor(String userAgent) {
            this.userAgent = userAgent;
        }

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            // Identity encoding keeps byte offsets on the wire equal to offsets on disk
            Request request = chain.request().newBuilder()
                    .header("User-Agent", userAgent)
                    .header("Accept", "*/*")
                    .header("Accept-Encoding", "identity")
                    .build();
            return chain.proceed(request);
        }
    }
}
