package com.example.homemic_backend.config;

import com.example.homemic_backend.engine.DummyTranscriber;
import com.example.homemic_backend.engine.Interfaces.Transcriber;
import com.example.homemic_backend.engine.WhisperHttpTranscriber;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(TranscriberProperties.class)
public class TranscriberConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(TranscriberConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    @Bean("whisperWebClient")
    WebClient whisperWebClient(TranscriberProperties props) {
        Duration timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        HttpClient httpClient = HttpClient.create()
                .protocol(HttpProtocol.HTTP11)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeout.toSeconds(), TimeUnit.SECONDS)));

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024));
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }

    @Bean
    Transcriber transcriber(TranscriberProperties props, @Qualifier("whisperWebClient") WebClient whisperWebClient) {
        String provider = props.getProvider() == null ? "whisper" : props.getProvider().toLowerCase(Locale.ROOT);
        LOGGER.info("Transcriber provider={} baseUrl={} model={}", provider, props.getBaseUrl(), props.getModel());
        if ("dummy".equals(provider)) {
            return new DummyTranscriber();
        }
        return new WhisperHttpTranscriber(whisperWebClient, props);
    }
}
