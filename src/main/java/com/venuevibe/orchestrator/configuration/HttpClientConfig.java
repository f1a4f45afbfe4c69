package com.venuevibe.orchestrator.configuration;

import com.venuevibe.orchestrator.client.UpstreamHttpClient;
import com.venuevibe.orchestrator.client.WebClientUpstreamHttpClient;
import com.venuevibe.orchestrator.config.HttpProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared outbound {@link WebClient}: Reactor Netty with connect and response timeouts, so a
 * hung upstream surfaces as a transport timeout the retrier can classify.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder, HttpProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
                .responseTimeout(properties.getResponseTimeout())
                .doOnConnected(conn -> conn.addHandlerLast(
                        new ReadTimeoutHandler(properties.getResponseTimeout().toMillis(), TimeUnit.MILLISECONDS)));

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(properties.getMaxInMemorySizeBytes()))
                        .build())
                .filter(loggingFilter())
                .build();
    }

    @Bean
    public UpstreamHttpClient upstreamHttpClient(WebClient upstreamWebClient) {
        return new WebClientUpstreamHttpClient(upstreamWebClient);
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            if (log.isDebugEnabled()) {
                String sanitized = request.url().toString().replaceAll("(?i)(key|apikey)=[^&]+", "$1=***");
                log.debug("Outbound request: {} {}", request.method(), sanitized);
            }
            return Mono.just(request);
        });
    }
}
