package com.memeinsight.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memeinsight.common.alert.OperatorAlertSink;
import com.memeinsight.marketdata.client.AlphaVantageBarClient;
import com.memeinsight.marketdata.client.RedditPostClient;
import com.memeinsight.marketdata.client.ShortAvailabilityWebClient;
import com.memeinsight.service.alert.SlackOperatorAlertSink;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClients for the three upstream collaborators and the Slack alert webhook.
 * Base URLs and credentials come from {@code upstream.*} and {@code notification.slack.*}.
 */
@Configuration
public class UpstreamClientConfig {

    private static final Logger log = LoggerFactory.getLogger(UpstreamClientConfig.class);

    @Value("${upstream.reddit.base-url:https://oauth.reddit.com}")
    private String redditBaseUrl;

    @Value("${upstream.reddit.bearer-token:}")
    private String redditBearerToken;

    @Value("${upstream.reddit.user-agent:meme-insight/0.1}")
    private String redditUserAgent;

    @Value("${upstream.alpha-vantage.base-url:https://www.alphavantage.co}")
    private String alphaVantageBaseUrl;

    @Value("${upstream.alpha-vantage.api-key:}")
    private String alphaVantageApiKey;

    @Value("${upstream.short-availability.base-url:http://localhost:8090}")
    private String shortAvailabilityBaseUrl;

    @Value("${upstream.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${upstream.read-timeout-seconds:15}")
    private int readTimeoutSeconds;

    @Value("${notification.slack.enabled:false}")
    private boolean slackEnabled;

    @Value("${notification.slack.webhook-url:}")
    private String slackWebhookUrl;

    @Bean
    public WebClient redditWebClient(WebClient.Builder builder) {
        return upstream(builder, redditBaseUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, redditUserAgent)
            .build();
    }

    @Bean
    public WebClient alphaVantageWebClient(WebClient.Builder builder) {
        return upstream(builder, alphaVantageBaseUrl).build();
    }

    @Bean
    public WebClient shortAvailabilityWebClient(WebClient.Builder builder) {
        return upstream(builder, shortAvailabilityBaseUrl).build();
    }

    @Bean
    public RedditPostClient redditPostClient(WebClient redditWebClient, ObjectMapper objectMapper) {
        return new RedditPostClient(redditWebClient, objectMapper, redditBearerToken);
    }

    @Bean
    public AlphaVantageBarClient alphaVantageBarClient(WebClient alphaVantageWebClient) {
        return new AlphaVantageBarClient(alphaVantageWebClient, alphaVantageApiKey);
    }

    @Bean
    public ShortAvailabilityWebClient shortAvailabilityClient(WebClient shortAvailabilityWebClient) {
        return new ShortAvailabilityWebClient(shortAvailabilityWebClient);
    }

    @Bean
    public OperatorAlertSink operatorAlertSink(WebClient.Builder builder) {
        return new SlackOperatorAlertSink(builder.build(), slackEnabled, slackWebhookUrl);
    }

    // Builder is a prototype bean; each call gets its own copy.
    private WebClient.Builder upstream(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter());
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("apikey=[^&]+", "apikey=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
