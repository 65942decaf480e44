package com.memeinsight.service.alert;

import com.memeinsight.common.alert.OperatorAlert;
import com.memeinsight.common.alert.OperatorAlertSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Posts operator alerts to a Slack incoming webhook. Fire-and-forget: the send is
 * subscribed in the background and a failed delivery is only logged.
 *
 * <p>When disabled, or with no webhook URL configured, the alert is logged at ERROR and
 * nothing is sent.
 */
public class SlackOperatorAlertSink implements OperatorAlertSink {

    private static final Logger log = LoggerFactory.getLogger(SlackOperatorAlertSink.class);

    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

    private final WebClient webClient;
    private final boolean enabled;
    private final String webhookUrl;

    public SlackOperatorAlertSink(WebClient webClient, boolean enabled, String webhookUrl) {
        this.webClient  = webClient;
        this.enabled    = enabled;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public void raise(OperatorAlert alert) {
        log.error("OPERATOR_ALERT source={} reason={} traceId={}", alert.source(), alert.reason(), alert.traceId());
        if (!enabled || webhookUrl == null || webhookUrl.isBlank()) {
            log.debug("Slack delivery disabled; alert logged only. source={}", alert.source());
            return;
        }
        send(alert).subscribe();
    }

    Mono<Void> send(OperatorAlert alert) {
        return webClient.post()
            .uri(webhookUrl)
            .bodyValue(Map.of("text", format(alert)))
            .retrieve()
            .toBodilessEntity()
            .timeout(SEND_TIMEOUT)
            .doOnSuccess(r -> log.info("Slack alert delivered. source={} status={}",
                alert.source(), r.getStatusCode()))
            .onErrorResume(e -> {
                log.warn("Slack alert delivery failed. source={} reason={}", alert.source(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    static String format(OperatorAlert alert) {
        return ":rotating_light: *Upstream source suspended*\n"
            + "*Source:* " + alert.source() + "\n"
            + "*Reason:* " + alert.reason() + "\n"
            + "*Raised:* " + alert.raisedAt() + "\n"
            + "*Trace:* `" + alert.traceId() + "`\n"
            + "Polling of this source stays paused until it is resumed via "
            + "`POST /api/v1/insight/sources/" + alert.source() + "/resume`.";
    }
}
