package trader.stablearb.telegram;

import io.github.cdimascio.dotenv.Dotenv;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import trader.stablearb.model.trade.TradeOutcome;
import trader.stablearb.model.trade.TradeRecord;
import trader.stablearb.service.engine.TradeListener;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pushes completed and partially failed attempts to a Telegram chat.
 */
@Slf4j
@Service
public class TelegramNotificationService implements TradeListener {

    private final WebClient telegramWebClient;
    private final Dotenv dotenv;
    private final Counter telegramNotificationsCounter;
    private final Clock clock;

    @Value("${telegram.enabled:false}")
    private boolean telegramEnabled;

    @Value("${telegram.retry.max-attempts:3}")
    private int maxRetryAttempts;

    @Value("${telegram.retry.initial-backoff:1000}")
    private long initialBackoffMillis;

    @Value("${telegram.retry.max-backoff:10000}")
    private long maxBackoffMillis;

    @Value("${telegram.rate-limit.messages-per-minute:20}")
    private int maxMessagesPerMinute;

    private final AtomicInteger messagesSentInCurrentMinute = new AtomicInteger(0);
    private volatile long currentMinuteStartTime;

    public TelegramNotificationService(@Qualifier("telegramWebClient") WebClient telegramWebClient,
                                       Dotenv dotenv,
                                       @Qualifier("telegramNotificationsCounter") Counter telegramNotificationsCounter,
                                       Clock clock) {
        this.telegramWebClient = telegramWebClient;
        this.dotenv = dotenv;
        this.telegramNotificationsCounter = telegramNotificationsCounter;
        this.clock = clock;
        this.currentMinuteStartTime = clock.millis();
    }

    @Override
    public void onTradeClosed(TradeRecord record) {
        if (record.getOutcome() == TradeOutcome.ABORTED) {
            return;
        }
        sendTradeNotification(record).subscribe();
    }

    /**
     * @return Mono<Boolean> telling whether the message was delivered
     */
    public Mono<Boolean> sendTradeNotification(TradeRecord record) {
        if (!telegramEnabled) {
            log.debug("Telegram notifications are disabled");
            return Mono.just(false);
        }
        if (!checkAndUpdateRateLimit()) {
            log.warn("Telegram rate limit reached. Skipping notification for attempt {}", record.getId());
            return Mono.just(false);
        }

        String chatId = dotenv.get("TELEGRAM_CHAT_ID");
        String message = formatMessage(record);

        return telegramWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/sendMessage")
                        .queryParam("chat_id", chatId)
                        .queryParam("text", message)
                        .queryParam("parse_mode", "HTML")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetrySpec())
                .map(response -> {
                    log.info("Telegram notification sent for attempt {}", record.getId());
                    telegramNotificationsCounter.increment();
                    return true;
                })
                .onErrorResume(e -> {
                    log.error("Failed to send Telegram notification: {}", e.getMessage(), e);
                    return Mono.just(false);
                });
    }

    String formatMessage(TradeRecord record) {
        if (record.getOutcome() == TradeOutcome.PARTIAL) {
            return String.format(
                    "<b>PARTIAL FAILURE, trading paused</b>\n\n" +
                            "<b>Attempt</b>: %s\n" +
                            "<b>Sold</b>: %s XRP on %s at %s\n" +
                            "<b>Buy leg</b>: %s on %s after %d submission(s)\n" +
                            "<b>Reason</b>: %s\n" +
                            "Acknowledge via POST /api/engine/reconciliation/ack",
                    record.getId(),
                    record.getSellLeg().getFilledAmount().toPlainString(),
                    record.getSellMarket(),
                    record.getSellLeg().getFilledPrice(),
                    record.getFinalState(),
                    record.getBuyMarket(),
                    record.getBuyLeg().getSubmissions(),
                    record.getFailureReason());
        }
        return String.format(
                "<b>Arbitrage completed</b>\n\n" +
                        "<b>Amount</b>: %s XRP\n" +
                        "<b>Sell</b>: %s at %s\n" +
                        "<b>Buy</b>: %s at %s\n" +
                        "<b>Spread</b>: %s%%\n" +
                        "<b>P&amp;L</b>: %s\n" +
                        "<b>Closed</b>: %s",
                record.getSellLeg().getFilledAmount().toPlainString(),
                record.getSellMarket(),
                record.getSellLeg().getFilledPrice(),
                record.getBuyMarket(),
                record.getBuyLeg().getFilledPrice(),
                record.getExpectedSpreadPercentage(),
                record.getRealizedProfitLoss().toPlainString(),
                record.getClosedAt());
    }

    private boolean checkAndUpdateRateLimit() {
        long now = clock.millis();
        if (now - currentMinuteStartTime >= 60_000) {
            log.debug("Resetting Telegram rate limit counter. Previous count: {}", messagesSentInCurrentMinute.get());
            messagesSentInCurrentMinute.set(0);
            currentMinuteStartTime = now;
        }
        return messagesSentInCurrentMinute.incrementAndGet() <= maxMessagesPerMinute;
    }

    private Retry createRetrySpec() {
        return Retry.backoff(maxRetryAttempts, Duration.ofMillis(initialBackoffMillis))
                .maxBackoff(Duration.ofMillis(maxBackoffMillis))
                .filter(this::shouldRetry)
                .doBeforeRetry(retrySignal ->
                        log.info("Retrying Telegram notification after error. Attempt {}/{}",
                                retrySignal.totalRetries() + 1, maxRetryAttempts));
    }

    // 429, 5xx and connection problems
    private boolean shouldRetry(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) throwable;
            HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
            return status.equals(HttpStatus.TOO_MANY_REQUESTS) || status.is5xxServerError();
        }
        return throwable instanceof IOException;
    }
}
