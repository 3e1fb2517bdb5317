package trader.stablearb.telegram;

import io.github.cdimascio.dotenv.Dotenv;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import trader.stablearb.model.trade.TradeRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static trader.stablearb.model.trade.TradeRecordFixtures.aborted;
import static trader.stablearb.model.trade.TradeRecordFixtures.completed;
import static trader.stablearb.model.trade.TradeRecordFixtures.partial;

@ExtendWith(MockitoExtension.class)
class TelegramNotificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private Dotenv dotenv;

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private Counter notifications;
    private TelegramNotificationService service;

    @BeforeEach
    void setUp() {
        notifications = new SimpleMeterRegistry().counter("telegram.notifications");
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.telegram.org/bottest")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK).body("{\"ok\":true}").build());
                })
                .build();
        service = new TelegramNotificationService(webClient, dotenv, notifications, Clock.fixed(NOW, ZoneId.of("UTC")));
        ReflectionTestUtils.setField(service, "maxRetryAttempts", 0);
        ReflectionTestUtils.setField(service, "maxMessagesPerMinute", 1);
    }

    @Test
    void disabledServiceSendsNothing() {
        StepVerifier.create(service.sendTradeNotification(completed(NOW, "100", "2")))
                .expectNext(false)
                .verifyComplete();

        assertThat(requests).isEmpty();
    }

    @Test
    void sendsToTheConfiguredChatAndHonoursTheRateLimit() {
        // given
        ReflectionTestUtils.setField(service, "telegramEnabled", true);
        when(dotenv.get("TELEGRAM_CHAT_ID")).thenReturn("42");

        // when / then
        StepVerifier.create(service.sendTradeNotification(completed(NOW, "100", "2")))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(service.sendTradeNotification(completed(NOW, "100", "2")))
                .expectNext(false)
                .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().getPath()).endsWith("/sendMessage");
        assertThat(requests.get(0).url().getRawQuery()).contains("chat_id=42");
        assertThat(notifications.count()).isEqualTo(1.0);
    }

    @Test
    void abortedAttemptsAreNotAnnounced() {
        ReflectionTestUtils.setField(service, "telegramEnabled", true);

        service.onTradeClosed(aborted(NOW));

        assertThat(requests).isEmpty();
    }

    @Test
    void partialFailureMessageAsksForReconciliation() {
        TradeRecord record = partial(NOW, "100");

        String message = service.formatMessage(record);

        assertThat(message)
                .contains("PARTIAL FAILURE")
                .contains(record.getId())
                .contains("100 XRP on XRP_USDT")
                .contains("/api/engine/reconciliation/ack");
    }

    @Test
    void completedMessageCarriesProfitAndLoss() {
        String message = service.formatMessage(completed(NOW, "100", "1.898"));

        assertThat(message)
                .contains("Arbitrage completed")
                .contains("<b>Amount</b>: 100 XRP")
                .contains("<b>P&amp;L</b>: 1.898")
                .contains("<b>Spread</b>: 4.0%");
    }
}
