package trader.stablearb.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;
import trader.stablearb.model.Market;
import trader.stablearb.model.Quote;
import trader.stablearb.service.monitor.PriceFeed;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public MEXC spot ticker endpoint. No credentials are involved.
 */
@Slf4j
@Service
public class MexcTickerClient implements PriceFeed {

    private final WebClient mexcWebClient;
    private final ObjectMapper objectMapper;
    private final Counter apiCallsCounter;
    private final Clock clock;

    @Value("${mexc.api.max-attempts:2}")
    private int maxAttempts;

    @Value("${mexc.api.initial-backoff:200}")
    private long initialBackoffMillis;

    @Value("${mexc.api.max-backoff:1000}")
    private long maxBackoffMillis;

    @Value("${mexc.api.calls-per-minute:120}")
    private int maxCallsPerMinute;

    private final AtomicInteger apiCallsInCurrentMinute = new AtomicInteger(0);
    private volatile long currentMinuteStartTime;

    public MexcTickerClient(@Qualifier("mexcWebClient") WebClient mexcWebClient,
                            ObjectMapper objectMapper,
                            @Qualifier("apiCallsCounter") Counter apiCallsCounter,
                            Clock clock) {
        this.mexcWebClient = mexcWebClient;
        this.objectMapper = objectMapper;
        this.apiCallsCounter = apiCallsCounter;
        this.clock = clock;
        this.currentMinuteStartTime = clock.millis();
    }

    @Override
    public Mono<Quote> getQuote(Market market) {
        checkAndResetRateLimit();
        if (apiCallsInCurrentMinute.incrementAndGet() > maxCallsPerMinute) {
            return Mono.error(new PriceFeedException(
                    "MEXC call budget of " + maxCallsPerMinute + " per minute exhausted"));
        }
        apiCallsCounter.increment();

        return mexcWebClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v3/ticker/24hr")
                        .queryParam("symbol", market.getExchangeSymbol())
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetrySpec(market))
                .map(body -> parseTicker(market, body));
    }

    private void checkAndResetRateLimit() {
        long currentTime = clock.millis();
        if (currentTime - currentMinuteStartTime >= 60_000) {
            log.debug("Resetting MEXC rate limit counter. Previous count: {}", apiCallsInCurrentMinute.get());
            apiCallsInCurrentMinute.set(0);
            currentMinuteStartTime = currentTime;
        }
    }

    Quote parseTicker(Market market, String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            String lastPrice = root.path("lastPrice").asText(null);
            if (lastPrice == null || lastPrice.isBlank()) {
                throw new PriceFeedException("MEXC ticker for " + market + " has no lastPrice");
            }
            BigDecimal price = new BigDecimal(lastPrice);
            if (price.signum() <= 0) {
                throw new PriceFeedException("MEXC ticker for " + market + " reported non-positive price " + price);
            }
            JsonNode volume = root.path("volume");

            return Quote.builder()
                    .market(market)
                    .price(price)
                    .volume(volume.isMissingNode() || volume.isNull() ? null : new BigDecimal(volume.asText("0")))
                    .timestamp(clock.instant())
                    .build();
        } catch (IOException | NumberFormatException e) {
            throw new PriceFeedException("Failed to parse MEXC ticker for " + market, e);
        }
    }

    private RetryBackoffSpec createRetrySpec(Market market) {
        return Retry.backoff(maxAttempts, Duration.ofMillis(initialBackoffMillis))
                .maxBackoff(Duration.ofMillis(maxBackoffMillis))
                .filter(this::shouldRetryOnError)
                .doBeforeRetry(retrySignal ->
                        log.info("Retrying MEXC ticker call for {} after error. Attempt {}/{}",
                                market, retrySignal.totalRetries() + 1, maxAttempts));
    }

    // rate limiting (429) and server errors only
    private boolean shouldRetryOnError(Throwable throwable) {
        if (throwable instanceof WebClientResponseException) {
            int statusCode = ((WebClientResponseException) throwable).getStatusCode().value();
            boolean shouldRetry = statusCode == 429 || (statusCode >= 500 && statusCode < 600);
            if (shouldRetry) {
                log.warn("Received status code {} from MEXC API. Will retry.", statusCode);
            }
            return shouldRetry;
        }
        return false;
    }
}
