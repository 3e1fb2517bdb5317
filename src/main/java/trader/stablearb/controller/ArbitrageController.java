package trader.stablearb.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import trader.stablearb.model.Market;
import trader.stablearb.model.Quote;
import trader.stablearb.service.engine.ArbitrageEngine;
import trader.stablearb.service.ledger.BalanceLedger;
import trader.stablearb.service.monitor.PriceMonitor;
import trader.stablearb.service.statistics.TradeStatisticsService;
import trader.stablearb.service.store.TradeStore;

import java.util.EnumMap;
import java.util.Map;
import java.util.NoSuchElementException;

@Configuration
@RequiredArgsConstructor
public class ArbitrageController {
    private static final int DEFAULT_RECENT_LIMIT = 20;
    private static final int MAX_RECENT_LIMIT = 500;

    private final PriceMonitor priceMonitor;
    private final BalanceLedger ledger;
    private final TradeStore tradeStore;
    private final TradeStatisticsService statisticsService;
    private final ArbitrageEngine engine;

    @Bean
    public RouterFunction<ServerResponse> arbitrageRoutes() {
        return RouterFunctions.route()
                .path("/api", this::buildApiRoutes)
                .build();
    }

    private RouterFunction<ServerResponse> buildApiRoutes() {
        return RouterFunctions.route()
                .GET("/spread", this::handleSpread)
                .GET("/quotes", this::handleQuotes)
                .GET("/quotes/history", this::handleQuoteHistory)
                .GET("/balances", request -> ServerResponse.ok().bodyValue(ledger.snapshot()))
                .GET("/trades/recent", this::handleRecentTrades)
                .GET("/stats", this::handleStats)
                .GET("/engine/status", request -> ServerResponse.ok().bodyValue(engine.status()))
                .POST("/engine/start", this::handleStart)
                .POST("/engine/stop", this::handleStop)
                .POST("/engine/reconciliation/ack", this::handleAcknowledge)
                .build();
    }

    private Mono<ServerResponse> handleSpread(ServerRequest request) {
        return Mono.justOrEmpty(priceMonitor.latestSpread())
                .flatMap(snapshot -> ServerResponse.ok().bodyValue(snapshot))
                .switchIfEmpty(ServerResponse.noContent().build());
    }

    private Mono<ServerResponse> handleQuotes(ServerRequest request) {
        Map<Market, Quote> quotes = new EnumMap<>(Market.class);
        for (Market market : Market.values()) {
            priceMonitor.latestQuote(market).ifPresent(quote -> quotes.put(market, quote));
        }
        return ServerResponse.ok().bodyValue(quotes);
    }

    private Mono<ServerResponse> handleQuoteHistory(ServerRequest request) {
        Market market;
        try {
            market = Market.valueOf(request.queryParam("market").orElseThrow());
        } catch (IllegalArgumentException | NoSuchElementException e) {
            return ServerResponse.badRequest().bodyValue(Map.of("error", "market must be one of XRP_USDT, XRP_USDC"));
        }
        return ServerResponse.ok().bodyValue(priceMonitor.history(market));
    }

    private Mono<ServerResponse> handleRecentTrades(ServerRequest request) {
        int limit;
        try {
            limit = request.queryParam("limit").map(Integer::parseInt).orElse(DEFAULT_RECENT_LIMIT);
        } catch (NumberFormatException e) {
            return ServerResponse.badRequest().bodyValue(Map.of("error", "limit must be a number"));
        }
        if (limit < 1 || limit > MAX_RECENT_LIMIT) {
            return ServerResponse.badRequest().bodyValue(Map.of("error", "limit must be between 1 and " + MAX_RECENT_LIMIT));
        }
        return Mono.fromCallable(() -> tradeStore.recent(limit))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(records -> ServerResponse.ok().bodyValue(records));
    }

    private Mono<ServerResponse> handleStats(ServerRequest request) {
        return Mono.fromCallable(statisticsService::statistics)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(stats -> ServerResponse.ok().bodyValue(stats));
    }

    private Mono<ServerResponse> handleStart(ServerRequest request) {
        return Mono.fromRunnable(engine::start)
                .then(Mono.defer(() -> ServerResponse.ok().bodyValue(engine.status())));
    }

    // stop waits for the in-flight attempt
    private Mono<ServerResponse> handleStop(ServerRequest request) {
        return Mono.fromRunnable(engine::stop)
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.defer(() -> ServerResponse.ok().bodyValue(engine.status())));
    }

    private Mono<ServerResponse> handleAcknowledge(ServerRequest request) {
        boolean cleared = engine.acknowledgeReconciliation();
        return ServerResponse.ok().bodyValue(Map.of(
                "cleared", cleared,
                "status", engine.status()));
    }
}
