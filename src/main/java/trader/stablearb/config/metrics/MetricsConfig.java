package trader.stablearb.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import trader.stablearb.model.SpreadSnapshot;
import trader.stablearb.service.monitor.PriceMonitor;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter tradeAttemptsCounter(MeterRegistry registry) {
        return Counter.builder("arbitrage.attempts")
                .description("Number of trade attempts handed to the executor")
                .register(registry);
    }

    @Bean
    public Counter partialFailuresCounter(MeterRegistry registry) {
        return Counter.builder("arbitrage.partial.failures")
                .description("Number of attempts that ended with an unhedged buy leg")
                .register(registry);
    }

    @Bean
    public Counter apiCallsCounter(MeterRegistry registry) {
        return Counter.builder("api.calls.total")
                .description("Number of API calls made")
                .register(registry);
    }

    @Bean
    public Counter telegramNotificationsCounter(MeterRegistry registry) {
        return Counter.builder("telegram.notifications.sent")
                .description("Number of Telegram notifications sent")
                .register(registry);
    }

    @Bean
    public Gauge spreadPercentGauge(MeterRegistry registry, PriceMonitor priceMonitor) {
        return Gauge.builder("arbitrage.spread.percent",
                        () -> priceMonitor.latestSpread()
                                .map(SpreadSnapshot::getSpreadPercentage)
                                .map(Number::doubleValue)
                                .orElse(Double.NaN))
                .description("Current spread between the USDT and USDC markets")
                .register(registry);
    }
}
