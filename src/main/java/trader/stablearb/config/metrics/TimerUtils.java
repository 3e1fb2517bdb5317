package trader.stablearb.config.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.experimental.UtilityClass;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

@UtilityClass
public class TimerUtils {

    public <T> Mono<T> timedMono(Supplier<Mono<T>> supplier, MeterRegistry registry, String name, String... tags) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(registry);
            return supplier.get()
                    .doOnSuccess(result -> stopTimer(sample, registry, name, withOutcome(tags, "success")))
                    .doOnError(error -> stopTimer(sample, registry, name, withOutcome(tags, "error")));
        });
    }

    private String[] withOutcome(String[] tags, String outcome) {
        String[] result = new String[tags.length + 2];
        System.arraycopy(tags, 0, result, 0, tags.length);
        result[tags.length] = "outcome";
        result[tags.length + 1] = outcome;
        return result;
    }

    private void stopTimer(Timer.Sample sample, MeterRegistry registry, String name, String... tags) {
        sample.stop(
                Timer.builder(name)
                        .tags(tags)
                        .description("Timed operation: " + name)
                        .register(registry)
        );
    }
}
