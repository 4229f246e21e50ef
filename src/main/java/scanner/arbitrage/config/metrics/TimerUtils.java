package scanner.arbitrage.config.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.experimental.UtilityClass;
import reactor.core.publisher.Mono;

import java.util.function.Supplier;

@UtilityClass
public class TimerUtils {

    /**
     * Records the time from subscription until the supplied Mono terminates, tagged with its outcome.
     */
    public <T> Mono<T> timedMono(Supplier<Mono<T>> supplier, MeterRegistry registry, String name, String... tags) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(registry);
            return supplier.get()
                    .doOnSuccess(result -> stopTimer(sample, registry, name, "success", tags))
                    .doOnError(error -> stopTimer(sample, registry, name, "error", tags));
        });
    }

    private void stopTimer(Timer.Sample sample, MeterRegistry registry, String name, String outcome, String... tags) {
        sample.stop(
                Timer.builder(name)
                        .tags(tags)
                        .tag("outcome", outcome)
                        .description("Timed operation: " + name)
                        .register(registry)
        );
    }
}
