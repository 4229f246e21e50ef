package scanner.arbitrage.telegram;

import io.github.cdimascio.dotenv.Dotenv;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import scanner.arbitrage.model.ArbitrageOpportunity;
import scanner.arbitrage.model.QuoteSnapshot;
import scanner.arbitrage.model.ScanReport;
import scanner.arbitrage.service.arbitrage.ScanCycleListener;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramNotificationService implements ScanCycleListener {

    private final WebClient telegramWebClient;
    private final Dotenv dotenv;
    private final Counter telegramNotificationsCounter;

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

    // Rate limiting tracking
    private final AtomicInteger messagesSentInCurrentMinute = new AtomicInteger(0);
    private volatile long currentMinuteStartTime = System.currentTimeMillis();

    @Override
    public void onScanCompleted(QuoteSnapshot snapshot, ScanReport report) {
        if (!telegramEnabled) {
            return;
        }
        for (ArbitrageOpportunity opportunity : report.getOpportunities()) {
            sendArbitrageNotification(opportunity)
                    .subscribe(
                            sent -> {
                                if (sent) {
                                    log.info("Telegram notification sent for {} {} -> {}",
                                            opportunity.getSymbol(), opportunity.getBuyVenue(), opportunity.getSellVenue());
                                }
                            },
                            error -> log.error("Error sending Telegram notification: {}", error.getMessage())
                    );
        }
    }

    /**
     * Sends an arbitrage opportunity notification to Telegram
     *
     * @param opportunity The arbitrage opportunity to notify about
     * @return Mono<Boolean> indicating success or failure
     */
    public Mono<Boolean> sendArbitrageNotification(ArbitrageOpportunity opportunity) {
        if (!telegramEnabled) {
            log.debug("Telegram notifications are disabled");
            return Mono.just(false);
        }

        if (!checkAndUpdateRateLimit()) {
            log.warn("Telegram rate limit reached. Skipping notification for {}", opportunity.getSymbol());
            return Mono.just(false);
        }

        String chatId = dotenv.get("TELEGRAM_CHAT_ID");
        String message = formatArbitrageMessage(opportunity);

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
                    telegramNotificationsCounter.increment();
                    return true;
                })
                .onErrorResume(e -> {
                    log.error("Failed to send Telegram notification: {}", e.getMessage(), e);
                    return Mono.just(false);
                });
    }

    /**
     * Format the arbitrage opportunity as a Telegram message
     */
    String formatArbitrageMessage(ArbitrageOpportunity opportunity) {
        return String.format(
                "🚨 <b>ARBITRAGE OPPORTUNITY</b> 🚨\n\n" +
                        "💰 <b>Symbol</b>: %s\n" +
                        "🛒 <b>Buy on %s</b>: %s\n" +
                        "💵 <b>Sell on %s</b>: %s\n" +
                        "🧾 <b>Fees</b>: %s\n" +
                        "📈 <b>Net profit</b>: %s (%s%%)\n" +
                        "⏰ <b>Observed</b>: %s",
                opportunity.getSymbol(),
                opportunity.getBuyVenue(),
                opportunity.getBuyPrice().toPlainString(),
                opportunity.getSellVenue(),
                opportunity.getSellPrice().toPlainString(),
                opportunity.getTotalFees().toPlainString(),
                opportunity.getNetProfit().toPlainString(),
                opportunity.getProfitPercentage().toPlainString(),
                opportunity.getDetectedAt()
        );
    }

    /**
     * Check and update rate limiting for Telegram messages
     *
     * @return true if message can be sent, false if rate limit is reached
     */
    private synchronized boolean checkAndUpdateRateLimit() {
        long currentTime = System.currentTimeMillis();
        long timeElapsed = currentTime - currentMinuteStartTime;

        // Reset counter if a minute has passed
        if (timeElapsed >= 60000) {
            log.debug("Resetting Telegram rate limit counter. Previous count: {}", messagesSentInCurrentMinute.get());
            messagesSentInCurrentMinute.set(0);
            currentMinuteStartTime = currentTime;
        }

        return messagesSentInCurrentMinute.incrementAndGet() <= maxMessagesPerMinute;
    }

    /**
     * Creates a retry specification for handling temporary errors
     */
    private Retry createRetrySpec() {
        return Retry.backoff(maxRetryAttempts, Duration.ofMillis(initialBackoffMillis))
                .maxBackoff(Duration.ofMillis(maxBackoffMillis))
                .filter(this::shouldRetry)
                .doBeforeRetry(retrySignal ->
                        log.info("Retrying Telegram notification after error. Attempt {}/{}",
                                retrySignal.totalRetries() + 1, maxRetryAttempts)
                );
    }

    /**
     * Determines if a failed request should be retried
     */
    private boolean shouldRetry(Throwable throwable) {
        // Retry on rate limiting (429) and server errors (5xx)
        if (throwable instanceof WebClientResponseException) {
            WebClientResponseException ex = (WebClientResponseException) throwable;
            HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
            return status != null && (status.equals(HttpStatus.TOO_MANY_REQUESTS) || status.is5xxServerError());
        }

        // Also retry on connection issues
        return throwable instanceof IOException;
    }
}
