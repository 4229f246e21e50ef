package scanner.arbitrage.service.clickhouse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;
import scanner.arbitrage.database.QuoteTickRepository;
import scanner.arbitrage.model.QuoteSnapshot;
import scanner.arbitrage.model.ScanReport;
import scanner.arbitrage.model.clickhouse.QuoteTickRecord;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static scanner.arbitrage.util.TestQuotes.quote;

class QuoteTickServiceTest {

    private QuoteTickRepository repository;
    private QuoteTickService service;

    @BeforeEach
    void setUp() {
        repository = mock(QuoteTickRepository.class);
        service = new QuoteTickService(repository, Runnable::run);
    }

    @SuppressWarnings("unchecked")
    @Test
    void flushWritesBufferedQuotesAtMidPrice() {
        service.bufferQuote(quote("binance", "BTC/USDT", "100", "102"));
        service.bufferQuote(quote("okx", "BTC/USDT", "101", "103"));

        StepVerifier.create(service.flushTicksAsync()).verifyComplete();

        ArgumentCaptor<List<QuoteTickRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveTicksBatch(saved.capture());
        assertThat(saved.getValue()).hasSize(2);
        QuoteTickRecord first = saved.getValue().get(0);
        assertThat(first.getVenue()).isEqualTo("binance");
        assertThat(first.getPrice()).isEqualByComparingTo("101");
        assertThat(first.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 5, 1, 12, 0));
    }

    @Test
    void emptyBufferWritesNothing() {
        StepVerifier.create(service.flushTicksAsync()).verifyComplete();

        verify(repository, never()).saveTicksBatch(anyList());
    }

    @Test
    void quotesWithoutPricesAreNotBuffered() {
        service.bufferQuote(quote("binance", "BTC/USDT", null, null));

        StepVerifier.create(service.flushTicksAsync()).verifyComplete();

        verify(repository, never()).saveTicksBatch(anyList());
    }

    @Test
    void storageErrorDoesNotPropagate() {
        doThrow(new IllegalStateException("clickhouse unavailable")).when(repository).saveTicksBatch(anyList());
        service.onScanCompleted(
                new QuoteSnapshot(List.of(quote("binance", "BTC/USDT", "1", "2")), List.of()),
                ScanReport.empty());

        StepVerifier.create(service.flushTicksAsync()).verifyComplete();
    }

    @Test
    void periodicFlushSurvivesWriteSlowerThanInterval() {
        ExecutorService jdbcExecutor = Executors.newSingleThreadExecutor();
        QuoteTickService periodic = new QuoteTickService(repository, jdbcExecutor);
        ReflectionTestUtils.setField(periodic, "flushIntervalMs", 2L);
        ReflectionTestUtils.setField(periodic, "batchSize", 1000);
        doAnswer(invocation -> {
            Thread.sleep(300);
            return null;
        }).doNothing().when(repository).saveTicksBatch(anyList());

        periodic.bufferQuote(quote("binance", "BTC/USDT", "100", "102"));
        periodic.initBuffer();
        try {
            verify(repository, timeout(2000)).saveTicksBatch(anyList());
            periodic.bufferQuote(quote("okx", "BTC/USDT", "101", "103"));

            verify(repository, timeout(3000).times(2)).saveTicksBatch(anyList());
        } finally {
            periodic.onDestroy();
            jdbcExecutor.shutdownNow();
        }
    }

    @Test
    void latestTickIsEmptyWhenSymbolUnknown() {
        when(repository.findLatestTick("DOGE/USDT")).thenReturn(Optional.empty());

        StepVerifier.create(service.getLatestTickReactive("DOGE/USDT")).verifyComplete();
    }
}
