package com.questrail.qotd.quotes;

import com.questrail.qotd.internal.time.CancellationSignal;
import com.questrail.qotd.internal.time.SystemWallClock;
import com.questrail.qotd.internal.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * DailyQuoteProvider
 * =============================================================================
 * {@link QuoteProvider} that chooses a new quote once a day, at a configurable
 * local time in a configurable time zone.
 *
 * <h2>Day boundaries</h2>
 * Days are counted in local date/time of {@link #zone()}, so DST transitions
 * shift the rollover with the local clock: after a spring-forward the first
 * request past the rollover time picks a new quote, and a fall-back that moves
 * the local time before the rollover again does not.
 *
 * <h2>Selection</h2>
 * With a pool of more than one quote, the new day's quote is drawn at random and
 * never equals the previous day's. Subclasses can replace the pool entirely by
 * overriding {@link #nextQuote(LocalDateTime)}.
 *
 * <h2>Thread Safety</h2>
 * Concurrent callers may race to roll the day over; only one new quote wins and
 * every caller observes it.
 */
public class DailyQuoteProvider implements QuoteProvider {
    private static final Logger log = LoggerFactory.getLogger(DailyQuoteProvider.class);

    private final WallClock clock;
    private final ZoneId zone;
    private final LocalTime rolloverTime;
    private final List<String> quotePool;

    private final AtomicReference<DatedQuote> current = new AtomicReference<>();

    /** A quote together with the local date it was chosen for. */
    private record DatedQuote(String quote, LocalDate date) { }

    /**
     * Rotate through {@code quotes}, rolling over at the current time of day in
     * the system time zone.
     */
    public DailyQuoteProvider(List<String> quotes) {
        this(SystemWallClock.INSTANCE, DailyQuoteProviderConfig.builder()
            .withQuotes(quotes)
            .withRolloverTime(LocalTime.now())
            .build());
    }

    public DailyQuoteProvider(DailyQuoteProviderConfig config) {
        this(SystemWallClock.INSTANCE, config);
    }

    public DailyQuoteProvider(WallClock clock, DailyQuoteProviderConfig config) {
        Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = config.zone();
        this.rolloverTime = config.rolloverTime();
        this.quotePool = config.quotes();
    }

    /**
     * For subclasses that generate quotes through {@link #nextQuote(LocalDateTime)}
     * instead of drawing from a pool.
     */
    protected DailyQuoteProvider(WallClock clock, LocalTime rolloverTime, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.rolloverTime = Objects.requireNonNull(rolloverTime, "rolloverTime");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.quotePool = null;
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalTime rolloverTime() {
        return rolloverTime;
    }

    /**
     * The quote in effect right now, choosing a new one first if a day boundary
     * has passed.
     */
    public String currentQuote() {
        LocalDateTime now = localNow();
        LocalDate today = now.toLocalDate();
        boolean beforeRollover = now.toLocalTime().isBefore(rolloverTime);
        DatedQuote previous = current.get();

        boolean due = previous == null || (previous.date().isBefore(today) && !beforeRollover);
        if (due) {
            // Before the rollover the quote still belongs to yesterday.
            LocalDate date = beforeRollover ? today.minusDays(1) : today;
            DatedQuote next = new DatedQuote(nextQuote(today.atTime(rolloverTime)), date);
            if (current.compareAndSet(previous, next)) {
                log.trace("New quote for {}: {}", date, next.quote());
            }
        }
        return current.get().quote();
    }

    @Override
    public CompletionStage<String> getQuote(InetAddress clientAddress, CancellationSignal token) {
        return CompletableFuture.completedFuture(currentQuote());
    }

    /**
     * Choose the quote for the day starting at {@code day} (the date with the
     * rollover time). Invoked about once a day; under contention it may run more
     * than once, in which case only one result is used.
     *
     * @throws IllegalStateException if this instance has no pool and the method
     *         is not overridden
     */
    protected String nextQuote(LocalDateTime day) {
        if (quotePool == null || quotePool.isEmpty()) {
            throw new IllegalStateException("nextQuote must be overridden when no quote pool is configured");
        }
        if (quotePool.size() == 1) {
            return quotePool.get(0);
        }

        int index = ThreadLocalRandom.current().nextInt(quotePool.size());
        DatedQuote previous = current.get();
        if (previous != null && quotePool.get(index).equals(previous.quote())) {
            index = index == 0 ? 1 : index - 1;
        }
        return quotePool.get(index);
    }

    /**
     * Current wall-clock time in {@link #zone()}.
     */
    protected LocalDateTime localNow() {
        return LocalDateTime.ofInstant(clock.now(), zone);
    }
}
