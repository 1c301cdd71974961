package com.questrail.qotd.quotes;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for a {@link DailyQuoteProvider}.
 *
 * @param quotes       pool of at least one quote; one is chosen per day
 * @param rolloverTime local time of day at which a new quote is chosen
 * @param zone         time zone in which days are counted
 */
public record DailyQuoteProviderConfig(
    List<String> quotes,
    LocalTime rolloverTime,
    ZoneId zone
) {
    public DailyQuoteProviderConfig {
        Objects.requireNonNull(quotes, "quotes");
        Objects.requireNonNull(rolloverTime, "rolloverTime");
        Objects.requireNonNull(zone, "zone");

        if (quotes.isEmpty()) {
            throw new IllegalArgumentException("quote pool must contain at least one quote");
        }
        if (quotes.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("quote pool must not contain null");
        }
        quotes = Collections.unmodifiableList(new ArrayList<>(quotes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> quotes = new ArrayList<>();
        private LocalTime rolloverTime = LocalTime.MIDNIGHT;
        private ZoneId zone = ZoneId.systemDefault();

        public Builder addQuote(String quote) {
            quotes.add(quote);
            return this;
        }

        public Builder withQuotes(List<String> quotes) {
            this.quotes.clear();
            this.quotes.addAll(quotes);
            return this;
        }

        public Builder withRolloverTime(LocalTime rolloverTime) {
            this.rolloverTime = rolloverTime;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public DailyQuoteProviderConfig build() {
            return new DailyQuoteProviderConfig(quotes, rolloverTime, zone);
        }
    }
}
