package com.flagship.fx_ledger.fx;

import com.flagship.fx_ledger.fx.fallback.FallbackRateTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Optional guard against grossly mispriced live rates.
 *
 * When {@code fx.sanity.max-deviation-factor} is greater than 1, a rate
 * that is more than that factor above or below the fallback rate for the same
 * pair is rejected. Disabled by default.
 */
@Component
@Slf4j
public class RateSanityPolicy {

    private final FallbackRateTable fallbackTable;
    private final FxProperties.Sanity settings;

    public RateSanityPolicy(FallbackRateTable fallbackTable, FxProperties properties) {
        this.fallbackTable = fallbackTable;
        this.settings = properties.getSanity();
    }

    /**
     * @throws RateUnavailableException if the quote deviates too far from the fallback rate
     */
    public void check(RateQuote quote) {
        if (!settings.isEnabled() || !quote.isLive() || quote.getFrom() == quote.getTo()) {
            return;
        }
        BigDecimal reference = fallbackTable.get(quote.getFrom(), quote.getTo()).getRate();
        BigDecimal ratio = quote.getRate().divide(reference, MathContext.DECIMAL64);
        BigDecimal factor = settings.getMaxDeviationFactor();
        BigDecimal lowerBound = BigDecimal.ONE.divide(factor, MathContext.DECIMAL64);

        if (ratio.compareTo(factor) > 0 || ratio.compareTo(lowerBound) < 0) {
            log.error("Live rate {} for {} -> {} deviates from fallback rate {} by more than {}x",
                    quote.getRate(), quote.getFrom(), quote.getTo(), reference, factor);
            throw new RateUnavailableException(String.format(
                "Live rate for %s -> %s failed the sanity check", quote.getFrom(), quote.getTo()));
        }
    }
}
