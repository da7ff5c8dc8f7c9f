package com.flagship.fx_ledger.wallet;

import com.flagship.fx_ledger.fx.RatePreference;
import com.flagship.fx_ledger.fx.RateResolver;
import com.flagship.fx_ledger.wallet.dto.ConversionResponse;
import com.flagship.fx_ledger.wallet.dto.RateResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * Read-only rate endpoints.
 */
@RestController
@RequestMapping("/api/fx")
@RequiredArgsConstructor
public class FxController {

    private final RateResolver rateResolver;

    /**
     * Live rate for a pair. With {@code allowFallback=true} the fallback
     * table answers when the live provider cannot.
     */
    @GetMapping("/rates/{from}/{to}")
    public RateResponse rate(@PathVariable("from") String from,
                             @PathVariable("to") String to,
                             @RequestParam(name = "allowFallback", defaultValue = "false") boolean allowFallback) {
        RatePreference preference = allowFallback ? RatePreference.ALLOW_FALLBACK : RatePreference.LIVE_ONLY;
        return RateResponse.from(rateResolver.resolveRate(
            WalletController.parseCurrency(from), WalletController.parseCurrency(to), preference));
    }

    @GetMapping("/convert")
    public ConversionResponse convert(@RequestParam("from") String from,
                                      @RequestParam("to") String to,
                                      @RequestParam("amount") BigDecimal amount) {
        return ConversionResponse.from(rateResolver.convert(
            WalletController.parseCurrency(from), WalletController.parseCurrency(to), amount));
    }
}
