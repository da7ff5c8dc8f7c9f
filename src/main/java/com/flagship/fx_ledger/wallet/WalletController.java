package com.flagship.fx_ledger.wallet;

import com.flagship.fx_ledger.currency.CurrencyCode;
import com.flagship.fx_ledger.ledger.LedgerEntry;
import com.flagship.fx_ledger.ledger.LedgerErrorCode;
import com.flagship.fx_ledger.ledger.LedgerException;
import com.flagship.fx_ledger.ledger.LedgerService;
import com.flagship.fx_ledger.wallet.dto.BalanceResponse;
import com.flagship.fx_ledger.wallet.dto.FundWalletRequest;
import com.flagship.fx_ledger.wallet.dto.LedgerEntryResponse;
import com.flagship.fx_ledger.wallet.dto.TradeCurrencyRequest;
import com.flagship.fx_ledger.wallet.dto.TransferFundsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for wallet operations of one owner.
 *
 * Authentication is handled upstream; the owner comes from the path.
 */
@RestController
@RequestMapping("/api/wallets/{ownerId}")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final LedgerService ledgerService;

    @PostMapping("/fund")
    public ResponseEntity<LedgerEntryResponse> fund(@PathVariable("ownerId") String ownerId,
                                                    @Valid @RequestBody FundWalletRequest request) {
        log.info("Received funding request: amount={}, currency={}", request.getAmount(), request.getCurrency());
        LedgerEntry entry = ledgerService.fund(ownerId, request.getAmount(),
            parseCurrency(request.getCurrency()), request.getReference());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @PostMapping("/transfer")
    public ResponseEntity<LedgerEntryResponse> transfer(@PathVariable("ownerId") String ownerId,
                                                        @Valid @RequestBody TransferFundsRequest request) {
        log.info("Received transfer request: to={}, amount={}, currency={}",
                request.getToOwnerId(), request.getAmount(), request.getCurrency());
        LedgerEntry entry = ledgerService.transfer(ownerId, request.getToOwnerId(), request.getAmount(),
            parseCurrency(request.getCurrency()), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @PostMapping("/trade")
    public ResponseEntity<LedgerEntryResponse> trade(@PathVariable("ownerId") String ownerId,
                                                     @Valid @RequestBody TradeCurrencyRequest request) {
        log.info("Received trade request: {} {} -> {}",
                request.getAmount(), request.getFromCurrency(), request.getToCurrency());
        LedgerEntry entry = ledgerService.trade(ownerId, parseCurrency(request.getFromCurrency()),
            parseCurrency(request.getToCurrency()), request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(LedgerEntryResponse.from(entry));
    }

    @GetMapping("/balances")
    public List<BalanceResponse> balances(@PathVariable("ownerId") String ownerId) {
        return ledgerService.getBalances(ownerId).stream()
            .map(BalanceResponse::from)
            .toList();
    }

    @GetMapping("/transactions")
    public List<LedgerEntryResponse> transactions(@PathVariable("ownerId") String ownerId) {
        return ledgerService.getLedgerEntries(ownerId).stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }

    static CurrencyCode parseCurrency(String code) {
        return CurrencyCode.find(code).orElseThrow(() ->
            new LedgerException(LedgerErrorCode.UNSUPPORTED_CURRENCY, "Unsupported currency: " + code));
    }
}
