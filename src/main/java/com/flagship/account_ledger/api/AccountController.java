package com.flagship.account_ledger.api;

import com.flagship.account_ledger.api.dto.AccountResponse;
import com.flagship.account_ledger.api.dto.AmountRequest;
import com.flagship.account_ledger.api.dto.BalanceResponse;
import com.flagship.account_ledger.api.dto.CreateAccountRequest;
import com.flagship.account_ledger.api.dto.LedgerEntryResponse;
import com.flagship.account_ledger.operation.AccountCreatedResult;
import com.flagship.account_ledger.operation.CreateAccountCommand;
import com.flagship.account_ledger.operation.CreateAccountService;
import com.flagship.account_ledger.operation.DepositCommand;
import com.flagship.account_ledger.operation.DepositService;
import com.flagship.account_ledger.operation.GetBalanceService;
import com.flagship.account_ledger.operation.GetTransactionsService;
import com.flagship.account_ledger.operation.WithdrawCommand;
import com.flagship.account_ledger.operation.WithdrawService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
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
 * REST endpoints for single-account operations.
 *
 * Request bodies are validated here; domain rules (account number format, currency
 * matching, funds) are enforced by the operations and mapped to HTTP by
 * {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final CreateAccountService createAccountService;
    private final DepositService depositService;
    private final WithdrawService withdrawService;
    private final GetBalanceService getBalanceService;
    private final GetTransactionsService getTransactionsService;

    @Value("${ledger.default-currency:BRL}")
    private String defaultCurrency;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: accountNumber={}", request.getAccountNumber());

        long initialBalance = request.getInitialBalanceCents() != null ? request.getInitialBalanceCents() : 0L;
        AccountCreatedResult result = createAccountService.createAccount(new CreateAccountCommand(
            request.getAccountNumber(), initialBalance, currencyOrDefault(request.getCurrency())));

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(result));
    }

    @GetMapping("/{accountNumber}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("accountNumber") String accountNumber) {
        return ResponseEntity.ok(BalanceResponse.from(getBalanceService.getBalance(accountNumber)));
    }

    @PostMapping("/{accountNumber}/deposit")
    public ResponseEntity<BalanceResponse> deposit(@PathVariable("accountNumber") String accountNumber,
                                                   @Valid @RequestBody AmountRequest request) {
        DepositCommand command = new DepositCommand(
            accountNumber, request.getAmountCents(), currencyOrDefault(request.getCurrency()));
        return ResponseEntity.ok(BalanceResponse.from(depositService.deposit(command)));
    }

    @PostMapping("/{accountNumber}/withdraw")
    public ResponseEntity<BalanceResponse> withdraw(@PathVariable("accountNumber") String accountNumber,
                                                    @Valid @RequestBody AmountRequest request) {
        WithdrawCommand command = new WithdrawCommand(
            accountNumber, request.getAmountCents(), currencyOrDefault(request.getCurrency()));
        return ResponseEntity.ok(BalanceResponse.from(withdrawService.withdraw(command)));
    }

    @GetMapping("/{accountNumber}/transactions")
    public ResponseEntity<List<LedgerEntryResponse>> getTransactions(
            @PathVariable("accountNumber") String accountNumber) {
        List<LedgerEntryResponse> entries = getTransactionsService.getTransactions(accountNumber).stream()
            .map(LedgerEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    private String currencyOrDefault(String currency) {
        return currency == null || currency.isBlank() ? defaultCurrency : currency;
    }
}
