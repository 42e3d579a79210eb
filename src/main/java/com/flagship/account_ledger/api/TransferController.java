package com.flagship.account_ledger.api;

import com.flagship.account_ledger.api.dto.TransferRequest;
import com.flagship.account_ledger.api.dto.TransferResponse;
import com.flagship.account_ledger.operation.TransferCommand;
import com.flagship.account_ledger.operation.TransferService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transfers")
@RequiredArgsConstructor
public class TransferController {

    private final TransferService transferService;

    @Value("${ledger.default-currency:BRL}")
    private String defaultCurrency;

    @PostMapping
    public ResponseEntity<TransferResponse> transfer(@Valid @RequestBody TransferRequest request) {
        String currency = request.getCurrency() == null || request.getCurrency().isBlank()
            ? defaultCurrency
            : request.getCurrency();
        TransferCommand command = new TransferCommand(
            request.getFromAccountNumber(), request.getToAccountNumber(), request.getAmountCents(), currency);
        return ResponseEntity.ok(TransferResponse.from(transferService.transfer(command)));
    }
}
