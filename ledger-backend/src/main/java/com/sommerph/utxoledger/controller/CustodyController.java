package com.sommerph.utxoledger.controller;

import com.sommerph.utxoledger.service.custody.AssetTransferException;
import com.sommerph.utxoledger.service.custody.InMemoryAssetCustody;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/custody")
@RequiredArgsConstructor
@Tag(name = "Custody", description = "Endpoints for the in-memory asset accounts backing the ledger")
public class CustodyController {

    private final InMemoryAssetCustody custody;

    @Operation(summary = "Credit an external account with assets")
    @PostMapping("/fund")
    public ResponseEntity<?> fund(@Valid @RequestBody FundRequest request) {
        log.info("Fund request for account: {}", request.getAccount());
        if (request.getAmount().signum() <= 0) {
            return ResponseEntity.badRequest().body("Amount must be positive");
        }
        try {
            custody.fund(request.getAccount(), request.getAmount());
        } catch (AssetTransferException e) {
            log.warn("Fund request rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.getMessage());
        }
        return ResponseEntity.ok(Map.of("account", request.getAccount(), "balance", custody.balanceOf(request.getAccount())));
    }

    @Operation(summary = "Get the balance of an account")
    @GetMapping("/balance/{account}")
    public ResponseEntity<?> balance(@PathVariable @NotBlank String account) {
        return ResponseEntity.ok(Map.of("account", account, "balance", custody.balanceOf(account)));
    }

    @Data
    public static class FundRequest {
        @NotBlank
        private String account;
        @NotNull
        private BigInteger amount;
    }

}
