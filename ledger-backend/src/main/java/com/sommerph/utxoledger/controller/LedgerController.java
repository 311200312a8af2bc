package com.sommerph.utxoledger.controller;

import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.custody.TransferApproval;
import com.sommerph.utxoledger.model.ledger.EncryptedOutput;
import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.model.ledger.KeyType;
import com.sommerph.utxoledger.model.ledger.MerkleProof;
import com.sommerph.utxoledger.service.ledger.LedgerStateMachine;
import com.sommerph.utxoledger.util.HexUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Endpoints for ledger state transitions and queries")
public class LedgerController {

    private final LedgerStateMachine ledger;

    @Operation(summary = "Deposit funds behind a new commitment")
    @PostMapping("/deposit")
    public ResponseEntity<?> deposit(@Valid @RequestBody DepositRequest request) {
        log.info("Deposit request from: {}", request.getDepositor());
        try {
            long index = ledger.deposit(Hash32.fromHex(request.getCommitment()), toOutput(request.getEncrypted()),
                    request.getAmount(), request.getDepositor());
            return ResponseEntity.ok(committed(index));
        } catch (LedgerException e) {
            return rejected(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to deposit for: {}", request.getDepositor(), e);
            return ResponseEntity.internalServerError().body("Error processing deposit: " + e.getMessage());
        }
    }

    @Operation(summary = "Deposit funds pulled under a signed transfer approval")
    @PostMapping("/deposit-with-approval")
    public ResponseEntity<?> depositWithApproval(@Valid @RequestBody ApprovalDepositRequest request) {
        log.info("Delegated deposit request from: {}", request.getDepositor());
        try {
            long index = ledger.depositWithDelegatedApproval(Hash32.fromHex(request.getCommitment()),
                    toOutput(request.getEncrypted()), request.getAmount(), request.getApproval(),
                    HexUtils.fromHex(request.getSignature()), request.getDepositor());
            return ResponseEntity.ok(committed(index));
        } catch (LedgerException e) {
            return rejected(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to deposit with approval for: {}", request.getDepositor(), e);
            return ResponseEntity.internalServerError().body("Error processing deposit: " + e.getMessage());
        }
    }

    @Operation(summary = "Submit a proved private transfer")
    @PostMapping("/submit-tx")
    public ResponseEntity<?> submitTransfer(@Valid @RequestBody TransferRequest request) {
        log.info("Transfer request with {} encrypted outputs", request.getEncryptedOutputs().size());
        try {
            ledger.submitTransfer(toOutputs(request.getEncryptedOutputs()), HexUtils.fromHex(request.getProof()),
                    HexUtils.fromHex(request.getPublicValues()));
            return ResponseEntity.ok(committed(null));
        } catch (LedgerException e) {
            return rejected(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to submit transfer", e);
            return ResponseEntity.internalServerError().body("Error processing transfer: " + e.getMessage());
        }
    }

    @Operation(summary = "Withdraw funds to a public recipient with a proof of spend")
    @PostMapping("/withdraw")
    public ResponseEntity<?> withdraw(@Valid @RequestBody WithdrawRequest request) {
        log.info("Withdraw request of {} to: {}", request.getAmount(), request.getRecipient());
        try {
            ledger.withdraw(request.getRecipient(), request.getAmount(), HexUtils.fromHex(request.getProof()),
                    HexUtils.fromHex(request.getPublicValues()), toOutputs(request.getEncryptedOutputs()));
            return ResponseEntity.ok(committed(null));
        } catch (LedgerException e) {
            return rejected(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to withdraw to: {}", request.getRecipient(), e);
            return ResponseEntity.internalServerError().body("Error processing withdrawal: " + e.getMessage());
        }
    }

    @Operation(summary = "Deposit and apply a proved transfer in one call")
    @PostMapping("/deposit-and-transfer")
    public ResponseEntity<?> depositAndTransfer(@Valid @RequestBody DepositAndTransferRequest request) {
        log.info("Deposit-and-transfer request from: {}", request.getDepositor());
        try {
            ledger.depositAndTransfer(Hash32.fromHex(request.getDepositCommitment()),
                    toOutputs(request.getEncryptedOutputs()), HexUtils.fromHex(request.getProof()),
                    HexUtils.fromHex(request.getPublicValues()), request.getAmount(), request.getDepositor());
            return ResponseEntity.ok(committed(null));
        } catch (LedgerException e) {
            return rejected(e);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", e.getMessage()));
        } catch (Exception e) {
            log.error("Failed to deposit and transfer for: {}", request.getDepositor(), e);
            return ResponseEntity.internalServerError().body("Error processing deposit and transfer: " + e.getMessage());
        }
    }

    @Operation(summary = "Get the current Merkle root")
    @GetMapping("/root")
    public ResponseEntity<?> currentRoot() {
        return ResponseEntity.ok(Map.of("root", ledger.currentRoot()));
    }

    @Operation(summary = "Check whether a root was ever held by the tree")
    @GetMapping("/roots/{root}")
    public ResponseEntity<?> knownRoot(@PathVariable @NotBlank String root) {
        try {
            return ResponseEntity.ok(Map.of("root", root, "known", ledger.isKnownRoot(Hash32.fromHex(root))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid root: " + root);
        }
    }

    @Operation(summary = "Get the index the next commitment will be inserted at")
    @GetMapping("/next-index")
    public ResponseEntity<?> nextLeafIndex() {
        return ResponseEntity.ok(Map.of("nextIndex", ledger.nextLeafIndex()));
    }

    @Operation(summary = "Check whether a nullifier has been spent")
    @GetMapping("/nullifiers/{nullifier}")
    public ResponseEntity<?> nullifierUsed(@PathVariable @NotBlank String nullifier) {
        try {
            return ResponseEntity.ok(Map.of("nullifier", nullifier, "used", ledger.nullifierUsed(Hash32.fromHex(nullifier))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid nullifier: " + nullifier);
        }
    }

    @Operation(summary = "Get the total deposited into the ledger")
    @GetMapping("/total-deposited")
    public ResponseEntity<?> totalDeposited() {
        return ResponseEntity.ok(Map.of("totalDeposited", ledger.totalDeposited()));
    }

    @Operation(summary = "Get the asset balance held in custody for the ledger")
    @GetMapping("/balance")
    public ResponseEntity<?> balance() {
        return ResponseEntity.ok(Map.of("balance", ledger.getBalance()));
    }

    @Operation(summary = "Get metadata posted for a commitment")
    @GetMapping("/metadata/{commitment}")
    public ResponseEntity<?> metadata(@PathVariable @NotBlank String commitment) {
        try {
            Optional<byte[]> metadata = ledger.getMetadata(Hash32.fromHex(commitment));
            return ResponseEntity.ok(Map.of("commitment", commitment, "metadata", HexUtils.toHex(metadata.orElse(new byte[0]))));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid commitment: " + commitment);
        }
    }

    @Operation(summary = "Get the Merkle inclusion path of a leaf")
    @GetMapping("/proof/{leafIndex}")
    public ResponseEntity<?> proof(@PathVariable @Min(0) long leafIndex) {
        Optional<MerkleProof> proof = ledger.proveLeaf(leafIndex);
        if (proof.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leafIndex", leafIndex);
        body.put("siblings", proof.get().getSiblings());
        body.put("root", ledger.currentRoot());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "List inserted commitments in leaf order")
    @GetMapping("/leaves")
    public ResponseEntity<?> leaves(@RequestParam(defaultValue = "0") @Min(0) long from,
                                    @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int count) {
        return ResponseEntity.ok(Map.of("from", from, "leaves", ledger.leaves(from, count)));
    }

    private Map<String, Object> committed(Long leafIndex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        if (leafIndex != null) {
            body.put("leafIndex", leafIndex);
        }
        body.put("root", ledger.currentRoot());
        return body;
    }

    private ResponseEntity<?> rejected(LedgerException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getError().name(), "message", e.getMessage()));
    }

    private List<EncryptedOutput> toOutputs(List<EncryptedOutputRequest> requests) {
        List<EncryptedOutput> outputs = new ArrayList<>();
        if (requests != null) {
            requests.forEach(r -> outputs.add(toOutput(r)));
        }
        return outputs;
    }

    private EncryptedOutput toOutput(EncryptedOutputRequest request) {
        return EncryptedOutput.builder()
                .commitment(Hash32.fromHex(request.getCommitment()))
                .keyType(KeyType.fromCode(request.getKeyType()))
                .ephemeralKey(HexUtils.fromHex(request.getEphemeralPubkey()))
                .nonce(HexUtils.fromHex(request.getNonce()))
                .ciphertext(HexUtils.fromHex(request.getCiphertext()))
                .metadata(request.getMetadata() == null ? null : HexUtils.fromHex(request.getMetadata()))
                .build();
    }

    @Data
    public static class EncryptedOutputRequest {
        @NotBlank
        private String commitment;
        @Min(0)
        private int keyType;
        @NotBlank
        private String ephemeralPubkey;
        @NotBlank
        private String nonce;
        @NotNull
        private String ciphertext;
        private String metadata;
    }

    @Data
    public static class DepositRequest {
        @NotBlank
        private String commitment;
        @Valid
        @NotNull
        private EncryptedOutputRequest encrypted;
        @NotNull
        private BigInteger amount;
        @NotBlank
        private String depositor;
    }

    @Data
    public static class ApprovalDepositRequest {
        @NotBlank
        private String commitment;
        @Valid
        @NotNull
        private EncryptedOutputRequest encrypted;
        @NotNull
        private BigInteger amount;
        @NotNull
        private TransferApproval approval;
        @NotBlank
        private String signature;
        @NotBlank
        private String depositor;
    }

    @Data
    public static class TransferRequest {
        @Valid
        @NotNull
        private List<EncryptedOutputRequest> encryptedOutputs = new ArrayList<>();
        @NotBlank
        private String proof;
        @NotBlank
        private String publicValues;
    }

    @Data
    public static class WithdrawRequest {
        @NotBlank
        private String recipient;
        @NotNull
        private BigInteger amount;
        @NotBlank
        private String proof;
        @NotBlank
        private String publicValues;
        @Valid
        private List<EncryptedOutputRequest> encryptedOutputs = new ArrayList<>();
    }

    @Data
    public static class DepositAndTransferRequest {
        @NotBlank
        private String depositCommitment;
        @Valid
        @NotNull
        private List<EncryptedOutputRequest> encryptedOutputs = new ArrayList<>();
        @NotBlank
        private String proof;
        @NotBlank
        private String publicValues;
        @NotNull
        private BigInteger amount;
        @NotBlank
        private String depositor;
    }

}
