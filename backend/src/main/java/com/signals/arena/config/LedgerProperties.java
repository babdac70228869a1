package com.signals.arena.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Settlement ledger endpoint, operator credential and retry policy.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "arena.ledger")
public class LedgerProperties {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern PRIVATE_KEY = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");

    /**
     * {@code logging} records settlements locally; {@code web3j} sends signed transactions.
     */
    @NotNull
    private LedgerMode mode = LedgerMode.LOGGING;

    private String rpcUrl;

    @Min(1)
    private long chainId = 10143L;

    private String contractAddress;

    private String operatorPrivateKey;

    private BigInteger gasLimit = BigInteger.valueOf(300_000L);

    @Min(1)
    private int maxAttempts = 6;

    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(1);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(30);

    /**
     * Lists every value the web3j ledger needs but does not have.
     */
    public List<String> missingWeb3jSettings() {
        List<String> problems = new ArrayList<>();
        if (rpcUrl == null || rpcUrl.isBlank()) {
            problems.add("arena.ledger.rpc-url is required");
        }
        if (contractAddress == null || !ADDRESS.matcher(contractAddress.trim()).matches()) {
            problems.add("arena.ledger.contract-address must be a 0x-prefixed 20-byte address");
        }
        if (operatorPrivateKey == null || !PRIVATE_KEY.matcher(operatorPrivateKey.trim()).matches()) {
            problems.add("arena.ledger.operator-private-key must be a 32-byte hex key");
        }
        return problems;
    }
}
