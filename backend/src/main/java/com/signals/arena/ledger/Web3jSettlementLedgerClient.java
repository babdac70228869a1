package com.signals.arena.ledger;

import com.signals.arena.config.LedgerProperties;
import com.signals.arena.match.PoolOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Sends settlement transactions to the arena contract, signed with the operator key.
 * Transactions are submitted on the single-threaded ledger executor so nonces stay sequential.
 */
@Component
@ConditionalOnProperty(prefix = "arena.ledger", name = "mode", havingValue = "web3j")
public class Web3jSettlementLedgerClient implements SettlementLedgerClient, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(Web3jSettlementLedgerClient.class);

    private final Web3j web3j;
    private final RawTransactionManager transactionManager;
    private final String contractAddress;
    private final BigInteger gasLimit;
    private final Executor ledgerExecutor;
    private final String operatorAddress;

    public Web3jSettlementLedgerClient(
            LedgerProperties ledgerProperties,
            @Qualifier("ledgerExecutor") Executor ledgerExecutor
    ) {
        List<String> problems = ledgerProperties.missingWeb3jSettings();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid ledger configuration: " + String.join("; ", problems));
        }

        this.web3j = Web3j.build(new HttpService(ledgerProperties.getRpcUrl()));
        Credentials credentials = Credentials.create(ledgerProperties.getOperatorPrivateKey().trim());
        this.transactionManager = new RawTransactionManager(web3j, credentials, ledgerProperties.getChainId());
        this.contractAddress = ledgerProperties.getContractAddress().trim();
        this.gasLimit = ledgerProperties.getGasLimit();
        this.ledgerExecutor = ledgerExecutor;
        this.operatorAddress = credentials.getAddress();

        log.info("Web3j ledger initialized: rpc={}, chainId={}, contract={}, operator={}",
                ledgerProperties.getRpcUrl(), ledgerProperties.getChainId(), contractAddress, operatorAddress);
    }

    @Override
    public CompletableFuture<String> recordSettlement(long matchId, PoolOutcome outcome, String addressA, String addressB) {
        Function function = new Function(
                "recordSettlement",
                Arrays.<Type>asList(
                        new Uint256(BigInteger.valueOf(matchId)),
                        new Uint8(BigInteger.valueOf(outcome.code())),
                        new Address(addressA),
                        new Address(addressB)
                ),
                Collections.emptyList()
        );
        return CompletableFuture.supplyAsync(() -> send(function, "match " + matchId), ledgerExecutor);
    }

    @Override
    public CompletableFuture<String> recordTournamentResult(long tournamentId, List<String> rankedAddresses) {
        List<Address> ranking = rankedAddresses.stream().map(Address::new).toList();
        Function function = new Function(
                "recordTournamentResult",
                Arrays.<Type>asList(
                        new Uint256(BigInteger.valueOf(tournamentId)),
                        new DynamicArray<>(Address.class, ranking)
                ),
                Collections.emptyList()
        );
        return CompletableFuture.supplyAsync(() -> send(function, "tournament " + tournamentId), ledgerExecutor);
    }

    @Override
    public LedgerStatus status() {
        try {
            BigInteger blockNumber = web3j.ethBlockNumber().send().getBlockNumber();
            return new LedgerStatus("web3j", true, "block " + blockNumber + ", operator " + operatorAddress);
        } catch (IOException | RuntimeException ex) {
            return new LedgerStatus("web3j", false, ex.getMessage());
        }
    }

    @Override
    public void destroy() {
        web3j.shutdown();
    }

    private String send(Function function, String subject) {
        String data = FunctionEncoder.encode(function);
        try {
            BigInteger gasPrice = web3j.ethGasPrice().send().getGasPrice();
            EthSendTransaction response = transactionManager.sendTransaction(
                    gasPrice, gasLimit, contractAddress, data, BigInteger.ZERO);
            if (response.hasError()) {
                throw new LedgerException(function.getName() + " for " + subject + " rejected: "
                        + response.getError().getMessage());
            }
            log.info("Ledger {} submitted for {}: tx={}", function.getName(), subject, response.getTransactionHash());
            return response.getTransactionHash();
        } catch (IOException ex) {
            throw new LedgerException(function.getName() + " for " + subject + " failed: " + ex.getMessage(), ex);
        }
    }
}
