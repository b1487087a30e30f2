package com.auctionhouse.blockchain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.ContractGasProvider;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Node connection and signing account shared by the blockchain collaborators.
 * The signing account is the marketplace custodian: it holds custodied
 * tokens and collected funds.
 */
@Component
public class BlockchainConnection {

    private static final Logger log = LoggerFactory.getLogger(BlockchainConnection.class);
    private final BlockchainConfig config;
    private Web3j web3j;
    private Credentials credentials;
    private ContractGasProvider gasProvider;

    public BlockchainConnection(BlockchainConfig config) {
        this.config = config;
        if (config.isEnabled()) {
            initialize();
        }
    }

    private void initialize() {
        try {
            this.web3j = Web3j.build(new HttpService(config.getNodeUrl()));
            this.credentials = Credentials.create(config.getPrivateKey());
            this.gasProvider = new StaticGasProvider(
                    BigInteger.valueOf(config.getGasPrice()),
                    BigInteger.valueOf(config.getGasLimit()));
            log.info("Blockchain connection to {} initialized for account {}",
                    config.getNodeUrl(), credentials.getAddress());
        } catch (Exception e) {
            log.error("Failed to initialize blockchain connection to {}", config.getNodeUrl(), e);
            this.web3j = null;
        }
    }

    public boolean isEnabled() {
        return config.isEnabled() && web3j != null;
    }

    public BlockchainConfig config() {
        return config;
    }

    public Web3j web3j() {
        return web3j;
    }

    public Credentials credentials() {
        return credentials;
    }

    public ContractGasProvider gasProvider() {
        return gasProvider;
    }

    /**
     * Address of the signing account, empty while disconnected.
     */
    public Optional<String> accountAddress() {
        return isEnabled() ? Optional.of(credentials.getAddress()) : Optional.empty();
    }

    /**
     * Sends a transaction and waits for its receipt. Empty when disconnected
     * or when the node rejected the transaction.
     */
    public Optional<BlockchainTxResult> submit(String description, Callable<TransactionReceipt> transaction) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = transaction.call();
            return Optional.of(new BlockchainTxResult(
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber(),
                    receipt.isStatusOK()
            ));
        } catch (Exception e) {
            log.error("Failed to {} on blockchain", description, e);
            return Optional.empty();
        }
    }

    public record BlockchainTxResult(String txHash, BigInteger blockNumber, boolean success) {}
}
