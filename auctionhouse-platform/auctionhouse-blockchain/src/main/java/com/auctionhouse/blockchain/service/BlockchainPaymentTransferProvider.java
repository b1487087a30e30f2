package com.auctionhouse.blockchain.service;

import com.auctionhouse.blockchain.contract.Erc20Contract;
import com.auctionhouse.blockchain.service.BlockchainConnection.BlockchainTxResult;
import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.spi.PaymentTransferProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.tx.Transfer;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Pays and collects ERC-20 currencies from the marketplace account.
 *
 * The native currency cannot be pulled from a buyer. When a wrapped-native
 * token is configured, native-currency amounts are collected and paid in
 * that token; otherwise native payouts are plain value transfers and native
 * collection is reported as failed.
 */
@Service
public class BlockchainPaymentTransferProvider implements PaymentTransferProvider {

    private static final Logger log = LoggerFactory.getLogger(BlockchainPaymentTransferProvider.class);
    private final BlockchainConnection connection;

    public BlockchainPaymentTransferProvider(BlockchainConnection connection) {
        this.connection = connection;
    }

    @Override
    public boolean pay(Address to, BigInteger amount, Address currency) {
        if (!connection.isEnabled()) {
            return false;
        }
        String description = "pay " + amount + " of " + currency + " to " + to;
        Optional<String> token = tokenFor(currency);
        Optional<BlockchainTxResult> result = token.isPresent()
                ? connection.submit(description, () -> erc20(token.get()).transfer(to.value(), amount).send())
                : connection.submit(description, () -> Transfer.sendFunds(connection.web3j(),
                        connection.credentials(), to.value(), new BigDecimal(amount), Convert.Unit.WEI).send());
        return succeeded(result);
    }

    @Override
    public boolean collect(Address from, BigInteger amount, Address currency) {
        Optional<String> custodian = connection.accountAddress();
        if (custodian.isEmpty()) {
            return false;
        }
        Optional<String> token = tokenFor(currency);
        if (token.isEmpty()) {
            log.warn("Cannot collect {} native currency from {} without a wrapped-native token", amount, from);
            return false;
        }
        return succeeded(connection.submit("collect " + amount + " of " + currency + " from " + from,
                () -> erc20(token.get()).transferFrom(from.value(), custodian.get(), amount).send()));
    }

    /**
     * ERC-20 contract that carries {@code currency}, empty for an unwrapped native currency.
     */
    Optional<String> tokenFor(Address currency) {
        if (!currency.isZero()) {
            return Optional.of(currency.value());
        }
        String wrapped = connection.config().getWrappedNativeAddress();
        return wrapped != null && !wrapped.isBlank() ? Optional.of(wrapped) : Optional.empty();
    }

    private Erc20Contract erc20(String address) {
        return Erc20Contract.load(address, connection.web3j(), connection.credentials(), connection.gasProvider());
    }

    private boolean succeeded(Optional<BlockchainTxResult> result) {
        result.filter(r -> !r.success())
                .ifPresent(r -> log.warn("Payment transaction {} reverted", r.txHash()));
        return result.map(BlockchainTxResult::success).orElse(false);
    }
}
