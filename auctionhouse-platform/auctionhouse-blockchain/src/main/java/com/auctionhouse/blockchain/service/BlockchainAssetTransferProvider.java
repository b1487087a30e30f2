package com.auctionhouse.blockchain.service;

import com.auctionhouse.blockchain.contract.TokenContract;
import com.auctionhouse.blockchain.service.BlockchainConnection.BlockchainTxResult;
import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.TokenKind;
import com.auctionhouse.core.domain.TokenReference;
import com.auctionhouse.core.spi.AssetTransferProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Moves tokens with on-chain transfers signed by the marketplace account.
 * Custody moves the token to the marketplace account; the owner must have
 * approved that account as operator beforehand.
 */
@Service
public class BlockchainAssetTransferProvider implements AssetTransferProvider {

    private static final Logger log = LoggerFactory.getLogger(BlockchainAssetTransferProvider.class);
    private final BlockchainConnection connection;

    public BlockchainAssetTransferProvider(BlockchainConnection connection) {
        this.connection = connection;
    }

    @Override
    public boolean custody(Address owner, TokenReference token, long quantity) {
        Optional<String> custodian = connection.accountAddress();
        if (custodian.isEmpty()) {
            return false;
        }
        return transfer(owner, Address.of(custodian.get()), token, quantity);
    }

    @Override
    public boolean transfer(Address from, Address to, TokenReference token, long quantity) {
        if (!connection.isEnabled()) {
            return false;
        }
        if (token.kind() == TokenKind.UNIQUE && quantity != 1) {
            log.warn("Refusing to transfer {} units of unique token {}", quantity, token.tokenId());
            return false;
        }
        TokenContract contract = TokenContract.load(token.contract().value(), connection.web3j(),
                connection.credentials(), connection.gasProvider());
        String description = "transfer " + quantity + " of token " + token.tokenId() + " from " + from + " to " + to;
        Optional<BlockchainTxResult> result = token.kind() == TokenKind.UNIQUE
                ? connection.submit(description,
                        () -> contract.safeTransferFrom(from.value(), to.value(), token.tokenId()).send())
                : connection.submit(description,
                        () -> contract.safeTransferFrom(from.value(), to.value(), token.tokenId(),
                                BigInteger.valueOf(quantity)).send());
        result.ifPresent(r -> log.info("Token transfer {} mined in block {} (success={})",
                r.txHash(), r.blockNumber(), r.success()));
        return result.map(BlockchainTxResult::success).orElse(false);
    }
}
