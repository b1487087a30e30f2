package com.auctionhouse.blockchain.service;

import com.auctionhouse.blockchain.contract.RoyaltyEngineContract;
import com.auctionhouse.blockchain.contract.TokenContract;
import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.TokenReference;
import com.auctionhouse.core.spi.RoyaltyLookupService;
import com.auctionhouse.core.spi.RoyaltyPayment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Royalty lookup backed by the on-chain royalty engine.
 */
@Service
public class BlockchainRoyaltyLookupService implements RoyaltyLookupService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainRoyaltyLookupService.class);
    private final BlockchainConnection connection;
    private RoyaltyEngineContract contract;

    public BlockchainRoyaltyLookupService(BlockchainConnection connection) {
        this.connection = connection;
        String address = connection.config().getRoyaltyEngineAddress();
        if (connection.isEnabled() && address != null && !address.isBlank()) {
            this.contract = RoyaltyEngineContract.load(address, connection.web3j(),
                    connection.credentials(), connection.gasProvider());
            log.info("Royalty engine contract initialized at {}", address);
        }
    }

    /**
     * @throws IllegalStateException if the engine could not be queried; the
     *         sale then settles without royalties
     */
    @Override
    public List<RoyaltyPayment> getRoyalty(TokenReference token, BigInteger saleValue) {
        if (!isEnabled()) {
            return List.of();
        }
        try {
            return RoyaltyEngineContract.decodeRoyalties(
                            contract.getRoyaltyView(token.contract().value(), token.tokenId(), saleValue).send())
                    .stream()
                    .map(share -> new RoyaltyPayment(Address.of(share.recipient()), share.amount()))
                    .toList();
        } catch (Exception e) {
            throw new IllegalStateException("Royalty engine lookup failed for token " + token.tokenId()
                    + " of " + token.contract(), e);
        }
    }

    /**
     * Compares {@code account} with the owner of the token's collection.
     *
     * @throws IllegalStateException if the collection could not be queried
     */
    @Override
    public boolean isCreator(TokenReference token, Address account) {
        if (!isEnabled()) {
            return false;
        }
        try {
            String owner = TokenContract.load(token.contract().value(), connection.web3j(),
                    connection.credentials(), connection.gasProvider()).owner().send();
            return isSameAccount(owner, account);
        } catch (Exception e) {
            throw new IllegalStateException("Creator lookup failed for collection " + token.contract(), e);
        }
    }

    static boolean isSameAccount(String owner, Address account) {
        return owner != null && account != null && !Address.ZERO.value().equalsIgnoreCase(owner)
                && Address.of(owner).equals(account);
    }

    public boolean isEnabled() {
        return connection.isEnabled() && contract != null;
    }
}
