package com.auctionhouse.blockchain.service;

import com.auctionhouse.blockchain.contract.SellerRegistryContract;
import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.spi.SellerAuthorizationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Seller registry backed by an on-chain registry contract. Fails closed:
 * a seller is only authorized on a positive answer from the registry.
 */
@Service
public class BlockchainSellerAuthorizationService implements SellerAuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(BlockchainSellerAuthorizationService.class);
    private final BlockchainConnection connection;
    private SellerRegistryContract contract;

    public BlockchainSellerAuthorizationService(BlockchainConnection connection) {
        this.connection = connection;
        String address = connection.config().getSellerRegistryAddress();
        if (connection.isEnabled() && address != null && !address.isBlank()) {
            this.contract = SellerRegistryContract.load(address, connection.web3j(),
                    connection.credentials(), connection.gasProvider());
            log.info("Seller registry contract initialized at {}", address);
        }
    }

    @Override
    public boolean isAuthorized(Address seller, byte[] contextData) {
        if (!isEnabled()) {
            return false;
        }
        try {
            Boolean authorized = contract.isAuthorized(seller.value(),
                    contextData != null ? contextData : new byte[0]).send();
            return Boolean.TRUE.equals(authorized);
        } catch (Exception e) {
            log.error("Failed to check seller {} against the registry", seller, e);
            return false;
        }
    }

    public boolean isEnabled() {
        return connection.isEnabled() && contract != null;
    }
}
