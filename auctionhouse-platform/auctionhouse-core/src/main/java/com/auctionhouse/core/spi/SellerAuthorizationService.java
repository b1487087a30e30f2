package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;

/**
 * Seller registry consulted once when a listing is created.
 */
public interface SellerAuthorizationService {

    boolean isAuthorized(Address seller, byte[] contextData);
}
