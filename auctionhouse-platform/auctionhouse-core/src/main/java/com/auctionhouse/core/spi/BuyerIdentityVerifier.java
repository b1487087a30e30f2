package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.TokenReference;

import java.math.BigInteger;

/**
 * Per-listing buyer gate, checked on every purchase, bid and offer when configured.
 */
public interface BuyerIdentityVerifier {

    boolean verify(long listingId, Address identity, TokenReference token, long count,
                   BigInteger amount, Address currency, byte[] contextData);
}
