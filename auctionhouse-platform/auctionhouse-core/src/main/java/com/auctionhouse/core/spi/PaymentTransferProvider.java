package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;

import java.math.BigInteger;

/**
 * Moves value between the marketplace and external accounts.
 */
public interface PaymentTransferProvider {

    /**
     * Pays {@code amount} of {@code currency} from the marketplace to {@code to}.
     *
     * @return false if the payment was not delivered
     */
    boolean pay(Address to, BigInteger amount, Address currency);

    /**
     * Pulls {@code amount} of {@code currency} from {@code from} into the marketplace.
     *
     * @return false if the funds were not received
     */
    boolean collect(Address from, BigInteger amount, Address currency);
}
