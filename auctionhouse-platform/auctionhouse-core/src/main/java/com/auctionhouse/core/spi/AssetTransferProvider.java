package com.auctionhouse.core.spi;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.TokenReference;

/**
 * Moves assets between custodians.
 */
public interface AssetTransferProvider {

    /**
     * Takes {@code quantity} units of the token from {@code owner} into marketplace custody.
     *
     * @return false if the movement did not happen
     */
    boolean custody(Address owner, TokenReference token, long quantity);

    /**
     * Moves {@code quantity} units of the token from {@code from} to {@code to}.
     *
     * @return false if the movement did not happen
     */
    boolean transfer(Address from, Address to, TokenReference token, long quantity);
}
