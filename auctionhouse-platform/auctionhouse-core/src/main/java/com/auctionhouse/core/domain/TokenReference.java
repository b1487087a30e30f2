package com.auctionhouse.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Identifies the asset being sold.
 *
 * @param contract collection contract
 * @param tokenId  asset id within the collection
 * @param kind     single-unique or multi-unit
 * @param lazy     asset is created on delivery rather than custodied up front
 */
public record TokenReference(
        Address contract,
        BigInteger tokenId,
        TokenKind kind,
        boolean lazy
) {
    public TokenReference {
        Objects.requireNonNull(contract, "Token contract cannot be null");
        Objects.requireNonNull(tokenId, "Token id cannot be null");
        Objects.requireNonNull(kind, "Token kind cannot be null");
        if (tokenId.signum() < 0) {
            throw new IllegalArgumentException("Token id cannot be negative");
        }
    }

    public static TokenReference unique(Address contract, long tokenId) {
        return new TokenReference(contract, BigInteger.valueOf(tokenId), TokenKind.UNIQUE, false);
    }

    public static TokenReference multiUnit(Address contract, long tokenId) {
        return new TokenReference(contract, BigInteger.valueOf(tokenId), TokenKind.MULTI_UNIT, false);
    }

    public static TokenReference lazy(Address contract, long tokenId, TokenKind kind) {
        return new TokenReference(contract, BigInteger.valueOf(tokenId), kind, true);
    }
}
