package com.auctionhouse.core.domain;

/**
 * Whether a token id names exactly one unit or a fungible quantity of units.
 */
public enum TokenKind {
    UNIQUE,
    MULTI_UNIT
}
