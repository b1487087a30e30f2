package com.auctionhouse.core.domain;

import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.Objects;

/**
 * 20-byte account or contract identity, held in lower-case hex with a 0x prefix.
 * As a currency, {@link #ZERO} denotes the native currency; as an optional
 * reference (referrer, identity verifier) it denotes "none".
 */
public record Address(String value) implements Comparable<Address> {

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "Address value cannot be null");
        if (!WalletUtils.isValidAddress(value)) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = "0x" + Numeric.cleanHexPrefix(value).toLowerCase(Locale.ROOT);
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    /**
     * True when an optional reference is set to a non-zero address.
     */
    public static boolean isPresent(Address address) {
        return address != null && !address.isZero();
    }

    public String toChecksum() {
        return Keys.toChecksumAddress(value);
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
