package com.auctionhouse.engine.config;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.spi.RoyaltyLookupService;
import com.auctionhouse.core.spi.SellerAuthorizationService;

import java.util.Objects;
import java.util.Set;

/**
 * Immutable, versioned snapshot of the global marketplace settings.
 * Operations read one snapshot at their start; {@link MarketplaceAdmin}
 * publishes a new version on every change.
 *
 * @param custodian           account that holds custodied assets and collected funds
 * @param sellerAuthorization seller registry, null when any seller may list
 * @param royaltyLookup       royalty service, null until bound
 */
public record MarketplaceConfig(
        long version,
        boolean enabled,
        int marketplaceFeeBPS,
        int referrerBPS,
        Address custodian,
        Set<Address> admins,
        SellerAuthorizationService sellerAuthorization,
        RoyaltyLookupService royaltyLookup,
        OfferPolicy offerPolicy
) {
    public static final int MAX_FEE_BPS = 1500;
    public static final int MAX_HOLDBACK_BPS = 1000;
    public static final int BPS_DENOMINATOR = 10_000;

    public MarketplaceConfig {
        Objects.requireNonNull(custodian, "Custodian cannot be null");
        admins = admins != null ? Set.copyOf(admins) : Set.of();
        offerPolicy = offerPolicy != null ? offerPolicy : OfferPolicy.DEFAULT;
        requireFeeCap(marketplaceFeeBPS, "Marketplace fee");
        requireFeeCap(referrerBPS, "Referrer fee");
    }

    /**
     * Initial configuration: enabled, no fees, no registry, no royalty service.
     */
    public static MarketplaceConfig initial(Address custodian, Set<Address> admins) {
        return new MarketplaceConfig(1, true, 0, 0, custodian, admins, null, null, OfferPolicy.DEFAULT);
    }

    public boolean isAdmin(Address account) {
        return account != null && admins.contains(account);
    }

    MarketplaceConfig withEnabled(boolean value) {
        return new MarketplaceConfig(version + 1, value, marketplaceFeeBPS, referrerBPS, custodian, admins,
                sellerAuthorization, royaltyLookup, offerPolicy);
    }

    MarketplaceConfig withFees(int newMarketplaceFeeBPS, int newReferrerBPS) {
        return new MarketplaceConfig(version + 1, enabled, newMarketplaceFeeBPS, newReferrerBPS, custodian, admins,
                sellerAuthorization, royaltyLookup, offerPolicy);
    }

    MarketplaceConfig withSellerAuthorization(SellerAuthorizationService service) {
        return new MarketplaceConfig(version + 1, enabled, marketplaceFeeBPS, referrerBPS, custodian, admins,
                service, royaltyLookup, offerPolicy);
    }

    MarketplaceConfig withRoyaltyLookup(RoyaltyLookupService service) {
        return new MarketplaceConfig(version + 1, enabled, marketplaceFeeBPS, referrerBPS, custodian, admins,
                sellerAuthorization, service, offerPolicy);
    }

    MarketplaceConfig withOfferPolicy(OfferPolicy policy) {
        return new MarketplaceConfig(version + 1, enabled, marketplaceFeeBPS, referrerBPS, custodian, admins,
                sellerAuthorization, royaltyLookup, policy);
    }

    private static void requireFeeCap(int bps, String name) {
        if (bps < 0 || bps > MAX_FEE_BPS) {
            throw new IllegalArgumentException(name + " must be between 0 and " + MAX_FEE_BPS + " BPS: " + bps);
        }
    }
}
