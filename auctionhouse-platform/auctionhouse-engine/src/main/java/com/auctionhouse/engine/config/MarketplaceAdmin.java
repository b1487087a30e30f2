package com.auctionhouse.engine.config;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.error.AuthorizationException;
import com.auctionhouse.core.error.StateException;
import com.auctionhouse.core.error.ValidationException;
import com.auctionhouse.core.error.ValidationRule;
import com.auctionhouse.core.spi.RoyaltyLookupService;
import com.auctionhouse.core.spi.SellerAuthorizationService;
import com.auctionhouse.engine.escrow.FeeLedger;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.event.MarketplaceEvent;
import com.auctionhouse.engine.event.MarketplaceEventType;
import com.auctionhouse.engine.support.OperationGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Administrator-only surface over the global marketplace configuration and
 * the collected fee balance. Listings capture fee rates at creation, so fee
 * changes never affect existing listings.
 */
public class MarketplaceAdmin {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceAdmin.class);

    private final AtomicReference<MarketplaceConfig> current;
    private final FeeLedger feeLedger;
    private final OperationGuard guard;
    private final EventBus eventBus;
    private final Clock clock;

    public MarketplaceAdmin(MarketplaceConfig initial, FeeLedger feeLedger, OperationGuard guard,
                            EventBus eventBus, Clock clock) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "Initial config cannot be null"));
        this.feeLedger = Objects.requireNonNull(feeLedger, "Fee ledger cannot be null");
        this.guard = Objects.requireNonNull(guard, "Operation guard cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public MarketplaceConfig current() {
        return current.get();
    }

    public boolean isAdmin(Address account) {
        return current.get().isAdmin(account);
    }

    public MarketplaceConfig setEnabled(Address caller, boolean enabled) {
        return update(caller, "enabled", config -> config.withEnabled(enabled));
    }

    /**
     * @throws ValidationException if either rate exceeds {@link MarketplaceConfig#MAX_FEE_BPS}
     */
    public MarketplaceConfig setFees(Address caller, int marketplaceFeeBPS, int referrerBPS) {
        requireFeeCap(marketplaceFeeBPS);
        requireFeeCap(referrerBPS);
        return update(caller, "fees", config -> config.withFees(marketplaceFeeBPS, referrerBPS));
    }

    public MarketplaceConfig setSellerAuthorization(Address caller, SellerAuthorizationService service) {
        return update(caller, "sellerAuthorization", config -> config.withSellerAuthorization(service));
    }

    /**
     * Binds the royalty service. Can only be done once.
     */
    public MarketplaceConfig setRoyaltyLookup(Address caller, RoyaltyLookupService service) {
        Objects.requireNonNull(service, "Royalty service cannot be null");
        return update(caller, "royaltyLookup", config -> {
            if (config.royaltyLookup() != null) {
                throw new StateException("ROYALTY_LOOKUP_ALREADY_SET", "Royalty service is already bound");
            }
            return config.withRoyaltyLookup(service);
        });
    }

    public MarketplaceConfig setOfferPolicy(Address caller, OfferPolicy policy) {
        Objects.requireNonNull(policy, "Offer policy cannot be null");
        return update(caller, "offerPolicy", config -> config.withOfferPolicy(policy));
    }

    /**
     * Pays collected marketplace revenue in {@code currency} to {@code receiver}.
     */
    public void withdrawFees(Address caller, Address currency, BigInteger amount, Address receiver) {
        Objects.requireNonNull(currency, "Currency cannot be null");
        Objects.requireNonNull(receiver, "Receiver cannot be null");
        guard.run("withdrawFees", () -> {
            requireAdmin(caller);
            if (amount == null || amount.signum() <= 0) {
                throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Withdrawal amount must be positive");
            }
            feeLedger.withdraw(currency, amount, receiver);
            eventBus.emit(new MarketplaceEvent(MarketplaceEventType.FEES_WITHDRAWN, 0, caller, amount,
                    clock.instant().getEpochSecond(),
                    Map.of("currency", currency.value(), "receiver", receiver.value())));
            return null;
        });
    }

    public BigInteger collectedFees(Address currency) {
        return feeLedger.balanceOf(currency);
    }

    private MarketplaceConfig update(Address caller, String setting, UnaryOperator<MarketplaceConfig> change) {
        return guard.run("configure", () -> {
            requireAdmin(caller);
            MarketplaceConfig updated = change.apply(current.get());
            current.set(updated);
            log.info("Marketplace {} changed by {}; config version {}", setting, caller, updated.version());
            eventBus.emit(new MarketplaceEvent(MarketplaceEventType.CONFIG_CHANGED, 0, caller, BigInteger.ZERO,
                    clock.instant().getEpochSecond(),
                    Map.of("setting", setting, "version", updated.version())));
            return updated;
        });
    }

    private void requireAdmin(Address caller) {
        if (!current.get().isAdmin(caller)) {
            throw new AuthorizationException("NOT_ADMIN", caller + " is not a marketplace administrator");
        }
    }

    private static void requireFeeCap(int bps) {
        if (bps < 0 || bps > MarketplaceConfig.MAX_FEE_BPS) {
            throw new ValidationException(ValidationRule.INVALID_BPS,
                    "Fee must be between 0 and " + MarketplaceConfig.MAX_FEE_BPS + " BPS: " + bps);
        }
    }
}
