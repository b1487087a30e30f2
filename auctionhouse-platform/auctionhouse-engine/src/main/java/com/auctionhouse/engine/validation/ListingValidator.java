package com.auctionhouse.engine.validation;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.DeliveryFees;
import com.auctionhouse.core.domain.Listing;
import com.auctionhouse.core.domain.ListingDetails;
import com.auctionhouse.core.domain.ListingType;
import com.auctionhouse.core.domain.RevenueReceiver;
import com.auctionhouse.core.domain.TokenKind;
import com.auctionhouse.core.domain.TokenReference;
import com.auctionhouse.core.error.ValidationException;
import com.auctionhouse.core.error.ValidationRule;
import com.auctionhouse.engine.config.MarketplaceConfig;

import java.util.List;
import java.util.Objects;

/**
 * Static validator for listing requests.
 * Fails on the first violated rule; a listing is only built from a request
 * that passes every rule.
 */
public class ListingValidator {

    private static final int MAX_BPS = MarketplaceConfig.BPS_DENOMINATOR;

    /** Latest accepted time or duration in seconds (end of year 9999 UTC). */
    public static final long MAX_TIME = 253_402_300_799L;

    /**
     * Validates a request and builds the listing it describes. Fee rates are
     * captured from {@code config}; the referrer rate only if the seller enabled referrers.
     */
    public Listing build(long id, Address seller, ListingRequest request, MarketplaceConfig config,
                         boolean tokenCreator, long now) {
        validate(seller, request, now);
        ListingType type = request.details().type();
        boolean acceptOffers = type == ListingType.OFFERS_ONLY || request.acceptOffers();
        int referrerBPS = request.enableReferrer() ? config.referrerBPS() : 0;
        return Listing.create(id, seller, config.marketplaceFeeBPS(), referrerBPS, request.details(),
                request.token(), request.receivers(), request.deliveryFees(), acceptOffers, tokenCreator, now);
    }

    /**
     * @throws ValidationException naming the first violated rule
     */
    public void validate(Address seller, ListingRequest request, long now) {
        Objects.requireNonNull(request, "Listing request cannot be null");
        if (!Address.isPresent(seller)) {
            throw new ValidationException(ValidationRule.INVALID_SELLER, "Seller must be a non-zero address");
        }
        ListingDetails details = request.details();

        validateAmounts(details, request.deliveryFees());
        validateQuantities(details, request.token());
        validateSchedule(details.type(), details.startTime(), details.endTime(), now);
        validateReceivers(request.receivers());

        switch (details.type()) {
            case INDIVIDUAL_AUCTION -> validateAuction(details, request.token());
            case FIXED_PRICE -> validateFixedPrice(details, request);
            case DYNAMIC_PRICE -> validateDynamicPrice(details, request);
            case OFFERS_ONLY -> validateOffersOnly(details, request);
        }
    }

    /**
     * Schedule rules shared by creation and modification. A zero start time
     * defers the start to the first buyer action; the end time is then a duration.
     */
    public void validateSchedule(ListingType type, long startTime, long endTime, long now) {
        if (startTime < 0 || endTime <= 0) {
            throw new ValidationException(ValidationRule.INVALID_SCHEDULE,
                    "Start and end times must be positive: " + startTime + ", " + endTime);
        }
        if (startTime > MAX_TIME || endTime > MAX_TIME) {
            throw new ValidationException(ValidationRule.INVALID_SCHEDULE,
                    "Start and end times cannot exceed " + MAX_TIME + ": " + startTime + ", " + endTime);
        }
        if (type == ListingType.OFFERS_ONLY && startTime <= now) {
            throw new ValidationException(ValidationRule.START_MUST_BE_FUTURE,
                    "Offers-only listings must start in the future");
        }
        if (startTime == 0) {
            return;
        }
        if (endTime <= startTime) {
            throw new ValidationException(ValidationRule.INVALID_SCHEDULE, "End time must be after start time");
        }
        if (endTime <= now) {
            throw new ValidationException(ValidationRule.INVALID_SCHEDULE, "End time must be in the future");
        }
    }

    private void validateAmounts(ListingDetails details, DeliveryFees fees) {
        if (details.initialAmount().signum() < 0) {
            throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Initial amount cannot be negative");
        }
        if (fees.deliverFixed().signum() < 0) {
            throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Fixed delivery fee cannot be negative");
        }
        requireBps(details.minIncrementBPS(), "Minimum increment");
        requireBps(fees.deliverBPS(), "Delivery fee");
        if (details.extensionInterval() < 0 || details.extensionInterval() > MAX_TIME) {
            throw new ValidationException(ValidationRule.INVALID_SCHEDULE,
                    "Extension interval out of range: " + details.extensionInterval());
        }
    }

    private void validateQuantities(ListingDetails details, TokenReference token) {
        if (details.totalPerSale() <= 0) {
            throw new ValidationException(ValidationRule.INVALID_QUANTITY, "Units per sale must be positive");
        }
        if (details.totalAvailable() < details.totalPerSale()) {
            throw new ValidationException(ValidationRule.INVALID_QUANTITY,
                    "Available units " + details.totalAvailable() + " below units per sale " + details.totalPerSale());
        }
        if (token.kind() == TokenKind.UNIQUE && !token.lazy() && details.totalAvailable() != 1) {
            throw new ValidationException(ValidationRule.UNIQUE_TOKEN_QUANTITY,
                    "A unique token can only be listed as a single unit");
        }
    }

    /**
     * Receiver shares must be positive and sum to exactly 10000 BPS.
     */
    private void validateReceivers(List<RevenueReceiver> receivers) {
        if (receivers.isEmpty()) {
            return;
        }
        long total = 0;
        for (RevenueReceiver receiver : receivers) {
            if (!Address.isPresent(receiver.receiver())) {
                throw new ValidationException(ValidationRule.INVALID_RECEIVERS, "Receiver must be a non-zero address");
            }
            if (receiver.receiverBPS() <= 0 || receiver.receiverBPS() > MAX_BPS) {
                throw new ValidationException(ValidationRule.INVALID_RECEIVERS,
                        "Receiver share out of range: " + receiver.receiverBPS());
            }
            total += receiver.receiverBPS();
        }
        if (total != MAX_BPS) {
            throw new ValidationException(ValidationRule.INVALID_RECEIVERS,
                    "Receiver shares sum to " + total + " BPS, expected " + MAX_BPS);
        }
    }

    private void validateAuction(ListingDetails details, TokenReference token) {
        if (token.lazy()) {
            throw new ValidationException(ValidationRule.LAZY_TOKEN_NOT_ALLOWED, "Auctions require a custodied token");
        }
        if (details.totalAvailable() != 1 || details.totalPerSale() != 1) {
            throw new ValidationException(ValidationRule.AUCTION_SINGLE_LOT, "Auctions sell exactly one unit");
        }
    }

    private void validateFixedPrice(ListingDetails details, ListingRequest request) {
        if (request.token().lazy()) {
            throw new ValidationException(ValidationRule.LAZY_TOKEN_NOT_ALLOWED,
                    "Fixed price listings require a custodied token");
        }
        if (details.initialAmount().signum() == 0) {
            throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Fixed price must be positive");
        }
        rejectAuctionTerms(details, request);
    }

    private void validateDynamicPrice(ListingDetails details, ListingRequest request) {
        if (!request.token().lazy()) {
            throw new ValidationException(ValidationRule.LAZY_TOKEN_REQUIRED,
                    "Dynamic price listings require a lazily delivered token");
        }
        if (details.initialAmount().signum() != 0) {
            throw new ValidationException(ValidationRule.INITIAL_AMOUNT_MUST_BE_ZERO,
                    "Dynamic price listings are priced by their oracle");
        }
        if (details.totalPerSale() != 1) {
            throw new ValidationException(ValidationRule.PER_SALE_MUST_BE_ONE,
                    "Dynamic price listings deliver one unit per sale");
        }
        rejectAuctionTerms(details, request);
    }

    private void validateOffersOnly(ListingDetails details, ListingRequest request) {
        if (details.initialAmount().signum() != 0) {
            throw new ValidationException(ValidationRule.INITIAL_AMOUNT_MUST_BE_ZERO,
                    "Offers-only listings have no asking price");
        }
        rejectAuctionTerms(details, request);
    }

    /**
     * Anti-sniping, increments, delivery fees and opt-in offers belong to auctions only.
     */
    private void rejectAuctionTerms(ListingDetails details, ListingRequest request) {
        if (details.extensionInterval() != 0 || details.minIncrementBPS() != 0) {
            throw new ValidationException(ValidationRule.AUCTION_TERMS_NOT_ALLOWED,
                    details.type() + " listings take no extension interval or minimum increment");
        }
        if (!request.deliveryFees().isNone()) {
            throw new ValidationException(ValidationRule.DELIVERY_FEE_NOT_ALLOWED,
                    details.type() + " listings take no delivery fee");
        }
        if (request.acceptOffers() && details.type() != ListingType.OFFERS_ONLY) {
            throw new ValidationException(ValidationRule.OFFERS_NOT_ALLOWED,
                    details.type() + " listings do not accept offers");
        }
    }

    private static void requireBps(int bps, String name) {
        if (bps < 0 || bps > MAX_BPS) {
            throw new ValidationException(ValidationRule.INVALID_BPS,
                    name + " must be between 0 and " + MAX_BPS + " BPS: " + bps);
        }
    }
}
