package com.auctionhouse.engine.listing;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.Bid;
import com.auctionhouse.core.domain.Listing;
import com.auctionhouse.core.domain.ListingDetails;
import com.auctionhouse.core.domain.ListingPhase;
import com.auctionhouse.core.domain.ListingType;
import com.auctionhouse.core.domain.Offer;
import com.auctionhouse.core.domain.TokenReference;
import com.auctionhouse.core.error.AuthorizationException;
import com.auctionhouse.core.error.InsufficientPaymentException;
import com.auctionhouse.core.error.StateException;
import com.auctionhouse.core.error.TransferFailureException;
import com.auctionhouse.core.error.ValidationException;
import com.auctionhouse.core.error.ValidationRule;
import com.auctionhouse.core.repository.ListingRepository;
import com.auctionhouse.core.spi.AssetTransferProvider;
import com.auctionhouse.core.spi.BuyerIdentityVerifier;
import com.auctionhouse.core.spi.CollaboratorDirectory;
import com.auctionhouse.core.spi.DynamicPriceOracle;
import com.auctionhouse.core.spi.LazyAssetDeliverer;
import com.auctionhouse.core.spi.PaymentTransferProvider;
import com.auctionhouse.engine.config.MarketplaceAdmin;
import com.auctionhouse.engine.config.MarketplaceConfig;
import com.auctionhouse.engine.config.OfferPolicy;
import com.auctionhouse.engine.escrow.FeeLedger;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.event.MarketplaceEvent;
import com.auctionhouse.engine.event.MarketplaceEventType;
import com.auctionhouse.engine.settlement.PaymentDispatcher;
import com.auctionhouse.engine.settlement.PayoutKind;
import com.auctionhouse.engine.settlement.SettlementEngine;
import com.auctionhouse.engine.settlement.SettlementPlan;
import com.auctionhouse.engine.settlement.SettlementReceipt;
import com.auctionhouse.engine.support.OperationGuard;
import com.auctionhouse.engine.validation.ListingRequest;
import com.auctionhouse.engine.validation.ListingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Owns listings, their bid and their offers, and exposes the listing lifecycle.
 *
 * Every operation runs under the engine-wide {@link OperationGuard} and in a
 * fixed order: checks, inbound payment collection, state effects, asset
 * movement, outbound payouts, event. A failed collection aborts before any
 * effect. A failed asset movement restores the listing snapshot, returns the
 * collected funds and throws {@link TransferFailureException}. Outbound
 * payouts never abort; an undeliverable payout is escrowed.
 *
 * Time-based transitions are evaluated lazily against the injected clock when
 * an operation touches the listing.
 */
public class ListingStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ListingStateMachine.class);
    private static final BigInteger BPS = BigInteger.valueOf(MarketplaceConfig.BPS_DENOMINATOR);

    private final ListingRepository repository;
    private final ListingValidator validator;
    private final SettlementEngine settlement;
    private final PaymentDispatcher dispatcher;
    private final FeeLedger feeLedger;
    private final MarketplaceAdmin admin;
    private final AssetTransferProvider assets;
    private final PaymentTransferProvider payments;
    private final CollaboratorDirectory directory;
    private final EventBus eventBus;
    private final OperationGuard guard;
    private final Clock clock;

    public ListingStateMachine(ListingRepository repository, ListingValidator validator,
                               SettlementEngine settlement, PaymentDispatcher dispatcher, FeeLedger feeLedger,
                               MarketplaceAdmin admin, AssetTransferProvider assets,
                               PaymentTransferProvider payments, CollaboratorDirectory directory,
                               EventBus eventBus, OperationGuard guard, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "Listing repository cannot be null");
        this.validator = Objects.requireNonNull(validator, "Listing validator cannot be null");
        this.settlement = Objects.requireNonNull(settlement, "Settlement engine cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Payment dispatcher cannot be null");
        this.feeLedger = Objects.requireNonNull(feeLedger, "Fee ledger cannot be null");
        this.admin = Objects.requireNonNull(admin, "Marketplace admin cannot be null");
        this.assets = Objects.requireNonNull(assets, "Asset transfer provider cannot be null");
        this.payments = Objects.requireNonNull(payments, "Payment transfer provider cannot be null");
        this.directory = Objects.requireNonNull(directory, "Collaborator directory cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.guard = Objects.requireNonNull(guard, "Operation guard cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    // ==================== Lifecycle ====================

    /**
     * Creates a listing and takes custody of its units unless the token is lazy.
     */
    public Listing create(Address seller, ListingRequest request) {
        Objects.requireNonNull(seller, "Seller cannot be null");
        Objects.requireNonNull(request, "Listing request cannot be null");
        return guard.run("create", () -> {
            MarketplaceConfig config = admin.current();
            requireEnabled(config);
            if (config.sellerAuthorization() != null
                    && !config.sellerAuthorization().isAuthorized(seller, request.contextData())) {
                throw new AuthorizationException("SELLER_NOT_AUTHORIZED", seller + " is not an authorized seller");
            }
            long now = now();
            validator.validate(seller, request, now);
            boolean tokenCreator = resolveCreator(config, request.token(), seller);

            Listing listing = validator.build(repository.nextId(), seller, request, config, tokenCreator, now);
            repository.save(listing);

            TokenReference token = listing.getToken();
            if (!token.lazy() && !moveAsset(() -> assets.custody(seller, token, listing.getDetails().totalAvailable()))) {
                repository.discard(listing.getId());
                throw new TransferFailureException("CUSTODY_FAILED",
                        "Could not take custody of token " + token.tokenId() + " from " + seller);
            }

            log.info("Listing {} created by {}: {} x{}", listing.getId(), seller,
                    listing.getDetails().type(), listing.getDetails().totalAvailable());
            emit(MarketplaceEventType.LISTING_CREATED, listing, seller, listing.getInitialAmount(),
                    Map.of("type", listing.getDetails().type().name(),
                            "tokenContract", token.contract().value(),
                            "tokenId", token.tokenId().toString()));
            return listing.copy();
        });
    }

    /**
     * Changes the price and schedule of a listing that has seen no activity.
     */
    public Listing modify(Address caller, long listingId, BigInteger initialAmount, long startTime, long endTime) {
        Objects.requireNonNull(initialAmount, "Initial amount cannot be null");
        return guard.run("modify", () -> {
            Listing listing = load(listingId);
            requireSeller(listing, caller);
            requireNotFinalized(listing);
            if (listing.hasActivity()) {
                throw new StateException("LISTING_HAS_ACTIVITY", "Listing " + listingId + " has bids or sales");
            }
            ListingType type = listing.getDetails().type();
            if ((type == ListingType.DYNAMIC_PRICE || type == ListingType.OFFERS_ONLY) && initialAmount.signum() != 0) {
                throw new ValidationException(ValidationRule.INITIAL_AMOUNT_MUST_BE_ZERO,
                        type + " listings keep an initial amount of zero");
            }
            if (initialAmount.signum() < 0 || (type == ListingType.FIXED_PRICE && initialAmount.signum() == 0)) {
                throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Invalid initial amount " + initialAmount);
            }
            validator.validateSchedule(type, startTime, endTime, now());

            listing.updateDetails(listing.getDetails().withTerms(initialAmount, startTime, endTime));
            repository.save(listing);

            emit(MarketplaceEventType.LISTING_MODIFIED, listing, caller, initialAmount,
                    Map.of("startTime", startTime, "endTime", endTime));
            return listing.copy();
        });
    }

    /**
     * Buys {@code count} lots from a fixed or dynamic price listing.
     *
     * @param tendered the most the buyer is willing to pay
     */
    public SettlementReceipt purchase(Address buyer, long listingId, long count, BigInteger tendered,
                                      Address referrer, byte[] data) {
        Objects.requireNonNull(buyer, "Buyer cannot be null");
        Objects.requireNonNull(tendered, "Tendered amount cannot be null");
        return guard.run("purchase", () -> {
            MarketplaceConfig config = admin.current();
            requireEnabled(config);
            Listing listing = load(listingId);
            if (!listing.getDetails().type().isPurchasable()) {
                throw new StateException("NOT_PURCHASABLE", "Listing " + listingId + " cannot be purchased");
            }
            requireNotFinalized(listing);
            if (count <= 0) {
                throw new ValidationException(ValidationRule.INVALID_QUANTITY, "Purchase count must be positive");
            }
            long now = now();
            requireActive(listing, effectiveDetails(listing, now), now);

            long units = unitsFor(listing, count);
            if (units > listing.remainingUnits()) {
                throw new StateException("INSUFFICIENT_SUPPLY",
                        "Only " + listing.remainingUnits() + " units left, " + units + " requested");
            }

            BigInteger price = priceOf(listing, count);
            if (tendered.compareTo(price) < 0) {
                throw new InsufficientPaymentException(price, tendered);
            }
            verifyBuyer(listing, buyer, count, price, data);
            // Dynamic price takes the tendered amount and refunds any excess after the sale
            BigInteger collected = listing.getDetails().type() == ListingType.DYNAMIC_PRICE ? tendered : price;
            SettlementPlan plan = settlement.plan(listing, price, referrer, config);

            collectPayment(buyer, collected, listing.getCurrency());

            Listing snapshot = listing.copy();
            if (!listing.hasStarted()) {
                listing.start(now);
            }
            long index = listing.getTotalSold();
            listing.recordSale(units);
            boolean soldOut = listing.remainingUnits() == 0;
            if (soldOut) {
                listing.markFinalized();
            }
            repository.save(listing);

            if (!deliver(listing, buyer, units, price, index)) {
                rollback(snapshot, buyer, collected, "ASSET_DELIVERY_FAILED",
                        "Could not deliver " + units + " units of listing " + listingId + " to " + buyer);
            }

            dispatcher.disburse(PayoutKind.REFUND, buyer, collected.subtract(price), listing.getCurrency());
            SettlementReceipt receipt = settlement.execute(plan);

            emit(MarketplaceEventType.PURCHASE, listing, buyer, price,
                    Map.of("count", count, "units", units, "totalSold", listing.getTotalSold()));
            if (soldOut) {
                log.info("Listing {} sold out", listingId);
                emit(MarketplaceEventType.LISTING_FINALIZED, listing, buyer, BigInteger.ZERO, Map.of("reason", "SOLD_OUT"));
            }
            return receipt;
        });
    }

    /**
     * Places a bid on an auction. The previous top bidder is refunded; a top
     * bidder raising their own bid pays only the difference.
     */
    public Bid bid(Address bidder, long listingId, BigInteger amount, Address referrer, byte[] data) {
        Objects.requireNonNull(bidder, "Bidder cannot be null");
        Objects.requireNonNull(amount, "Bid amount cannot be null");
        return guard.run("bid", () -> {
            MarketplaceConfig config = admin.current();
            requireEnabled(config);
            Listing listing = load(listingId);
            requireAuction(listing);
            requireNotFinalized(listing);
            if (bidder.equals(listing.getSeller())) {
                throw new AuthorizationException("SELLER_CANNOT_BID", "Sellers cannot bid on their own listing");
            }
            if (amount.signum() <= 0) {
                throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Bid amount must be positive");
            }
            long now = now();
            ListingDetails details = effectiveDetails(listing, now);
            requireActive(listing, details, now);

            Optional<Bid> previous = listing.getBid();
            BigInteger minimum = minimumBid(listing);
            if (amount.compareTo(minimum) < 0) {
                throw new InsufficientPaymentException(minimum, amount);
            }
            verifyBuyer(listing, bidder, 1, amount, data);

            boolean selfRaise = previous.isPresent() && previous.get().bidder().equals(bidder);
            BigInteger due = selfRaise ? amount.subtract(previous.get().amount()) : amount;
            collectPayment(bidder, due, listing.getCurrency());

            if (!listing.hasStarted()) {
                listing.start(now);
            }
            Bid bid = Bid.place(bidder, amount, now, referrer);
            listing.replaceBid(bid);
            listing.disableOffers();
            long endTime = listing.getDetails().endTime();
            long extension = listing.getDetails().extensionInterval();
            boolean extended = extension > 0 && now >= endTime - extension;
            if (extended) {
                listing.extendTo(now + extension);
            }
            repository.save(listing);

            if (previous.isPresent() && !selfRaise) {
                Bid outbid = previous.get();
                dispatcher.disburse(PayoutKind.REFUND, outbid.bidder(), outbid.amount(), listing.getCurrency());
            }

            log.debug("Bid of {} on listing {} by {}", amount, listingId, bidder);
            emit(MarketplaceEventType.BID_PLACED, listing, bidder, amount,
                    Map.of("endTime", listing.getDetails().endTime(), "extended", extended));
            return bid;
        });
    }

    /**
     * Makes an offer, or raises the caller's existing offer by {@code amount}.
     * Offered funds are collected and held until the offer is accepted or rescinded.
     */
    public Offer offer(Address offerer, long listingId, BigInteger amount, Address referrer, byte[] data) {
        Objects.requireNonNull(offerer, "Offerer cannot be null");
        Objects.requireNonNull(amount, "Offer amount cannot be null");
        return guard.run("offer", () -> {
            MarketplaceConfig config = admin.current();
            requireEnabled(config);
            Listing listing = load(listingId);
            requireNotFinalized(listing);
            if (offerer.equals(listing.getSeller())) {
                throw new AuthorizationException("SELLER_CANNOT_OFFER", "Sellers cannot offer on their own listing");
            }
            if (amount.signum() <= 0) {
                throw new ValidationException(ValidationRule.INVALID_AMOUNT, "Offer amount must be positive");
            }
            long now = now();
            requireOfferWindow(listing, now);

            Optional<Offer> existing = listing.getOffer(offerer);
            if (existing.isPresent() && existing.get().accepted()) {
                throw new StateException("OFFER_ALREADY_ACCEPTED", "Offer by " + offerer + " was already accepted");
            }
            BigInteger total = existing.map(o -> o.amount().add(amount)).orElse(amount);
            verifyBuyer(listing, offerer, 1, total, data);

            collectPayment(offerer, amount, listing.getCurrency());

            Offer offer = existing.map(o -> o.increasedBy(amount, now))
                    .orElseGet(() -> Offer.make(offerer, amount, now, referrer));
            listing.putOffer(offer);
            repository.save(listing);

            emit(MarketplaceEventType.OFFER_MADE, listing, offerer, amount,
                    Map.of("offerTotal", offer.amount().toString()));
            return offer;
        });
    }

    /**
     * Accepts the named offers. Each offer must still match the amount the
     * seller saw, and their total may not exceed {@code maxAmount}. Every
     * accepted offer buys one lot; the listing finalizes once sold out.
     *
     * Every lot is delivered before any proceeds are paid. If a delivery
     * fails, lots already delivered are taken back into custody, the listing
     * is restored and the failure thrown. A lot that cannot be taken back
     * stays sold to its offerer and is settled.
     */
    public List<SettlementReceipt> accept(Address caller, long listingId, List<Address> offerers,
                                          List<BigInteger> expectedAmounts, BigInteger maxAmount) {
        Objects.requireNonNull(offerers, "Offerers cannot be null");
        Objects.requireNonNull(expectedAmounts, "Expected amounts cannot be null");
        Objects.requireNonNull(maxAmount, "Max amount cannot be null");
        return guard.run("accept", () -> {
            MarketplaceConfig config = admin.current();
            Listing listing = load(listingId);
            requireSeller(listing, caller);
            requireNotFinalized(listing);
            if (listing.hasBid()) {
                throw new StateException("AUCTION_HAS_BID", "Offers cannot be accepted once an auction has a bid");
            }
            if (offerers.isEmpty() || offerers.size() != expectedAmounts.size()
                    || new HashSet<>(offerers).size() != offerers.size()) {
                throw new ValidationException(ValidationRule.INVALID_REQUEST,
                        "Offerers and expected amounts must be non-empty, distinct and of equal length");
            }

            List<Offer> accepted = new ArrayList<>();
            BigInteger aggregate = BigInteger.ZERO;
            for (int i = 0; i < offerers.size(); i++) {
                Address offerer = offerers.get(i);
                Offer offer = listing.getOffer(offerer).orElseThrow(() ->
                        new StateException("OFFER_NOT_FOUND", "No offer by " + offerer + " on listing " + listingId));
                if (offer.accepted()) {
                    throw new StateException("OFFER_ALREADY_ACCEPTED", "Offer by " + offerer + " was already accepted");
                }
                if (offer.amount().compareTo(expectedAmounts.get(i)) != 0) {
                    throw new StateException("OFFER_CHANGED",
                            "Offer by " + offerer + " is " + offer.amount() + ", expected " + expectedAmounts.get(i));
                }
                aggregate = aggregate.add(offer.amount());
                accepted.add(offer);
            }
            if (aggregate.compareTo(maxAmount) > 0) {
                throw new StateException("OFFERS_EXCEED_MAX_AMOUNT",
                        "Offers total " + aggregate + ", above maximum " + maxAmount);
            }
            long perSale = listing.getDetails().totalPerSale();
            if (accepted.size() > listing.remainingUnits() / perSale) {
                throw new StateException("INSUFFICIENT_SUPPLY",
                        "Only " + listing.remainingUnits() / perSale + " lots left for " + accepted.size() + " offers");
            }
            List<SettlementPlan> plans = new ArrayList<>(accepted.size());
            for (Offer offer : accepted) {
                plans.add(settlement.plan(listing, offer.amount(), offer.referrer(), config));
            }

            Listing snapshot = listing.copy();
            long firstIndex = listing.getTotalSold();
            for (Offer offer : accepted) {
                listing.putOffer(offer.markAccepted());
            }
            listing.recordSale(perSale * accepted.size());
            if (listing.remainingUnits() == 0) {
                listing.markFinalized();
            }
            repository.save(listing);

            for (int i = 0; i < accepted.size(); i++) {
                Offer offer = accepted.get(i);
                if (!deliver(listing, offer.offerer(), perSale, offer.amount(), firstIndex + i * perSale)) {
                    abortAcceptance(snapshot, accepted.subList(0, i), plans, caller);
                    throw new TransferFailureException("ASSET_DELIVERY_FAILED",
                            "Could not deliver listing " + listingId + " to offerer " + offer.offerer());
                }
            }

            List<SettlementReceipt> receipts = new ArrayList<>(accepted.size());
            for (int i = 0; i < accepted.size(); i++) {
                Offer offer = accepted.get(i);
                receipts.add(settlement.execute(plans.get(i)));
                emit(MarketplaceEventType.OFFER_ACCEPTED, listing, offer.offerer(), offer.amount(),
                        Map.of("seller", caller.value()));
            }

            if (listing.isFinalized()) {
                emit(MarketplaceEventType.LISTING_FINALIZED, listing, caller, BigInteger.ZERO,
                        Map.of("reason", "OFFERS_ACCEPTED"));
            }
            return receipts;
        });
    }

    /**
     * Withdraws offers and returns their funds. Offerers rescind their own
     * offers; the seller may force-rescind others' offers.
     */
    public void rescind(Address caller, long listingId, List<Address> offerers) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(offerers, "Offerers cannot be null");
        guard.run("rescind", () -> {
            MarketplaceConfig config = admin.current();
            Listing listing = load(listingId);
            long now = now();

            List<Offer> rescinded = new ArrayList<>();
            Set<Address> seen = new HashSet<>();
            for (Address offerer : offerers) {
                if (!seen.add(offerer)) {
                    continue;
                }
                Offer offer = listing.getOffer(offerer).orElseThrow(() ->
                        new StateException("OFFER_NOT_FOUND", "No offer by " + offerer + " on listing " + listingId));
                if (offer.accepted()) {
                    throw new StateException("OFFER_ALREADY_ACCEPTED", "Accepted offers cannot be rescinded");
                }
                requireRescindable(listing, caller, offerer, config.offerPolicy(), now);
                rescinded.add(offer);
            }

            for (Offer offer : rescinded) {
                listing.removeOffer(offer.offerer());
            }
            repository.save(listing);

            for (Offer offer : rescinded) {
                dispatcher.disburse(PayoutKind.REFUND, offer.offerer(), offer.amount(), listing.getCurrency());
                emit(MarketplaceEventType.OFFER_RESCINDED, listing, caller, offer.amount(),
                        Map.of("offerer", offer.offerer().value()));
            }
            return null;
        });
    }

    /**
     * Completes a listing after its end time.
     *
     * An auction is finalized by anyone (by the bidder when a delivery fee is
     * owed): the bidder receives the lot and proceeds are settled unless
     * already collected, or without a bid the lot returns to the seller. Other
     * listing types are finalized by their seller to take unsold units back.
     */
    public Listing finalize(Address caller, long listingId) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        return guard.run("finalize", () -> {
            MarketplaceConfig config = admin.current();
            Listing listing = load(listingId);
            requireNotFinalized(listing);
            long now = now();
            if (!listing.hasEnded(now)) {
                throw new StateException("LISTING_NOT_ENDED", "Listing " + listingId + " has not ended");
            }
            if (listing.getDetails().type().isAuction() && listing.hasBid()) {
                finalizeSoldAuction(listing, caller, config);
            } else {
                if (!listing.getDetails().type().isAuction()) {
                    requireSeller(listing, caller);
                }
                returnUnsold(listing, listing.copy());
            }
            emit(MarketplaceEventType.LISTING_FINALIZED, listing, caller, BigInteger.ZERO,
                    Map.of("reason", "ENDED"));
            return listing.copy();
        });
    }

    private void finalizeSoldAuction(Listing listing, Address caller, MarketplaceConfig config) {
        Bid bid = listing.getBid().orElseThrow();
        BigInteger deliveryFee = listing.getDeliveryFees().isNone()
                ? BigInteger.ZERO
                : listing.getDeliveryFees().feeFor(bid.amount());
        if (!listing.getDeliveryFees().isNone() && !caller.equals(bid.bidder())) {
            throw new AuthorizationException("BIDDER_MUST_FINALIZE",
                    "Only the bidder can finalize an auction with a delivery fee");
        }
        SettlementPlan plan = bid.settled() ? null : settlement.plan(listing, bid.amount(), bid.referrer(), config);

        collectPayment(bid.bidder(), deliveryFee, listing.getCurrency());

        Listing snapshot = listing.copy();
        Bid delivered = bid.markDelivered();
        listing.replaceBid(plan != null ? delivered.markSettled() : delivered);
        listing.recordSale(listing.getDetails().totalPerSale());
        listing.markFinalized();
        repository.save(listing);

        if (!deliver(listing, bid.bidder(), listing.getDetails().totalPerSale(), bid.amount(), 0)) {
            rollback(snapshot, bid.bidder(), deliveryFee, "ASSET_DELIVERY_FAILED",
                    "Could not deliver listing " + listing.getId() + " to bidder " + bid.bidder());
        }

        feeLedger.credit(listing.getCurrency(), deliveryFee);
        if (plan != null) {
            settlement.execute(plan);
        }
        log.info("Auction {} finalized; {} won with {}", listing.getId(), bid.bidder(), bid.amount());
    }

    /**
     * Settles the proceeds of an ended auction before the lot is delivered.
     */
    public SettlementReceipt collect(Address caller, long listingId) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        return guard.run("collect", () -> {
            MarketplaceConfig config = admin.current();
            Listing listing = load(listingId);
            requireAuction(listing);
            requireSeller(listing, caller);
            requireNotFinalized(listing);
            Bid bid = listing.getBid().orElseThrow(() ->
                    new StateException("NO_BID", "Listing " + listingId + " has no bid to collect"));
            if (bid.settled()) {
                throw new StateException("ALREADY_SETTLED", "Proceeds of listing " + listingId + " were collected");
            }
            if (!listing.hasEnded(now())) {
                throw new StateException("LISTING_NOT_ENDED", "Listing " + listingId + " has not ended");
            }
            SettlementPlan plan = settlement.plan(listing, bid.amount(), bid.referrer(), config);

            listing.replaceBid(bid.markSettled());
            repository.save(listing);

            SettlementReceipt receipt = settlement.execute(plan);
            emit(MarketplaceEventType.PROCEEDS_COLLECTED, listing, caller, bid.amount(), Map.of());
            return receipt;
        });
    }

    /**
     * Cancels a listing. Sellers may cancel a listing without activity; an
     * administrator may cancel any listing before finalization and withhold
     * up to {@link MarketplaceConfig#MAX_HOLDBACK_BPS} of the bidder's refund.
     */
    public Listing cancel(Address caller, long listingId, int holdbackBPS) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        return guard.run("cancel", () -> {
            Listing listing = load(listingId);
            requireNotFinalized(listing);
            boolean byAdmin = admin.isAdmin(caller);
            if (!byAdmin) {
                requireSeller(listing, caller);
                if (holdbackBPS != 0) {
                    throw new AuthorizationException("HOLDBACK_REQUIRES_ADMIN",
                            "Only an administrator can withhold part of a refund");
                }
                if (listing.hasActivity()) {
                    throw new StateException("LISTING_HAS_ACTIVITY", "Listing " + listingId + " has bids or sales");
                }
            } else if (holdbackBPS < 0 || holdbackBPS > MarketplaceConfig.MAX_HOLDBACK_BPS) {
                throw new ValidationException(ValidationRule.INVALID_BPS,
                        "Holdback must be between 0 and " + MarketplaceConfig.MAX_HOLDBACK_BPS + " BPS: " + holdbackBPS);
            }
            Optional<Bid> bid = listing.getBid();
            if (bid.isPresent() && bid.get().settled()) {
                throw new StateException("ALREADY_SETTLED",
                        "Proceeds of listing " + listingId + " were collected; it can only be finalized");
            }
            BigInteger holdback = bid.map(b -> b.amount().multiply(BigInteger.valueOf(holdbackBPS)).divide(BPS))
                    .orElse(BigInteger.ZERO);

            Listing snapshot = listing.copy();
            bid.ifPresent(b -> listing.replaceBid(b.markRefunded()));
            returnUnsold(listing, snapshot);

            bid.ifPresent(b -> dispatcher.disburse(PayoutKind.REFUND, b.bidder(), b.amount().subtract(holdback),
                    listing.getCurrency()));
            feeLedger.credit(listing.getCurrency(), holdback);

            log.info("Listing {} cancelled by {} (holdback {} BPS)", listingId, caller, holdbackBPS);
            emit(MarketplaceEventType.LISTING_CANCELLED, listing, caller, holdback,
                    Map.of("holdbackBPS", holdbackBPS, "byAdmin", byAdmin));
            return listing.copy();
        });
    }

    /**
     * Marks the listing finalized and returns unsold custodied units to the
     * seller, restoring {@code snapshot} if the return fails.
     */
    private void returnUnsold(Listing listing, Listing snapshot) {
        long unsold = listing.remainingUnits();
        listing.markFinalized();
        repository.save(listing);

        TokenReference token = listing.getToken();
        if (!token.lazy() && unsold > 0
                && !moveAsset(() -> assets.transfer(custodian(), listing.getSeller(), token, unsold))) {
            rollback(snapshot, listing.getSeller(), BigInteger.ZERO, "ASSET_RETURN_FAILED",
                    "Could not return " + unsold + " units of listing " + listing.getId() + " to the seller");
        }
    }

    // ==================== Queries ====================

    public Listing getListing(long listingId) {
        return guard.read(() -> load(listingId).copy());
    }

    public List<Listing> getListings() {
        return guard.read(() -> repository.findAll().stream().map(Listing::copy).toList());
    }

    public List<Listing> getListingsBySeller(Address seller) {
        return guard.read(() -> repository.findBySeller(seller).stream().map(Listing::copy).toList());
    }

    public Optional<Bid> getBid(long listingId) {
        return guard.read(() -> load(listingId).getBid());
    }

    public List<Offer> getOffers(long listingId) {
        return guard.read(() -> List.copyOf(load(listingId).getOffers()));
    }

    public Optional<Offer> getOffer(long listingId, Address offerer) {
        return guard.read(() -> load(listingId).getOffer(offerer));
    }

    public ListingPhase phase(long listingId) {
        return guard.read(() -> load(listingId).phase(now()));
    }

    /**
     * Price of the next sale: the reserve or minimum next bid for auctions,
     * the unit price for fixed price listings, the oracle quote for one
     * dynamically priced sale, and zero for offers-only listings.
     */
    public BigInteger getCurrentPrice(long listingId) {
        return guard.read(() -> {
            Listing listing = load(listingId);
            return switch (listing.getDetails().type()) {
                case INDIVIDUAL_AUCTION -> minimumBid(listing);
                case FIXED_PRICE, DYNAMIC_PRICE -> priceOf(listing, 1);
                case OFFERS_ONLY -> BigInteger.ZERO;
            };
        });
    }

    /**
     * Delivery fee owed on top of the current price.
     */
    public BigInteger getDeliveryFee(long listingId) {
        return guard.read(() -> deliveryFeeOn(load(listingId), getCurrentPrice(listingId)));
    }

    public BigInteger getTotalPrice(long listingId) {
        return guard.read(() -> {
            BigInteger price = getCurrentPrice(listingId);
            return price.add(deliveryFeeOn(load(listingId), price));
        });
    }

    // ==================== Internals ====================

    private BigInteger deliveryFeeOn(Listing listing, BigInteger price) {
        if (!listing.getDetails().type().isAuction() || listing.getDeliveryFees().isNone()) {
            return BigInteger.ZERO;
        }
        BigInteger base = listing.getBid().map(Bid::amount).orElse(price);
        return listing.getDeliveryFees().feeFor(base);
    }

    /**
     * Reserve before the first bid; afterwards the current bid plus the minimum
     * increment, never less than one unit.
     */
    private BigInteger minimumBid(Listing listing) {
        return listing.getBid()
                .map(bid -> {
                    BigInteger increment = bid.amount()
                            .multiply(BigInteger.valueOf(listing.getDetails().minIncrementBPS()))
                            .divide(BPS);
                    return bid.amount().add(increment.max(BigInteger.ONE));
                })
                .orElse(listing.getInitialAmount().max(BigInteger.ONE));
    }

    private BigInteger priceOf(Listing listing, long count) {
        if (listing.getDetails().type() == ListingType.DYNAMIC_PRICE) {
            TokenReference token = listing.getToken();
            DynamicPriceOracle oracle = directory.priceOracle(token.contract()).orElseThrow(() ->
                    new StateException("PRICE_ORACLE_UNAVAILABLE", "No price oracle for " + token.contract()));
            BigInteger quote = oracle.quote(token.tokenId(), listing.getTotalSold(), count);
            if (quote == null || quote.signum() < 0) {
                throw new StateException("PRICE_ORACLE_UNAVAILABLE", "Price oracle returned an invalid quote");
            }
            return quote;
        }
        return listing.getInitialAmount().multiply(BigInteger.valueOf(count));
    }

    private long unitsFor(Listing listing, long count) {
        try {
            return Math.multiplyExact(count, listing.getDetails().totalPerSale());
        } catch (ArithmeticException e) {
            throw new ValidationException(ValidationRule.INVALID_QUANTITY, "Purchase count too large: " + count);
        }
    }

    private ListingDetails effectiveDetails(Listing listing, long now) {
        return listing.getDetails().startingAt(now);
    }

    private void requireActive(Listing listing, ListingDetails details, long now) {
        if (now < details.startTime()) {
            throw new StateException("LISTING_NOT_STARTED", "Listing " + listing.getId() + " has not started");
        }
        if (now >= details.endTime()) {
            throw new StateException("LISTING_ENDED", "Listing " + listing.getId() + " has ended");
        }
    }

    private void requireOfferWindow(Listing listing, long now) {
        ListingType type = listing.getDetails().type();
        if (type == ListingType.OFFERS_ONLY) {
            requireActive(listing, listing.getDetails(), now);
        } else if (type.isAuction() && listing.isAcceptOffers()) {
            if (listing.hasEnded(now)) {
                throw new StateException("LISTING_ENDED", "Listing " + listing.getId() + " has ended");
            }
        } else if (type.isAuction() && listing.hasBid()) {
            throw new StateException("AUCTION_HAS_BID", "Auction " + listing.getId() + " no longer takes offers");
        } else {
            throw new StateException("OFFERS_NOT_ACCEPTED", "Listing " + listing.getId() + " does not take offers");
        }
    }

    private void requireRescindable(Listing listing, Address caller, Address offerer, OfferPolicy policy, long now) {
        boolean ended = listing.isFinalized() || listing.hasEnded(now);
        if (caller.equals(offerer)) {
            if (listing.isFinalized()) {
                return;
            }
            if (listing.getDetails().type() == ListingType.OFFERS_ONLY) {
                long releaseAt = listing.getDetails().endTime() + policy.offersOnlyRescindGraceSeconds();
                if (now < releaseAt) {
                    throw new StateException("RESCIND_TOO_EARLY", "Offer can be rescinded from " + releaseAt);
                }
            } else if (listing.hasBid() && !policy.auctionOffersRescindableAfterBid()) {
                throw new StateException("RESCIND_TOO_EARLY", "Offer can be rescinded once the auction is finalized");
            }
        } else if (caller.equals(listing.getSeller())) {
            if (policy.sellerRescindRequiresEnd() && !ended) {
                throw new StateException("RESCIND_TOO_EARLY", "Seller can rescind offers once the listing ended");
            }
        } else {
            throw new AuthorizationException("NOT_OFFERER", caller + " cannot rescind the offer of " + offerer);
        }
    }

    private void verifyBuyer(Listing listing, Address identity, long count, BigInteger amount, byte[] data) {
        if (!listing.getDetails().hasIdentityVerifier()) {
            return;
        }
        Address reference = listing.getDetails().identityVerifier();
        BuyerIdentityVerifier verifier = directory.identityVerifier(reference).orElseThrow(() ->
                new StateException("IDENTITY_VERIFIER_UNAVAILABLE", "No identity verifier at " + reference));
        if (!verifier.verify(listing.getId(), identity, listing.getToken(), count, amount, listing.getCurrency(),
                data != null ? data : new byte[0])) {
            throw new AuthorizationException("IDENTITY_VERIFICATION_FAILED", identity + " failed identity verification");
        }
    }

    private boolean resolveCreator(MarketplaceConfig config, TokenReference token, Address seller) {
        if (config.royaltyLookup() == null) {
            return false;
        }
        try {
            return config.royaltyLookup().isCreator(token, seller);
        } catch (RuntimeException e) {
            log.warn("Creator lookup failed for token {}; treating seller as non-creator", token.tokenId(), e);
            return false;
        }
    }

    private void collectPayment(Address payer, BigInteger amount, Address currency) {
        if (amount.signum() <= 0) {
            return;
        }
        boolean collected;
        try {
            collected = payments.collect(payer, amount, currency);
        } catch (RuntimeException e) {
            throw new TransferFailureException("PAYMENT_COLLECTION_FAILED",
                    "Collecting " + amount + " from " + payer + " failed", e);
        }
        if (!collected) {
            throw new TransferFailureException("PAYMENT_COLLECTION_FAILED",
                    "Collecting " + amount + " from " + payer + " was refused");
        }
    }

    /**
     * Restores the listing after a failed batch acceptance. Delivered lots go
     * back into custody; lazily delivered lots, and lots whose return fails,
     * remain sold and are settled.
     */
    private void abortAcceptance(Listing snapshot, List<Offer> delivered, List<SettlementPlan> plans,
                                 Address seller) {
        Listing restored = snapshot.copy();
        long perSale = restored.getDetails().totalPerSale();
        TokenReference token = restored.getToken();
        for (int i = 0; i < delivered.size(); i++) {
            Offer offer = delivered.get(i);
            boolean returned = !token.lazy()
                    && moveAsset(() -> assets.transfer(offer.offerer(), custodian(), token, perSale));
            if (returned) {
                continue;
            }
            log.error("Lot of listing {} delivered to {} could not be taken back; settling it",
                    restored.getId(), offer.offerer());
            restored.putOffer(offer.markAccepted());
            restored.recordSale(perSale);
            settlement.execute(plans.get(i));
            emit(MarketplaceEventType.OFFER_ACCEPTED, restored, offer.offerer(), offer.amount(),
                    Map.of("seller", seller.value()));
        }
        repository.save(restored);
        log.warn("Rolled back acceptance on listing {}", restored.getId());
    }

    /**
     * Hands units to a buyer: minted by the lazy deliverer, or moved out of custody.
     */
    private boolean deliver(Listing listing, Address to, long units, BigInteger amount, long index) {
        TokenReference token = listing.getToken();
        if (token.lazy()) {
            Optional<LazyAssetDeliverer> deliverer = directory.lazyDeliverer(token.contract());
            if (deliverer.isEmpty()) {
                log.warn("No lazy deliverer registered for {}", token.contract());
                return false;
            }
            return moveAsset(() -> deliverer.get().deliver(listing.getId(), to, token.tokenId(), units, amount,
                    listing.getCurrency(), index));
        }
        return moveAsset(() -> assets.transfer(custodian(), to, token, units));
    }

    private boolean moveAsset(BooleanSupplier movement) {
        try {
            return movement.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Asset movement failed", e);
            return false;
        }
    }

    /**
     * Restores the listing as it was before the operation's effects, returns
     * funds collected from {@code payer}, and aborts the operation.
     */
    private void rollback(Listing snapshot, Address payer, BigInteger collected, String reason, String message) {
        repository.save(snapshot);
        dispatcher.disburse(PayoutKind.REFUND, payer, collected, snapshot.getCurrency());
        log.warn("Rolled back listing {}: {}", snapshot.getId(), message);
        throw new TransferFailureException(reason, message);
    }

    private Listing load(long listingId) {
        return repository.findById(listingId).orElseThrow(() ->
                new StateException("LISTING_NOT_FOUND", "Listing " + listingId + " does not exist"));
    }

    private void requireEnabled(MarketplaceConfig config) {
        if (!config.enabled()) {
            throw new StateException("MARKETPLACE_DISABLED", "Marketplace is disabled");
        }
    }

    private void requireSeller(Listing listing, Address caller) {
        if (!listing.getSeller().equals(caller)) {
            throw new AuthorizationException("NOT_SELLER", caller + " is not the seller of listing " + listing.getId());
        }
    }

    private void requireNotFinalized(Listing listing) {
        if (listing.isFinalized()) {
            throw new StateException("LISTING_FINALIZED", "Listing " + listing.getId() + " is finalized");
        }
    }

    private void requireAuction(Listing listing) {
        if (!listing.getDetails().type().isAuction()) {
            throw new StateException("NOT_AUCTION", "Listing " + listing.getId() + " is not an auction");
        }
    }

    private Address custodian() {
        return admin.current().custodian();
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private void emit(MarketplaceEventType type, Listing listing, Address actor, BigInteger amount,
                      Map<String, Object> metadata) {
        eventBus.emit(new MarketplaceEvent(type, listing.getId(), actor, amount, now(), metadata));
    }
}
