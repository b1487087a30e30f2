package com.auctionhouse.core.domain;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A seller's listing together with its live bid and offer ledger.
 *
 * Mutated only by the listing state machine. Once finalized, every mutator
 * throws {@link IllegalStateException}.
 */
public class Listing {

    private final long id;
    private final Address seller;
    private final int marketplaceBPS;
    private final int referrerBPS;
    private final TokenReference token;
    private final List<RevenueReceiver> receivers;
    private final DeliveryFees deliveryFees;
    private final boolean tokenCreator;
    private final long createdAt;

    private ListingDetails details;
    private boolean finalized;
    private long totalSold;
    private Bid bid;
    private boolean acceptOffers;
    private final Map<Address, Offer> offers;

    private Listing(long id, Address seller, int marketplaceBPS, int referrerBPS, ListingDetails details,
                    TokenReference token, List<RevenueReceiver> receivers, DeliveryFees deliveryFees,
                    boolean acceptOffers, boolean tokenCreator, long createdAt) {
        this.id = id;
        this.seller = seller;
        this.marketplaceBPS = marketplaceBPS;
        this.referrerBPS = referrerBPS;
        this.details = details;
        this.token = token;
        this.receivers = List.copyOf(receivers);
        this.deliveryFees = deliveryFees;
        this.acceptOffers = acceptOffers;
        this.tokenCreator = tokenCreator;
        this.createdAt = createdAt;
        this.offers = new LinkedHashMap<>();
    }

    public static Listing create(long id, Address seller, int marketplaceBPS, int referrerBPS,
                                 ListingDetails details, TokenReference token, List<RevenueReceiver> receivers,
                                 DeliveryFees deliveryFees, boolean acceptOffers, boolean tokenCreator,
                                 long createdAt) {
        Objects.requireNonNull(seller, "Seller cannot be null");
        Objects.requireNonNull(details, "Listing details cannot be null");
        Objects.requireNonNull(token, "Token reference cannot be null");
        return new Listing(id, seller, marketplaceBPS, referrerBPS, details, token,
                receivers != null ? receivers : List.of(),
                deliveryFees != null ? deliveryFees : DeliveryFees.NONE,
                acceptOffers, tokenCreator, createdAt);
    }

    /**
     * Deep copy used to roll an operation back when an asset movement fails.
     */
    public Listing copy() {
        Listing copy = new Listing(id, seller, marketplaceBPS, referrerBPS, details, token, receivers,
                deliveryFees, acceptOffers, tokenCreator, createdAt);
        copy.finalized = finalized;
        copy.totalSold = totalSold;
        copy.bid = bid;
        copy.offers.putAll(offers);
        return copy;
    }

    public ListingPhase phase(long now) {
        if (finalized) {
            return ListingPhase.FINALIZED;
        }
        if (details.startsOnFirstAction() || now < details.startTime()) {
            return ListingPhase.OPEN;
        }
        return now < details.endTime() ? ListingPhase.ACTIVE : ListingPhase.ENDED;
    }

    public boolean hasStarted() {
        return !details.startsOnFirstAction();
    }

    public boolean hasEnded(long now) {
        return hasStarted() && now >= details.endTime();
    }

    public boolean hasBid() {
        return bid != null;
    }

    public boolean hasActivity() {
        return bid != null || totalSold > 0 || offers.values().stream().anyMatch(Offer::accepted);
    }

    public long remainingUnits() {
        return details.totalAvailable() - totalSold;
    }

    // Mutators

    public void start(long now) {
        requireOpen();
        this.details = details.startingAt(now);
    }

    public void updateDetails(ListingDetails newDetails) {
        requireOpen();
        this.details = Objects.requireNonNull(newDetails, "Listing details cannot be null");
    }

    public void extendTo(long newEndTime) {
        requireOpen();
        this.details = details.withEndTime(newEndTime);
    }

    public void recordSale(long units) {
        requireOpen();
        if (units <= 0 || totalSold + units > details.totalAvailable()) {
            throw new IllegalStateException("Sale of " + units + " units exceeds remaining " + remainingUnits());
        }
        this.totalSold += units;
    }

    public void replaceBid(Bid newBid) {
        requireOpen();
        this.bid = newBid;
    }

    public void disableOffers() {
        this.acceptOffers = false;
    }

    public void putOffer(Offer offer) {
        requireOpen();
        offers.put(offer.offerer(), offer);
    }

    public Offer removeOffer(Address offerer) {
        return offers.remove(offerer);
    }

    public void markFinalized() {
        requireOpen();
        this.finalized = true;
    }

    private void requireOpen() {
        if (finalized) {
            throw new IllegalStateException("Listing " + id + " is finalized");
        }
    }

    // Getters
    public long getId() { return id; }
    public Address getSeller() { return seller; }
    public int getMarketplaceBPS() { return marketplaceBPS; }
    public int getReferrerBPS() { return referrerBPS; }
    public ListingDetails getDetails() { return details; }
    public TokenReference getToken() { return token; }
    public List<RevenueReceiver> getReceivers() { return receivers; }
    public DeliveryFees getDeliveryFees() { return deliveryFees; }
    public boolean isTokenCreator() { return tokenCreator; }
    public long getCreatedAt() { return createdAt; }
    public boolean isFinalized() { return finalized; }
    public long getTotalSold() { return totalSold; }
    public boolean isAcceptOffers() { return acceptOffers; }
    public Optional<Bid> getBid() { return Optional.ofNullable(bid); }
    public Optional<Offer> getOffer(Address offerer) { return Optional.ofNullable(offers.get(offerer)); }
    public Collection<Offer> getOffers() { return Collections.unmodifiableCollection(new ArrayList<>(offers.values())); }

    public Address getCurrency() {
        return details.currency();
    }

    public BigInteger getInitialAmount() {
        return details.initialAmount();
    }
}
