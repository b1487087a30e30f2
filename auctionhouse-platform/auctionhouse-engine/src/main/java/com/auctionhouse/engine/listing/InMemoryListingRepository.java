package com.auctionhouse.engine.listing;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.Listing;
import com.auctionhouse.core.repository.ListingRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory listing storage. Ids are assigned monotonically from 1.
 */
public class InMemoryListingRepository implements ListingRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, Listing> listings = new ConcurrentHashMap<>();

    @Override
    public long nextId() {
        return sequence.incrementAndGet();
    }

    @Override
    public Listing save(Listing listing) {
        Objects.requireNonNull(listing, "Listing cannot be null");
        listings.put(listing.getId(), listing);
        return listing;
    }

    @Override
    public Optional<Listing> findById(long id) {
        return Optional.ofNullable(listings.get(id));
    }

    @Override
    public List<Listing> findAll() {
        return listings.values().stream()
                .sorted(Comparator.comparingLong(Listing::getId))
                .toList();
    }

    @Override
    public List<Listing> findBySeller(Address seller) {
        return listings.values().stream()
                .filter(listing -> listing.getSeller().equals(seller))
                .sorted(Comparator.comparingLong(Listing::getId))
                .toList();
    }

    @Override
    public void discard(long id) {
        listings.remove(id);
    }
}
