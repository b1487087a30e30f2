package com.auctionhouse.core.repository;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.Listing;

import java.util.List;
import java.util.Optional;

/**
 * Listing storage. Listings are never deleted once an operation has committed them.
 */
public interface ListingRepository {

    long nextId();

    Listing save(Listing listing);

    Optional<Listing> findById(long id);

    List<Listing> findAll();

    List<Listing> findBySeller(Address seller);

    /**
     * Removes a listing whose creation was rolled back.
     */
    void discard(long id);
}
