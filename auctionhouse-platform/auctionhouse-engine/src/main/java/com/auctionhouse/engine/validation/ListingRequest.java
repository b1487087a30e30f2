package com.auctionhouse.engine.validation;

import com.auctionhouse.core.domain.DeliveryFees;
import com.auctionhouse.core.domain.ListingDetails;
import com.auctionhouse.core.domain.RevenueReceiver;
import com.auctionhouse.core.domain.TokenReference;

import java.util.List;
import java.util.Objects;

/**
 * A seller's request to create a listing.
 *
 * @param enableReferrer pay the marketplace referrer rate to buyer-named referrers
 * @param acceptOffers   accept offers on an auction until its first bid
 * @param contextData    opaque data handed to the seller registry
 */
public record ListingRequest(
        ListingDetails details,
        TokenReference token,
        List<RevenueReceiver> receivers,
        DeliveryFees deliveryFees,
        boolean enableReferrer,
        boolean acceptOffers,
        byte[] contextData
) {
    public ListingRequest {
        Objects.requireNonNull(details, "Listing details cannot be null");
        Objects.requireNonNull(token, "Token reference cannot be null");
        receivers = receivers != null ? List.copyOf(receivers) : List.of();
        deliveryFees = deliveryFees != null ? deliveryFees : DeliveryFees.NONE;
        contextData = contextData != null ? contextData.clone() : new byte[0];
    }

    public static ListingRequest of(ListingDetails details, TokenReference token) {
        return new ListingRequest(details, token, List.of(), DeliveryFees.NONE, false, false, null);
    }

    public ListingRequest withReceivers(List<RevenueReceiver> newReceivers) {
        return new ListingRequest(details, token, newReceivers, deliveryFees, enableReferrer, acceptOffers,
                contextData);
    }

    public ListingRequest withDeliveryFees(DeliveryFees fees) {
        return new ListingRequest(details, token, receivers, fees, enableReferrer, acceptOffers, contextData);
    }

    public ListingRequest withReferrer() {
        return new ListingRequest(details, token, receivers, deliveryFees, true, acceptOffers, contextData);
    }

    public ListingRequest withOffers() {
        return new ListingRequest(details, token, receivers, deliveryFees, enableReferrer, true, contextData);
    }

    public ListingRequest withContextData(byte[] data) {
        return new ListingRequest(details, token, receivers, deliveryFees, enableReferrer, acceptOffers, data);
    }

    @Override
    public byte[] contextData() {
        return contextData.clone();
    }
}
