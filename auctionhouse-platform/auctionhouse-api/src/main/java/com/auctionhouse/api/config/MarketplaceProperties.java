package com.auctionhouse.api.config;

import com.auctionhouse.engine.config.MarketplaceConfig;
import com.auctionhouse.engine.config.OfferPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Initial marketplace settings. Applied once at startup; later changes go
 * through the administrator surface.
 */
@Validated
@ConfigurationProperties(prefix = "auctionhouse.marketplace")
public class MarketplaceProperties {

    /** Required unless a blockchain connection supplies the signing account. */
    private String custodian;

    @NotEmpty
    private List<String> admins = new ArrayList<>();

    private boolean enabled = true;

    @Min(0)
    @Max(MarketplaceConfig.MAX_FEE_BPS)
    private int marketplaceFeeBps = 0;

    @Min(0)
    @Max(MarketplaceConfig.MAX_FEE_BPS)
    private int referrerBps = 0;

    @Min(0)
    private long offerRescindGraceSeconds = OfferPolicy.DEFAULT_GRACE_SECONDS;

    private boolean auctionOffersRescindableAfterBid = true;
    private boolean sellerRescindRequiresEnd = true;

    public String getCustodian() { return custodian; }
    public void setCustodian(String custodian) { this.custodian = custodian; }
    public List<String> getAdmins() { return admins; }
    public void setAdmins(List<String> admins) { this.admins = admins; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getMarketplaceFeeBps() { return marketplaceFeeBps; }
    public void setMarketplaceFeeBps(int bps) { this.marketplaceFeeBps = bps; }
    public int getReferrerBps() { return referrerBps; }
    public void setReferrerBps(int bps) { this.referrerBps = bps; }
    public long getOfferRescindGraceSeconds() { return offerRescindGraceSeconds; }
    public void setOfferRescindGraceSeconds(long seconds) { this.offerRescindGraceSeconds = seconds; }
    public boolean isAuctionOffersRescindableAfterBid() { return auctionOffersRescindableAfterBid; }
    public void setAuctionOffersRescindableAfterBid(boolean value) { this.auctionOffersRescindableAfterBid = value; }
    public boolean isSellerRescindRequiresEnd() { return sellerRescindRequiresEnd; }
    public void setSellerRescindRequiresEnd(boolean value) { this.sellerRescindRequiresEnd = value; }

    public OfferPolicy offerPolicy() {
        return new OfferPolicy(offerRescindGraceSeconds, auctionOffersRescindableAfterBid, sellerRescindRequiresEnd);
    }
}
