package com.auctionhouse.api.config;

import com.auctionhouse.blockchain.service.BlockchainConnection;
import com.auctionhouse.blockchain.service.BlockchainRoyaltyLookupService;
import com.auctionhouse.blockchain.service.BlockchainSellerAuthorizationService;
import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.repository.ListingRepository;
import com.auctionhouse.core.spi.AssetTransferProvider;
import com.auctionhouse.core.spi.PaymentTransferProvider;
import com.auctionhouse.engine.config.MarketplaceAdmin;
import com.auctionhouse.engine.config.MarketplaceConfig;
import com.auctionhouse.engine.escrow.EscrowLedger;
import com.auctionhouse.engine.escrow.FeeLedger;
import com.auctionhouse.engine.event.EventBus;
import com.auctionhouse.engine.listing.InMemoryListingRepository;
import com.auctionhouse.engine.listing.ListingStateMachine;
import com.auctionhouse.engine.settlement.PaymentDispatcher;
import com.auctionhouse.engine.settlement.SettlementEngine;
import com.auctionhouse.engine.support.OperationGuard;
import com.auctionhouse.engine.validation.ListingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the marketplace engine. One operation guard is shared by every
 * component that mutates marketplace state.
 */
@Configuration
@EnableConfigurationProperties(MarketplaceProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock marketplaceClock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperationGuard operationGuard() {
        return new OperationGuard();
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean
    public EscrowLedger escrowLedger(PaymentTransferProvider payments, OperationGuard guard,
                                     EventBus eventBus, Clock clock) {
        return new EscrowLedger(payments, guard, eventBus, clock);
    }

    @Bean
    public FeeLedger feeLedger(PaymentTransferProvider payments) {
        return new FeeLedger(payments);
    }

    @Bean
    public PaymentDispatcher paymentDispatcher(PaymentTransferProvider payments, EscrowLedger escrowLedger) {
        return new PaymentDispatcher(payments, escrowLedger);
    }

    @Bean
    public SettlementEngine settlementEngine(PaymentDispatcher dispatcher, FeeLedger feeLedger) {
        return new SettlementEngine(dispatcher, feeLedger);
    }

    @Bean
    public ListingValidator listingValidator() {
        return new ListingValidator();
    }

    @Bean
    public ListingRepository listingRepository() {
        return new InMemoryListingRepository();
    }

    @Bean
    public CollaboratorRegistry collaboratorRegistry() {
        return new CollaboratorRegistry();
    }

    @Bean
    public MarketplaceConfig initialMarketplaceConfig(MarketplaceProperties properties,
                                                      BlockchainConnection connection,
                                                      BlockchainSellerAuthorizationService sellerRegistry,
                                                      BlockchainRoyaltyLookupService royaltyEngine) {
        Set<Address> admins = properties.getAdmins().stream()
                .map(Address::of)
                .collect(Collectors.toSet());
        MarketplaceConfig config = new MarketplaceConfig(
                1,
                properties.isEnabled(),
                properties.getMarketplaceFeeBps(),
                properties.getReferrerBps(),
                custodian(properties, connection),
                admins,
                sellerRegistry.isEnabled() ? sellerRegistry : null,
                royaltyEngine.isEnabled() ? royaltyEngine : null,
                properties.offerPolicy());
        log.info("Marketplace configured: custodian={}, admins={}, fee={}bps, referrer={}bps, registry={}, royalties={}",
                config.custodian(), admins.size(), config.marketplaceFeeBPS(), config.referrerBPS(),
                config.sellerAuthorization() != null, config.royaltyLookup() != null);
        return config;
    }

    /**
     * The custodian is the account that holds custodied tokens and collected
     * funds. With a live connection that is the signing account; a configured
     * custodian must then name the same account.
     */
    static Address custodian(MarketplaceProperties properties, BlockchainConnection connection) {
        String configured = properties.getCustodian();
        boolean hasConfigured = configured != null && !configured.isBlank();
        if (connection.accountAddress().isEmpty()) {
            if (!hasConfigured) {
                throw new IllegalStateException(
                        "auctionhouse.marketplace.custodian is required without a blockchain connection");
            }
            return Address.of(configured);
        }
        Address signer = Address.of(connection.accountAddress().get());
        if (hasConfigured && !Address.of(configured).equals(signer)) {
            throw new IllegalStateException("Configured custodian " + configured
                    + " does not match the signing account " + signer);
        }
        return signer;
    }

    @Bean
    public MarketplaceAdmin marketplaceAdmin(MarketplaceConfig initialMarketplaceConfig, FeeLedger feeLedger,
                                             OperationGuard guard, EventBus eventBus, Clock clock) {
        return new MarketplaceAdmin(initialMarketplaceConfig, feeLedger, guard, eventBus, clock);
    }

    @Bean
    public ListingStateMachine listingStateMachine(ListingRepository repository, ListingValidator validator,
                                                   SettlementEngine settlement, PaymentDispatcher dispatcher,
                                                   FeeLedger feeLedger, MarketplaceAdmin admin,
                                                   AssetTransferProvider assets, PaymentTransferProvider payments,
                                                   CollaboratorRegistry collaborators, EventBus eventBus,
                                                   OperationGuard guard, Clock clock) {
        return new ListingStateMachine(repository, validator, settlement, dispatcher, feeLedger, admin,
                assets, payments, collaborators, eventBus, guard, clock);
    }
}
