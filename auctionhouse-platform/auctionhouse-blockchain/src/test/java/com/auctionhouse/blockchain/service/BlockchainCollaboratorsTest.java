package com.auctionhouse.blockchain.service;

import com.auctionhouse.core.domain.Address;
import com.auctionhouse.core.domain.TokenReference;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Collaborators over a disabled connection never reach a node and report
 * every movement as not delivered.
 */
class BlockchainCollaboratorsTest {

    private static final Address ACCOUNT = Address.of("0x00000000000000000000000000000000000000aa");
    private static final Address OTHER = Address.of("0x00000000000000000000000000000000000000bb");
    private static final Address USDC = Address.of("0x00000000000000000000000000000000000000cc");
    private static final String WRAPPED = "0x00000000000000000000000000000000000000dd";

    private static BlockchainConnection disabled() {
        BlockchainConfig config = new BlockchainConfig();
        config.setRoyaltyEngineAddress("0x00000000000000000000000000000000000000ee");
        config.setSellerRegistryAddress("0x00000000000000000000000000000000000000ff");
        return new BlockchainConnection(config);
    }

    @Test
    void defaultsMatchLocalDevelopmentNode() {
        BlockchainConfig config = new BlockchainConfig();

        assertThat(config.isEnabled()).isFalse();
        assertThat(config.getNodeUrl()).isEqualTo("http://localhost:8545");
        assertThat(config.getGasLimit()).isEqualTo(6_721_975L);
    }

    @Test
    void disabledConnectionSubmitsNothing() {
        BlockchainConnection connection = disabled();

        assertThat(connection.isEnabled()).isFalse();
        assertThat(connection.accountAddress()).isEmpty();
        assertThat(connection.submit("noop", () -> {
            throw new AssertionError("must not be called");
        })).isEmpty();
    }

    @Test
    void disabledProvidersReportFailure() {
        BlockchainConnection connection = disabled();
        BlockchainAssetTransferProvider assets = new BlockchainAssetTransferProvider(connection);
        BlockchainPaymentTransferProvider payments = new BlockchainPaymentTransferProvider(connection);
        TokenReference token = TokenReference.unique(USDC, 1);

        assertThat(assets.custody(ACCOUNT, token, 1)).isFalse();
        assertThat(assets.transfer(ACCOUNT, OTHER, token, 1)).isFalse();
        assertThat(payments.pay(ACCOUNT, BigInteger.TEN, Address.ZERO)).isFalse();
        assertThat(payments.collect(ACCOUNT, BigInteger.TEN, USDC)).isFalse();
    }

    @Test
    void disabledRegistryAndRoyaltyEngineAreInert() {
        BlockchainConnection connection = disabled();
        BlockchainSellerAuthorizationService registry = new BlockchainSellerAuthorizationService(connection);
        BlockchainRoyaltyLookupService royalties = new BlockchainRoyaltyLookupService(connection);

        assertThat(registry.isEnabled()).isFalse();
        assertThat(registry.isAuthorized(ACCOUNT, null)).isFalse();
        assertThat(royalties.isEnabled()).isFalse();
        assertThat(royalties.getRoyalty(TokenReference.unique(USDC, 1), BigInteger.TEN)).isEmpty();
        assertThat(royalties.isCreator(TokenReference.unique(USDC, 1), ACCOUNT)).isFalse();
    }

    @Test
    void creatorIsCollectionOwnerRegardlessOfCase() {
        assertThat(BlockchainRoyaltyLookupService.isSameAccount(ACCOUNT.toChecksum(), ACCOUNT)).isTrue();
        assertThat(BlockchainRoyaltyLookupService.isSameAccount(ACCOUNT.value(), OTHER)).isFalse();
        assertThat(BlockchainRoyaltyLookupService.isSameAccount(Address.ZERO.value(), Address.ZERO)).isFalse();
        assertThat(BlockchainRoyaltyLookupService.isSameAccount(null, ACCOUNT)).isFalse();
    }

    @Test
    void nativeCurrencyUsesWrappedTokenWhenConfigured() {
        BlockchainConnection connection = disabled();
        BlockchainPaymentTransferProvider payments = new BlockchainPaymentTransferProvider(connection);

        assertThat(payments.tokenFor(Address.ZERO)).isEmpty();
        assertThat(payments.tokenFor(USDC)).contains(USDC.value());

        connection.config().setWrappedNativeAddress(WRAPPED);
        assertThat(payments.tokenFor(Address.ZERO)).contains(WRAPPED);
        assertThat(payments.tokenFor(USDC)).contains(USDC.value());
    }
}
