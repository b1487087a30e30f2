package com.auctionhouse.blockchain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for blockchain connectivity.
 */
@Configuration
@ConfigurationProperties(prefix = "auctionhouse.blockchain")
public class BlockchainConfig {

    private String nodeUrl = "http://localhost:8545";
    private String royaltyEngineAddress;
    private String sellerRegistryAddress;
    private String wrappedNativeAddress;
    private String privateKey;
    private long gasPrice = 20_000_000_000L; // 20 Gwei
    private long gasLimit = 6_721_975L;
    private boolean enabled = false;

    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getRoyaltyEngineAddress() { return royaltyEngineAddress; }
    public void setRoyaltyEngineAddress(String addr) { this.royaltyEngineAddress = addr; }
    public String getSellerRegistryAddress() { return sellerRegistryAddress; }
    public void setSellerRegistryAddress(String addr) { this.sellerRegistryAddress = addr; }
    public String getWrappedNativeAddress() { return wrappedNativeAddress; }
    public void setWrappedNativeAddress(String addr) { this.wrappedNativeAddress = addr; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public long getGasPrice() { return gasPrice; }
    public void setGasPrice(long gasPrice) { this.gasPrice = gasPrice; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
