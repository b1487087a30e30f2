package com.auctionhouse.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicBytes;
import org.web3j.abi.datatypes.Function;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.util.Arrays;

/**
 * Seller Registry Smart Contract - Web3j wrapper.
 *
 * Solidity equivalent:
 * interface IMarketplaceSellerRegistry {
 *     function isAuthorized(address seller, bytes calldata data) external view returns (bool);
 * }
 */
public class SellerRegistryContract extends Contract {

    public static final String BINARY = "";

    public static final String FUNC_ISAUTHORIZED = "isAuthorized";

    protected SellerRegistryContract(String contractAddress, Web3j web3j, Credentials credentials,
                                     ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Checks whether the seller may create listings.
     */
    public RemoteFunctionCall<Boolean> isAuthorized(String seller, byte[] data) {
        return executeRemoteCallSingleValueReturn(isAuthorizedFunction(seller, data), Boolean.class);
    }

    public static Function isAuthorizedFunction(String seller, byte[] data) {
        return new Function(
                FUNC_ISAUTHORIZED,
                Arrays.asList(new Address(seller), new DynamicBytes(data)),
                Arrays.asList(new TypeReference<Bool>() {}));
    }

    /**
     * Loads an existing contract at the given address.
     */
    public static SellerRegistryContract load(String contractAddress, Web3j web3j,
                                              Credentials credentials, ContractGasProvider gasProvider) {
        return new SellerRegistryContract(contractAddress, web3j, credentials, gasProvider);
    }
}
