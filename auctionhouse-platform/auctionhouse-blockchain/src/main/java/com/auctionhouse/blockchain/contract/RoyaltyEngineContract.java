package com.auctionhouse.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Royalty Engine Smart Contract - Web3j wrapper.
 *
 * Resolves the royalty recipients and amounts registered for a token,
 * whichever royalty standard the token collection implements.
 *
 * Solidity equivalent:
 * interface IRoyaltyEngineV1 {
 *     function getRoyaltyView(address tokenAddress, uint256 tokenId, uint256 value)
 *         external view returns (address payable[] memory recipients, uint256[] memory amounts);
 * }
 */
public class RoyaltyEngineContract extends Contract {

    /**
     * The engine is deployed by its maintainers; this wrapper only loads it.
     */
    public static final String BINARY = "";

    public static final String FUNC_GETROYALTYVIEW = "getRoyaltyView";

    protected RoyaltyEngineContract(String contractAddress, Web3j web3j, Credentials credentials,
                                    ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Gets the royalties owed when the token sells for {@code value}.
     */
    public RemoteFunctionCall<List<Type>> getRoyaltyView(String tokenAddress, BigInteger tokenId, BigInteger value) {
        return executeRemoteCallMultipleValueReturn(getRoyaltyViewFunction(tokenAddress, tokenId, value));
    }

    public static Function getRoyaltyViewFunction(String tokenAddress, BigInteger tokenId, BigInteger value) {
        return new Function(
                FUNC_GETROYALTYVIEW,
                Arrays.asList(new Address(tokenAddress), new Uint256(tokenId), new Uint256(value)),
                Arrays.asList(
                        new TypeReference<DynamicArray<Address>>() {},  // recipients
                        new TypeReference<DynamicArray<Uint256>>() {}   // amounts
                ));
    }

    /**
     * Pairs the decoded recipient and amount arrays.
     *
     * @throws IllegalArgumentException if the arrays are missing or differ in length
     */
    @SuppressWarnings("unchecked")
    public static List<RoyaltyShare> decodeRoyalties(List<Type> values) {
        if (values == null || values.size() != 2) {
            throw new IllegalArgumentException("Royalty engine returned " + (values == null ? 0 : values.size())
                    + " values, expected 2");
        }
        List<Address> recipients = ((DynamicArray<Address>) values.get(0)).getValue();
        List<Uint256> amounts = ((DynamicArray<Uint256>) values.get(1)).getValue();
        if (recipients.size() != amounts.size()) {
            throw new IllegalArgumentException("Royalty engine returned " + recipients.size()
                    + " recipients for " + amounts.size() + " amounts");
        }
        List<RoyaltyShare> shares = new ArrayList<>(recipients.size());
        for (int i = 0; i < recipients.size(); i++) {
            shares.add(new RoyaltyShare(recipients.get(i).getValue(), amounts.get(i).getValue()));
        }
        return shares;
    }

    /**
     * Loads an existing contract at the given address.
     */
    public static RoyaltyEngineContract load(String contractAddress, Web3j web3j,
                                             Credentials credentials, ContractGasProvider gasProvider) {
        return new RoyaltyEngineContract(contractAddress, web3j, credentials, gasProvider);
    }

    public record RoyaltyShare(String recipient, BigInteger amount) {}
}
