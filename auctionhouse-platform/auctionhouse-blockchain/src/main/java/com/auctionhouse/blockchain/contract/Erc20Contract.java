package com.auctionhouse.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * ERC-20 payment currency - Web3j wrapper.
 *
 * Solidity equivalent:
 * interface IERC20 {
 *     function transfer(address to, uint256 amount) external returns (bool);
 *     function transferFrom(address from, address to, uint256 amount) external returns (bool);
 *     function allowance(address owner, address spender) external view returns (uint256);
 * }
 */
public class Erc20Contract extends Contract {

    public static final String BINARY = "";

    public static final String FUNC_TRANSFER = "transfer";
    public static final String FUNC_TRANSFERFROM = "transferFrom";
    public static final String FUNC_ALLOWANCE = "allowance";

    protected Erc20Contract(String contractAddress, Web3j web3j, Credentials credentials,
                            ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Pays from the marketplace account.
     */
    public RemoteFunctionCall<TransactionReceipt> transfer(String to, BigInteger amount) {
        return executeRemoteCallTransaction(transferFunction(to, amount));
    }

    /**
     * Pulls from an account that approved the marketplace as spender.
     */
    public RemoteFunctionCall<TransactionReceipt> transferFrom(String from, String to, BigInteger amount) {
        return executeRemoteCallTransaction(transferFromFunction(from, to, amount));
    }

    public RemoteFunctionCall<BigInteger> allowance(String owner, String spender) {
        final Function function = new Function(
                FUNC_ALLOWANCE,
                Arrays.asList(new Address(owner), new Address(spender)),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public static Function transferFunction(String to, BigInteger amount) {
        return new Function(
                FUNC_TRANSFER,
                Arrays.asList(new Address(to), new Uint256(amount)),
                Collections.emptyList());
    }

    public static Function transferFromFunction(String from, String to, BigInteger amount) {
        return new Function(
                FUNC_TRANSFERFROM,
                Arrays.asList(new Address(from), new Address(to), new Uint256(amount)),
                Collections.emptyList());
    }

    /**
     * Loads an existing contract at the given address.
     */
    public static Erc20Contract load(String contractAddress, Web3j web3j,
                                     Credentials credentials, ContractGasProvider gasProvider) {
        return new Erc20Contract(contractAddress, web3j, credentials, gasProvider);
    }
}
