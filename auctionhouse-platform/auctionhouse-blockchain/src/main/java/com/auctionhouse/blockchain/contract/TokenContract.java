package com.auctionhouse.blockchain.contract;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicBytes;
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
 * Token collection - Web3j wrapper over the transfer entry points of
 * single-unique (ERC-721) and multi-unit (ERC-1155) collections.
 *
 * The marketplace account must be approved as operator for the owner's
 * tokens before custody can be taken.
 *
 * Solidity equivalent:
 * interface IERC721 {
 *     function safeTransferFrom(address from, address to, uint256 tokenId) external;
 *     function ownerOf(uint256 tokenId) external view returns (address);
 * }
 * interface IERC1155 {
 *     function safeTransferFrom(address from, address to, uint256 id, uint256 amount, bytes calldata data) external;
 *     function balanceOf(address account, uint256 id) external view returns (uint256);
 * }
 * interface Ownable {
 *     function owner() external view returns (address);
 * }
 *
 * The collection owner is taken as the creator of its tokens.
 */
public class TokenContract extends Contract {

    public static final String BINARY = "";

    public static final String FUNC_SAFETRANSFERFROM = "safeTransferFrom";
    public static final String FUNC_OWNEROF = "ownerOf";
    public static final String FUNC_BALANCEOF = "balanceOf";
    public static final String FUNC_OWNER = "owner";

    protected TokenContract(String contractAddress, Web3j web3j, Credentials credentials,
                            ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    /**
     * Transfers a single-unique token.
     */
    public RemoteFunctionCall<TransactionReceipt> safeTransferFrom(String from, String to, BigInteger tokenId) {
        return executeRemoteCallTransaction(uniqueTransferFunction(from, to, tokenId));
    }

    /**
     * Transfers {@code amount} units of a multi-unit token.
     */
    public RemoteFunctionCall<TransactionReceipt> safeTransferFrom(String from, String to, BigInteger tokenId,
                                                                   BigInteger amount) {
        return executeRemoteCallTransaction(multiUnitTransferFunction(from, to, tokenId, amount));
    }

    public RemoteFunctionCall<String> ownerOf(BigInteger tokenId) {
        final Function function = new Function(
                FUNC_OWNEROF,
                Arrays.asList(new Uint256(tokenId)),
                Arrays.asList(new TypeReference<Address>() {}));
        return executeRemoteCallSingleValueReturn(function, String.class);
    }

    public RemoteFunctionCall<BigInteger> balanceOf(String account, BigInteger tokenId) {
        final Function function = new Function(
                FUNC_BALANCEOF,
                Arrays.asList(new Address(account), new Uint256(tokenId)),
                Arrays.asList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    public RemoteFunctionCall<String> owner() {
        return executeRemoteCallSingleValueReturn(ownerFunction(), String.class);
    }

    public static Function ownerFunction() {
        return new Function(
                FUNC_OWNER,
                Collections.emptyList(),
                Arrays.asList(new TypeReference<Address>() {}));
    }

    public static Function uniqueTransferFunction(String from, String to, BigInteger tokenId) {
        return new Function(
                FUNC_SAFETRANSFERFROM,
                Arrays.asList(new Address(from), new Address(to), new Uint256(tokenId)),
                Collections.emptyList());
    }

    public static Function multiUnitTransferFunction(String from, String to, BigInteger tokenId, BigInteger amount) {
        return new Function(
                FUNC_SAFETRANSFERFROM,
                Arrays.asList(new Address(from), new Address(to), new Uint256(tokenId), new Uint256(amount),
                        new DynamicBytes(new byte[0])),
                Collections.emptyList());
    }

    /**
     * Loads an existing contract at the given address.
     */
    public static TokenContract load(String contractAddress, Web3j web3j,
                                     Credentials credentials, ContractGasProvider gasProvider) {
        return new TokenContract(contractAddress, web3j, credentials, gasProvider);
    }
}
