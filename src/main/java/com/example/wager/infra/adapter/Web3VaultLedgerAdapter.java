package com.example.wager.infra.adapter;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.utils.Numeric;

import com.example.wager.application.domain.error.TransientInfrastructureException;
import com.example.wager.application.domain.vault.VaultReading;
import com.example.wager.application.port.VaultLedgerPort;

import lombok.extern.slf4j.Slf4j;

/**
 * 以 eth_call 讀取 ERC-4626 金庫合約的 totalAssets() / totalSupply()
 *
 * <p>
 * 兩個數值固定在同一個區塊高度讀取，避免讀到不同區塊的資產與份額。
 * </p>
 */
@Slf4j
public class Web3VaultLedgerAdapter implements VaultLedgerPort {

	private final Web3j web3j;
	private final String contractAddress;

	public Web3VaultLedgerAdapter(Web3j web3j, String contractAddress) {
		this.web3j = web3j;
		this.contractAddress = contractAddress;
	}

	@Override
	public VaultReading fetch() {
		try {
			BigInteger blockNumber = web3j.ethBlockNumber().send().getBlockNumber();
			DefaultBlockParameter block = DefaultBlockParameter.valueOf(blockNumber);
			BigInteger totalAssets = callUint256("totalAssets", block);
			BigInteger totalShares = callUint256("totalSupply", block);
			return new VaultReading(totalAssets, totalShares, blockNumber);
		} catch (TransientInfrastructureException e) {
			throw e;
		} catch (IOException | RuntimeException e) {
			throw new TransientInfrastructureException("金庫合約讀取失敗: " + e.getMessage(), e);
		}
	}

	/**
	 * 無參數、回傳單一 uint256 的 view 函式；回傳值為 32 bytes 無號整數
	 */
	private BigInteger callUint256(String name, DefaultBlockParameter block) throws IOException {
		Function function = new Function(name, Collections.emptyList(), Collections.emptyList());
		String encoded = FunctionEncoder.encode(function);
		EthCall response = web3j
				.ethCall(Transaction.createEthCallTransaction(null, contractAddress, encoded), block).send();
		if (response.hasError()) {
			throw new TransientInfrastructureException(name + "() 呼叫失敗: " + response.getError().getMessage());
		}
		String value = response.getValue();
		if (value == null || Numeric.cleanHexPrefix(value).isEmpty()) {
			throw new TransientInfrastructureException(name + "() 回傳空值 (合約位址 " + contractAddress + ")");
		}
		BigInteger result = Numeric.toBigInt(value);
		log.debug(">>> [Vault] {}() = {} @ {}", name, result, block.getValue());
		return result;
	}
}
