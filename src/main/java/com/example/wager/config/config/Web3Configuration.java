package com.example.wager.config.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import com.example.wager.application.port.VaultLedgerPort;
import com.example.wager.infra.adapter.Web3VaultLedgerAdapter;

import lombok.extern.slf4j.Slf4j;

/**
 * 金庫合約的 JSON-RPC 連線
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "wager.vault.enabled", havingValue = "true", matchIfMissing = true)
public class Web3Configuration {

	@Bean(destroyMethod = "shutdown")
	public Web3j web3j(WagerProperties properties) {
		log.info(">>> [Vault] 連線 RPC: {}", properties.getVault().getRpcUrl());
		return Web3j.build(new HttpService(properties.getVault().getRpcUrl()));
	}

	@Bean
	public VaultLedgerPort vaultLedgerPort(Web3j web3j, WagerProperties properties) {
		return new Web3VaultLedgerAdapter(web3j, properties.getVault().getContractAddress());
	}
}
