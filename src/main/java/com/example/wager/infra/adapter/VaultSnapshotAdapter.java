package com.example.wager.infra.adapter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.wager.application.domain.vault.VaultSnapshot;
import com.example.wager.application.port.VaultSnapshotRepositoryPort;
import com.example.wager.infra.repository.VaultSnapshotRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class VaultSnapshotAdapter implements VaultSnapshotRepositoryPort {

	private final VaultSnapshotRepository vaultSnapshotRepository;

	@Override
	public void save(VaultSnapshot snapshot) {
		vaultSnapshotRepository.save(snapshot);
	}

	@Override
	public Optional<VaultSnapshot> findLatest() {
		return vaultSnapshotRepository.findLatest();
	}

	@Override
	public List<VaultSnapshot> findSince(Instant since) {
		return vaultSnapshotRepository.findSince(since);
	}

	@Override
	public int deleteOlderThan(Instant cutoff) {
		return vaultSnapshotRepository.deleteOlderThan(cutoff);
	}
}
