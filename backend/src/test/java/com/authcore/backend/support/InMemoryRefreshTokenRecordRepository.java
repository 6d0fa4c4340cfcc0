package com.authcore.backend.support;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

import com.authcore.backend.modules.auth.domain.RefreshTokenRecord;
import com.authcore.backend.modules.auth.domain.RevocationReason;
import com.authcore.backend.modules.auth.infrastructure.persistence.RefreshTokenRecordRepository;

public class InMemoryRefreshTokenRecordRepository implements RefreshTokenRecordRepository {

    private final Map<UUID, RefreshTokenRecord> records = new LinkedHashMap<>();
    private final LockJournal lockJournal;

    public InMemoryRefreshTokenRecordRepository(LockJournal lockJournal) {
        this.lockJournal = lockJournal;
    }

    @Override
    public RefreshTokenRecord save(RefreshTokenRecord record) {
        if (record.getId() == null) {
            TestEntities.withId(record, UUID.randomUUID());
        }
        records.put(record.getId(), record);
        return record;
    }

    @Override
    public Optional<RefreshTokenRecord> findById(UUID id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public Optional<RefreshTokenRecord> findByTokenValueForUpdate(String tokenValue) {
        lockJournal.record("refresh_token_record", tokenValue);
        return records.values().stream()
                .filter(record -> record.getTokenValue().equals(tokenValue))
                .findFirst();
    }

    @Override
    public List<RefreshTokenRecord> findActiveByAccountId(UUID accountId, OffsetDateTime now) {
        return records.values().stream()
                .filter(record -> record.getAccount().getId().equals(accountId))
                .filter(record -> record.isActiveAt(now))
                .sorted(Comparator.comparing(RefreshTokenRecord::getSessionStartedAt).reversed())
                .toList();
    }

    @Override
    public int revokeAllByAccountId(UUID accountId, OffsetDateTime revokedAt, RevocationReason reason) {
        return revokeWhere(record -> record.getAccount().getId().equals(accountId), revokedAt, reason);
    }

    @Override
    public int revokeFamily(UUID accountId, UUID familyId, OffsetDateTime revokedAt, RevocationReason reason) {
        return revokeWhere(record -> record.getAccount().getId().equals(accountId)
                && record.getFamilyId().equals(familyId), revokedAt, reason);
    }

    @Override
    public int deleteStale(OffsetDateTime now, OffsetDateTime revokedBefore) {
        List<UUID> stale = new ArrayList<>();
        for (RefreshTokenRecord record : records.values()) {
            boolean expired = record.getExpiresAt().isBefore(now);
            boolean longRevoked = record.getRevokedAt() != null && record.getRevokedAt().isBefore(revokedBefore);
            if (expired || longRevoked) {
                stale.add(record.getId());
            }
        }
        stale.forEach(records::remove);
        return stale.size();
    }

    public List<RefreshTokenRecord> all() {
        return List.copyOf(records.values());
    }

    public List<RefreshTokenRecord> activeAt(OffsetDateTime now) {
        return records.values().stream().filter(record -> record.isActiveAt(now)).toList();
    }

    private int revokeWhere(Predicate<RefreshTokenRecord> filter, OffsetDateTime revokedAt,
                            RevocationReason reason) {
        int count = 0;
        for (RefreshTokenRecord record : records.values()) {
            if (record.getRevokedAt() == null && filter.test(record)) {
                record.setRevokedAt(revokedAt);
                record.setRevokedReason(reason);
                count++;
            }
        }
        return count;
    }
}
