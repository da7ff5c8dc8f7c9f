package com.flagship.fx_ledger.balance;

import com.flagship.fx_ledger.currency.CurrencyCode;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for balance rows.
 */
@Repository
public interface BalanceRepository extends JpaRepository<BalanceEntity, UUID> {

    /**
     * Creates a zeroed row unless one already exists for the key.
     * A concurrent insert of the same key waits on the unique index and then
     * does nothing, so duplicates are impossible.
     *
     * @return 1 if a row was inserted, 0 otherwise
     */
    @Modifying
    @Query(value = """
        INSERT INTO wallet_balances (id, owner_id, currency, total, locked, available, created_at, updated_at)
        VALUES (gen_random_uuid(), :ownerId, :currency, 0, 0, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        ON CONFLICT (owner_id, currency) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("ownerId") String ownerId, @Param("currency") String currency);

    Optional<BalanceEntity> findByOwnerIdAndCurrency(String ownerId, CurrencyCode currency);

    /**
     * Reads a row with a pessimistic write lock (SELECT ... FOR UPDATE).
     * Callers must invoke this in canonical key order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BalanceEntity b WHERE b.ownerId = :ownerId AND b.currency = :currency")
    Optional<BalanceEntity> findForUpdate(@Param("ownerId") String ownerId,
                                          @Param("currency") CurrencyCode currency);

    List<BalanceEntity> findByOwnerIdOrderByCurrencyAsc(String ownerId);

    /**
     * Scopes the Postgres lock wait to the current transaction.
     */
    @Query(value = "SELECT set_config('lock_timeout', :timeout, true)", nativeQuery = true)
    String setLocalLockTimeout(@Param("timeout") String timeout);
}
