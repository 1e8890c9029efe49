package com.nosota.groupbuy.repository;

import com.nosota.groupbuy.api.model.Asset;
import com.nosota.groupbuy.model.TokenAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TokenAccountRepository extends JpaRepository<TokenAccount, Long> {

    Optional<TokenAccount> findByAssetAndAccountId(Asset asset, String accountId);

    /**
     * Loads an account row with a write lock held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM TokenAccount a WHERE a.asset = :asset AND a.accountId = :accountId")
    Optional<TokenAccount> findForUpdate(@Param("asset") Asset asset, @Param("accountId") String accountId);
}
