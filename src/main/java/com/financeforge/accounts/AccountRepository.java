package com.financeforge.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for credit account metadata.
 */
@Repository
public interface AccountRepository extends JpaRepository<CreditAccount, String> {

    Optional<CreditAccount> findByAccountId(String accountId);

    List<CreditAccount> findAllByOrderByAccountIdAsc();

    List<CreditAccount> findByDisplayNameIgnoreCase(String displayName);
}
