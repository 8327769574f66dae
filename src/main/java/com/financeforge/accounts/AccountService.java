package com.financeforge.accounts;

import com.financeforge.common.Amounts;
import com.financeforge.common.exception.AccountNotFoundException;
import com.financeforge.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Service for registering and looking up credit accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final BigDecimal MAX_APR = BigDecimal.ONE;

    private final AccountRepository accountRepository;
    private final Clock clock;

    /**
     * Register an account. Registering an existing id again with identical terms
     * returns the existing account, so a client can safely retry a registration.
     */
    @Transactional
    public CreditAccount registerAccount(AccountRegistration registration) {
        validate(registration);

        Optional<CreditAccount> existing = accountRepository.findByAccountId(registration.getAccountId());
        if (existing.isPresent()) {
            if (!hasTerms(existing.get(), registration)) {
                throw new ValidationException("Account already registered: " + registration.getAccountId());
            }
            log.info("Account {} already registered with identical terms", registration.getAccountId());
            return existing.get();
        }

        CreditAccount account = new CreditAccount(
            registration.getAccountId(),
            registration.getDisplayName(),
            registration.getKind(),
            registration.getApr(),
            registration.getCreditLimit() != null ? Amounts.of(registration.getCreditLimit()) : null,
            registration.getPromoRateExpiry(),
            registration.getMinimumPayment() != null ? Amounts.of(registration.getMinimumPayment()) : null,
            Instant.now(clock)
        );
        accountRepository.save(account);

        log.info("Registered {} account {} ({}) at APR {} with limit {}",
            account.getKind(), account.getAccountId(), account.getDisplayName(),
            account.getApr(), account.getCreditLimit());
        return account;
    }

    @Transactional(readOnly = true)
    public CreditAccount getAccount(String accountId) {
        return accountRepository.findByAccountId(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public boolean exists(String accountId) {
        return accountId != null && accountRepository.existsById(accountId);
    }

    @Transactional(readOnly = true)
    public List<CreditAccount> getAccounts() {
        return accountRepository.findAllByOrderByAccountIdAsc();
    }

    private static boolean hasTerms(CreditAccount account, AccountRegistration registration) {
        return account.getDisplayName().equals(registration.getDisplayName())
            && account.getKind() == registration.getKind()
            && account.getApr().compareTo(registration.getApr()) == 0
            && sameAmount(account.getCreditLimit(), registration.getCreditLimit())
            && Objects.equals(account.getPromoRateExpiry(), registration.getPromoRateExpiry())
            && sameAmount(account.getMinimumPayment(), registration.getMinimumPayment());
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    private void validate(AccountRegistration registration) {
        if (registration.getAccountId() == null || registration.getAccountId().isBlank()) {
            throw new ValidationException("Account id is required");
        }
        if (registration.getDisplayName() == null || registration.getDisplayName().isBlank()) {
            throw new ValidationException("Display name is required");
        }
        if (registration.getKind() == null) {
            throw new ValidationException("Account kind is required");
        }
        BigDecimal apr = registration.getApr();
        if (apr == null || apr.signum() < 0 || apr.compareTo(MAX_APR) > 0) {
            throw new ValidationException("APR must be a fraction between 0 and 1: " + apr);
        }

        BigDecimal limit = registration.getCreditLimit();
        if (registration.getKind().isRevolving()) {
            if (limit == null) {
                throw new ValidationException("Credit limit is required for " + registration.getKind());
            }
            if (limit.signum() < 0) {
                throw new ValidationException("Credit limit cannot be negative: " + limit);
            }
        } else if (limit != null) {
            throw new ValidationException("Installment loans do not carry a credit limit");
        }

        BigDecimal minimum = registration.getMinimumPayment();
        if (minimum != null && minimum.signum() < 0) {
            throw new ValidationException("Minimum payment cannot be negative: " + minimum);
        }
    }
}
