package com.financeforge.accounts;

import com.financeforge.common.exception.AccountNotFoundException;
import com.financeforge.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for account registration rules.
 */
@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:30:00Z");

    @Mock
    private AccountRepository accountRepository;

    private AccountService accountService;

    @BeforeEach
    void setUp() {
        accountService = new AccountService(accountRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testRegisterRevolvingAccount() {
        when(accountRepository.findByAccountId("card")).thenReturn(Optional.empty());

        CreditAccount account = accountService.registerAccount(card("card", "0.2999", "10000"));

        assertEquals("card", account.getAccountId());
        assertEquals(new BigDecimal("10000.00"), account.getCreditLimit());
        assertEquals(NOW, account.getRegisteredAt());
        verify(accountRepository).save(account);
    }

    @Test
    void testNegativeCreditLimitRejected() {
        assertThrows(ValidationException.class,
            () -> accountService.registerAccount(card("card", "0.2999", "-1.00")));
        verify(accountRepository, never()).save(any());
    }

    @Test
    void testRevolvingAccountNeedsLimit() {
        assertThrows(ValidationException.class,
            () -> accountService.registerAccount(card("card", "0.2999", null)));
    }

    @Test
    void testLoanCannotCarryLimit() {
        AccountRegistration loan = AccountRegistration.builder()
            .accountId("loan")
            .displayName("Car loan")
            .kind(AccountKind.INSTALLMENT_LOAN)
            .apr(new BigDecimal("0.06"))
            .creditLimit(new BigDecimal("20000.00"))
            .build();

        assertThrows(ValidationException.class, () -> accountService.registerAccount(loan));
    }

    @Test
    void testAprOutsideFractionRangeRejected() {
        assertThrows(ValidationException.class,
            () -> accountService.registerAccount(card("card", "29.99", "1000.00")));
    }

    @Test
    void testDuplicateWithDifferentTermsRejected() {
        when(accountRepository.findByAccountId("card")).thenReturn(Optional.of(new CreditAccount("card", "Card card",
            AccountKind.REVOLVING_CREDIT, new BigDecimal("0.2499"), new BigDecimal("1000.00"), null, null, NOW)));

        assertThrows(ValidationException.class,
            () -> accountService.registerAccount(card("card", "0.2999", "1000.00")));
        verify(accountRepository, never()).save(any());
    }

    @Test
    void testReRegistrationWithIdenticalTermsReturnsExisting() {
        CreditAccount existing = new CreditAccount("card", "Card card", AccountKind.REVOLVING_CREDIT,
            new BigDecimal("0.2999"), new BigDecimal("1000.00"), null, null, NOW.minusSeconds(60));
        when(accountRepository.findByAccountId("card")).thenReturn(Optional.of(existing));

        CreditAccount account = accountService.registerAccount(card("card", "0.2999", "1000"));

        assertSame(existing, account);
        verify(accountRepository, never()).save(any());
    }

    @Test
    void testUnknownAccount() {
        when(accountRepository.findByAccountId("missing")).thenReturn(Optional.empty());

        assertThrows(AccountNotFoundException.class, () -> accountService.getAccount("missing"));
    }

    @Test
    void testMinimumPaymentDerivedFromBalance() {
        CreditAccount account = new CreditAccount("card", "Card", AccountKind.REVOLVING_CREDIT,
            new BigDecimal("0.20"), new BigDecimal("10000.00"), null, null, NOW);

        assertEquals(new BigDecimal("25.00"), account.minimumPaymentFor(new BigDecimal("400.00")));
        assertEquals(new BigDecimal("100.00"), account.minimumPaymentFor(new BigDecimal("5000.00")));
        assertEquals(new BigDecimal("10.00"), account.minimumPaymentFor(new BigDecimal("10.00")));
        assertEquals(new BigDecimal("0.00"), account.minimumPaymentFor(new BigDecimal("-5.00")));
    }

    private static AccountRegistration card(String id, String apr, String limit) {
        return AccountRegistration.builder()
            .accountId(id)
            .displayName("Card " + id)
            .kind(AccountKind.REVOLVING_CREDIT)
            .apr(new BigDecimal(apr))
            .creditLimit(limit != null ? new BigDecimal(limit) : null)
            .build();
    }
}
