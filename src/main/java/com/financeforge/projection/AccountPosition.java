package com.financeforge.projection;

import com.financeforge.accounts.CreditAccount;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.List;

/**
 * An account's terms paired with its projected balance.
 */
@Value
public class AccountPosition {

    CreditAccount account;
    BigDecimal balance;

    public static List<AccountPosition> of(Collection<CreditAccount> accounts, Snapshot snapshot) {
        return accounts.stream()
            .map(account -> new AccountPosition(account, snapshot.balanceOf(account.getAccountId())))
            .toList();
    }

    public String getAccountId() {
        return account.getAccountId();
    }

    public BigDecimal getApr() {
        return account.getApr();
    }

    public boolean hasBalance() {
        return balance.signum() > 0;
    }

    public BigDecimal availableCapacity() {
        return account.availableCapacity(balance);
    }

    public BigDecimal minimumPayment() {
        return account.minimumPaymentFor(balance);
    }

    /**
     * Balance over credit limit; 0 without a limit, 1 when a zero limit carries a balance.
     */
    public double utilization() {
        BigDecimal limit = account.getCreditLimit();
        if (limit == null) {
            return 0.0;
        }
        if (limit.signum() == 0) {
            return balance.signum() > 0 ? 1.0 : 0.0;
        }
        return balance.divide(limit, MathContext.DECIMAL64).doubleValue();
    }
}
