package com.financeforge.reconciliation;

import com.financeforge.accounts.CreditAccount;
import lombok.Value;

import java.util.List;

/**
 * Outcome of resolving an account reference. The account is set only when
 * resolved; candidates are set only when ambiguous.
 */
@Value
public class AccountResolution {

    public enum Method {
        EXACT_ID,
        EXACT_NAME,
        FUZZY_NAME
    }

    String reference;
    CreditAccount account;
    Method method;
    List<MatchCandidate> candidates;

    static AccountResolution resolved(String reference, CreditAccount account, Method method) {
        return new AccountResolution(reference, account, method, List.of());
    }

    static AccountResolution ambiguous(String reference, List<MatchCandidate> candidates) {
        return new AccountResolution(reference, null, null, List.copyOf(candidates));
    }

    static AccountResolution notFound(String reference) {
        return new AccountResolution(reference, null, null, List.of());
    }

    public boolean isResolved() {
        return account != null;
    }

    public boolean isAmbiguous() {
        return account == null && !candidates.isEmpty();
    }
}
