package com.financeforge.reconciliation;

import lombok.Value;

/**
 * An account a reference might mean, with its name similarity in [0,1].
 */
@Value
public class MatchCandidate {
    String accountId;
    String displayName;
    double score;
}
