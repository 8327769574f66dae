package com.financeforge.reconciliation;

import com.financeforge.accounts.AccountService;
import com.financeforge.accounts.CreditAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maps an external account reference to a registered account.
 *
 * Tries the exact id, then the exact normalized display name, then fuzzy name
 * matching. A fuzzy match is accepted only when the best candidate clears the
 * confidence threshold and leads the runner-up by the margin. Anything else is
 * returned as ambiguous with its candidates; it is never guessed.
 */
@Component
@Slf4j
public class AccountReferenceResolver {

    private static final Comparator<MatchCandidate> BEST_FIRST =
        Comparator.comparingDouble(MatchCandidate::getScore).reversed()
            .thenComparing(MatchCandidate::getAccountId);

    private static final double SCORE_TOLERANCE = 1e-9;

    private final AccountService accountService;
    private final double confidenceThreshold;
    private final double margin;
    private final double candidateFloor;
    private final int maxCandidates;

    public AccountReferenceResolver(AccountService accountService,
                                    @Value("${financeforge.reconciliation.fuzzy.confidence-threshold:0.85}") double confidenceThreshold,
                                    @Value("${financeforge.reconciliation.fuzzy.margin:0.05}") double margin,
                                    @Value("${financeforge.reconciliation.fuzzy.candidate-floor:0.5}") double candidateFloor,
                                    @Value("${financeforge.reconciliation.fuzzy.max-candidates:5}") int maxCandidates) {
        this.accountService = accountService;
        this.confidenceThreshold = confidenceThreshold;
        this.margin = margin;
        this.candidateFloor = candidateFloor;
        this.maxCandidates = maxCandidates;
    }

    public AccountResolution resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return AccountResolution.notFound(reference);
        }
        String trimmed = reference.trim();
        List<CreditAccount> accounts = accountService.getAccounts();

        Optional<CreditAccount> byId = accounts.stream()
            .filter(account -> account.getAccountId().equals(trimmed))
            .findFirst();
        if (byId.isPresent()) {
            return AccountResolution.resolved(reference, byId.get(), AccountResolution.Method.EXACT_ID);
        }

        String normalized = NameSimilarity.normalize(trimmed);
        List<CreditAccount> byName = accounts.stream()
            .filter(account -> NameSimilarity.normalize(account.getDisplayName()).equals(normalized))
            .toList();
        if (byName.size() == 1) {
            return AccountResolution.resolved(reference, byName.get(0), AccountResolution.Method.EXACT_NAME);
        }
        if (byName.size() > 1) {
            log.warn("Reference '{}' names {} accounts", reference, byName.size());
            return AccountResolution.ambiguous(reference, byName.stream()
                .map(account -> new MatchCandidate(account.getAccountId(), account.getDisplayName(), 1.0))
                .sorted(BEST_FIRST)
                .toList());
        }

        List<MatchCandidate> candidates = accounts.stream()
            .map(account -> new MatchCandidate(account.getAccountId(), account.getDisplayName(),
                round(NameSimilarity.similarity(trimmed, account.getDisplayName()))))
            .filter(candidate -> candidate.getScore() >= candidateFloor)
            .sorted(BEST_FIRST)
            .limit(maxCandidates)
            .toList();
        if (candidates.isEmpty()) {
            log.warn("Reference '{}' matches no account", reference);
            return AccountResolution.notFound(reference);
        }

        MatchCandidate best = candidates.get(0);
        double runnerUp = candidates.size() > 1 ? candidates.get(1).getScore() : 0.0;
        if (best.getScore() >= confidenceThreshold && best.getScore() - runnerUp >= margin - SCORE_TOLERANCE) {
            log.info("Resolved reference '{}' to {} by fuzzy match ({})", reference, best.getAccountId(), best.getScore());
            CreditAccount account = accounts.stream()
                .filter(candidate -> candidate.getAccountId().equals(best.getAccountId()))
                .findFirst()
                .orElseThrow();
            return AccountResolution.resolved(reference, account, AccountResolution.Method.FUZZY_NAME);
        }

        log.warn("Reference '{}' is ambiguous: best {} at {}, runner-up at {}",
            reference, best.getAccountId(), best.getScore(), runnerUp);
        return AccountResolution.ambiguous(reference, candidates);
    }

    private static double round(double score) {
        return Math.round(score * 10_000.0) / 10_000.0;
    }
}
