package com.financeforge.phase;

import com.financeforge.accounts.AccountService;
import com.financeforge.common.Amounts;
import com.financeforge.projection.AccountPosition;
import com.financeforge.projection.ProjectionBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Derives classifier inputs from the latest snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhaseService {

    private final PhaseClassifier classifier;
    private final ProjectionBuilder projectionBuilder;
    private final AccountService accountService;

    public PhaseAssessment assess(BigDecimal annualIncome) {
        List<AccountPosition> positions =
            AccountPosition.of(accountService.getAccounts(), projectionBuilder.snapshot(null));
        return assess(positions, annualIncome);
    }

    /**
     * Total debt is the sum of positive balances; utilization counts only accounts with a credit limit.
     */
    public PhaseAssessment assess(List<AccountPosition> positions, BigDecimal annualIncome) {
        BigDecimal income = Amounts.of(annualIncome);
        BigDecimal totalDebt = Amounts.ZERO;
        BigDecimal creditUsed = Amounts.ZERO;
        BigDecimal creditAvailable = Amounts.ZERO;

        for (AccountPosition position : positions) {
            BigDecimal owed = Amounts.max(Amounts.ZERO, position.getBalance());
            totalDebt = totalDebt.add(owed);
            if (position.getAccount().hasCreditLimit()) {
                creditUsed = creditUsed.add(owed);
                creditAvailable = creditAvailable.add(position.getAccount().getCreditLimit());
            }
        }

        Phase phase = classifier.classify(totalDebt, income, creditUsed, creditAvailable);
        log.info("Classified portfolio as {} (debt {}, income {}, credit {}/{})",
            phase, totalDebt, income, creditUsed, creditAvailable);
        return PhaseAssessment.builder()
            .phase(phase)
            .totalDebt(totalDebt)
            .annualIncome(income)
            .creditUsed(creditUsed)
            .creditAvailable(creditAvailable)
            .debtToIncome(PhaseClassifier.ratio(totalDebt, income))
            .utilization(PhaseClassifier.ratio(creditUsed, creditAvailable))
            .build();
    }
}
