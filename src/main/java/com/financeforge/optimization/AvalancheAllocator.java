package com.financeforge.optimization;

import com.financeforge.common.Amounts;
import com.financeforge.common.exception.ValidationException;
import com.financeforge.projection.AccountPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a payment budget across accounts, highest rate first.
 *
 * Minimums are paid in rate order until the funds run out. Whatever remains goes
 * to the highest-rate balance until it is cleared, then cascades to the next.
 */
@Component
@Slf4j
public class AvalancheAllocator {

    static final Comparator<AccountPosition> HIGHEST_RATE_FIRST =
        Comparator.comparing(AccountPosition::getApr).reversed()
            .thenComparing(AccountPosition::getAccountId);

    public AllocationPlan allocate(List<AccountPosition> positions, BigDecimal availableFunds) {
        BigDecimal funds = Amounts.of(availableFunds);
        if (Amounts.isNegative(funds)) {
            throw new ValidationException("Available funds cannot be negative: " + funds);
        }

        List<AccountPosition> ordered = positions.stream()
            .filter(AccountPosition::hasBalance)
            .sorted(HIGHEST_RATE_FIRST)
            .toList();

        Map<String, BigDecimal> paid = new LinkedHashMap<>();
        AllocationPlan.AllocationPlanBuilder plan = AllocationPlan.builder().availableFunds(funds);
        BigDecimal remaining = funds;

        for (AccountPosition position : ordered) {
            BigDecimal minimum = position.minimumPayment();
            BigDecimal payment = Amounts.min(minimum, remaining);
            paid.put(position.getAccountId(), payment);
            remaining = remaining.subtract(payment);
            if (payment.compareTo(minimum) < 0) {
                plan.unmetMinimum(new UnmetMinimum(position.getAccountId(), minimum, payment));
            }
        }

        for (AccountPosition position : ordered) {
            if (!Amounts.isPositive(remaining)) {
                break;
            }
            BigDecimal outstanding = position.getBalance().subtract(paid.get(position.getAccountId()));
            BigDecimal extra = Amounts.min(outstanding, remaining);
            paid.merge(position.getAccountId(), extra, BigDecimal::add);
            remaining = remaining.subtract(extra);
        }

        for (AccountPosition position : ordered) {
            plan.allocation(PaymentAllocation.builder()
                .accountId(position.getAccountId())
                .apr(position.getApr())
                .balance(position.getBalance())
                .minimumPayment(position.minimumPayment())
                .amount(paid.get(position.getAccountId()))
                .build());
        }

        AllocationPlan result = plan.unallocated(remaining).build();
        if (!result.isMinimumsCovered()) {
            log.warn("Funds of {} do not cover minimum payments on {} accounts",
                funds, result.getUnmetMinimums().size());
        }
        return result;
    }
}
