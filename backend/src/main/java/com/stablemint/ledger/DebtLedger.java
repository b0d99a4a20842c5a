package com.stablemint.ledger;

import com.stablemint.exception.DebtUnderflowException;
import com.stablemint.util.FixedPointMath;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Minted stable units outstanding per actor (18 decimals).
 */
public class DebtLedger {

    private final Map<String, BigInteger> debt = new LinkedHashMap<>();

    public void increase(UndoJournal journal, String actor, BigInteger amount) {
        CollateralLedger.requirePositive(amount);
        BigInteger before = debtOf(actor);
        debt.put(actor, FixedPointMath.add(before, amount));
        journal.record("debt.increase " + actor, () -> debt.put(actor, before));
    }

    public void decrease(UndoJournal journal, String actor, BigInteger amount) {
        CollateralLedger.requirePositive(amount);
        BigInteger before = debtOf(actor);
        if (amount.compareTo(before) > 0) {
            throw new DebtUnderflowException(amount, before);
        }
        debt.put(actor, FixedPointMath.sub(before, amount));
        journal.record("debt.decrease " + actor, () -> debt.put(actor, before));
    }

    public BigInteger debtOf(String actor) {
        return debt.getOrDefault(actor, BigInteger.ZERO);
    }

    public BigInteger totalDebt() {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger v : debt.values()) total = FixedPointMath.add(total, v);
        return total;
    }

    public Set<String> actors() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(debt.keySet()));
    }
}
