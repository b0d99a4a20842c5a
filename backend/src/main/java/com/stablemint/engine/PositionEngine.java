package com.stablemint.engine;

import com.stablemint.event.CollateralDepositedEvent;
import com.stablemint.event.CollateralRedeemedEvent;
import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.ledger.CollateralLedger;
import com.stablemint.ledger.DebtLedger;
import com.stablemint.token.CollateralTokenGateway;
import com.stablemint.token.StableToken;
import com.stablemint.token.TokenException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;

/**
 * Actor-initiated position changes: deposit, redeem, mint, burn and the two composites.
 *
 * <p>Each step follows the same order: amount check, asset check, ledger effect, token interaction,
 * solvency assertion. A failed assertion aborts the whole operation and the guard unwinds every effect,
 * token movements included.</p>
 */
@Slf4j
public class PositionEngine {

    private final CollateralLedger collateral;
    private final DebtLedger debt;
    private final SolvencyCalculator solvency;
    private final CollateralTokenGateway collateralTokens;
    private final StableToken stableToken;
    private final String custody;
    private final EngineGuard guard;

    public PositionEngine(CollateralLedger collateral,
                          DebtLedger debt,
                          SolvencyCalculator solvency,
                          CollateralTokenGateway collateralTokens,
                          StableToken stableToken,
                          String custody,
                          EngineGuard guard) {
        this.collateral = collateral;
        this.debt = debt;
        this.solvency = solvency;
        this.collateralTokens = collateralTokens;
        this.stableToken = stableToken;
        this.custody = custody;
        this.guard = guard;
    }

    // ---------------------------- Public operations ----------------------------

    public void depositCollateral(String actor, String asset, BigInteger amount) {
        guard.run("depositCollateral", actor, ctx -> deposit(ctx, actor, asset, amount));
        log.info("[position] {} deposited {} of {}", actor, amount, asset);
    }

    public void mintDsc(String actor, BigInteger amount) {
        guard.run("mintDsc", actor, ctx -> mint(ctx, actor, amount));
        log.info("[position] {} minted {}", actor, amount);
    }

    /** Deposit first so that the mint's solvency check sees the new collateral. */
    public void depositCollateralAndMintDsc(String actor, String asset, BigInteger collateralAmount, BigInteger mintAmount) {
        guard.run("depositCollateralAndMintDsc", actor, ctx -> {
            deposit(ctx, actor, asset, collateralAmount);
            mint(ctx, actor, mintAmount);
        });
        log.info("[position] {} deposited {} of {} and minted {}", actor, collateralAmount, asset, mintAmount);
    }

    public void redeemCollateral(String actor, String asset, BigInteger amount) {
        guard.run("redeemCollateral", actor, ctx -> {
            redeem(ctx, asset, amount, actor, actor);
            requireHealthy(actor);
        });
        log.info("[position] {} redeemed {} of {}", actor, amount, asset);
    }

    public void burnDsc(String actor, BigInteger amount) {
        guard.run("burnDsc", actor, ctx -> {
            burn(ctx, amount, actor, actor);
            requireHealthy(actor);
        });
        log.info("[position] {} burned {}", actor, amount);
    }

    /** Burn first so that the redeem's solvency check sees the reduced debt. */
    public void redeemCollateralForDsc(String actor, String asset, BigInteger collateralAmount, BigInteger burnAmount) {
        guard.run("redeemCollateralForDsc", actor, ctx -> {
            burn(ctx, burnAmount, actor, actor);
            redeem(ctx, asset, collateralAmount, actor, actor);
            requireHealthy(actor);
        });
        log.info("[position] {} burned {} and redeemed {} of {}", actor, burnAmount, collateralAmount, asset);
    }

    // ---------------------------- Steps (run inside a guarded operation) ----------------------------

    void deposit(OperationContext ctx, String actor, String asset, BigInteger amount) {
        collateral.deposit(ctx.getJournal(), actor, asset, amount);
        ctx.emit(new CollateralDepositedEvent(actor, asset, amount));
        moveCollateral(ctx, asset, actor, custody, amount);
    }

    void mint(OperationContext ctx, String actor, BigInteger amount) {
        debt.increase(ctx.getJournal(), actor, amount);
        requireHealthy(actor);
        boolean minted;
        try {
            minted = stableToken.mint(actor, amount);
        } catch (TokenException e) {
            throw new EngineException(ErrorCode.MINT_FAILED, "Stable token mint failed: " + e.getMessage(), e);
        }
        if (!minted) {
            throw new EngineException(ErrorCode.MINT_FAILED, "Stable token reported mint failure",
                    Map.of("to", actor, "amount", amount.toString()));
        }
        ctx.getJournal().record("stable.mint " + actor, () -> {
            requireCompensated(stableToken.transferFrom(actor, custody, amount), "reclaim minted " + amount);
            stableToken.burn(amount);
        });
    }

    /** Collateral leaves {@code from}'s position and is paid to {@code to}. No solvency check here. */
    void redeem(OperationContext ctx, String asset, BigInteger amount, String from, String to) {
        collateral.withdraw(ctx.getJournal(), from, asset, amount);
        ctx.emit(new CollateralRedeemedEvent(from, to, asset, amount));
        moveCollateral(ctx, asset, custody, to, amount);
    }

    /** Reduces {@code onBehalfOf}'s debt, paid with stable units pulled from {@code payer} and destroyed. */
    void burn(OperationContext ctx, BigInteger amount, String onBehalfOf, String payer) {
        debt.decrease(ctx.getJournal(), onBehalfOf, amount);

        boolean pulled;
        try {
            pulled = stableToken.transferFrom(payer, custody, amount);
        } catch (TokenException e) {
            throw new EngineException(ErrorCode.TRANSFER_FAILED, "Stable token transfer failed: " + e.getMessage(), e);
        }
        if (!pulled) {
            throw new EngineException(ErrorCode.TRANSFER_FAILED, "Could not pull stable units from payer",
                    Map.of("from", payer, "amount", amount.toString()));
        }
        ctx.getJournal().record("stable.pull " + payer, () ->
                requireCompensated(stableToken.transferFrom(custody, payer, amount), "return " + amount + " to " + payer));

        try {
            stableToken.burn(amount);
        } catch (TokenException e) {
            throw new EngineException(ErrorCode.TRANSFER_FAILED, "Stable token burn failed: " + e.getMessage(), e);
        }
        ctx.getJournal().record("stable.burn " + amount, () ->
                requireCompensated(stableToken.mint(custody, amount), "re-mint " + amount));
    }

    void requireHealthy(String actor) {
        BigInteger hf = solvency.healthFactor(actor);
        if (!SolvencyCalculator.isHealthy(hf)) {
            throw new EngineException(ErrorCode.HEALTH_FACTOR_BELOW_THRESHOLD,
                    "Health factor of " + actor + " would be " + hf,
                    Map.of("actor", actor, "healthFactor", hf.toString()));
        }
    }

    private void moveCollateral(OperationContext ctx, String asset, String from, String to, BigInteger amount) {
        boolean moved;
        try {
            moved = collateralTokens.transferFrom(asset, from, to, amount);
        } catch (TokenException e) {
            throw new EngineException(ErrorCode.TRANSFER_FAILED, "Collateral transfer failed: " + e.getMessage(), e);
        }
        if (!moved) {
            throw new EngineException(ErrorCode.TRANSFER_FAILED, "Collateral token declined the transfer",
                    Map.of("asset", asset, "from", from, "to", to, "amount", amount.toString()));
        }
        ctx.getJournal().record("collateral.transfer " + asset + " " + from + "->" + to, () ->
                requireCompensated(collateralTokens.transferFrom(asset, to, from, amount),
                        "return " + amount + " of " + asset + " to " + from));
    }

    private static void requireCompensated(boolean ok, String what) {
        if (!ok) throw new IllegalStateException("Compensation refused: " + what);
    }
}
