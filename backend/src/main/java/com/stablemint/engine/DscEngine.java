package com.stablemint.engine;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.ledger.CollateralLedger;
import com.stablemint.ledger.DebtLedger;
import com.stablemint.oracle.PriceFeed;
import com.stablemint.oracle.PriceOracleAdapter;
import com.stablemint.token.CollateralTokenGateway;
import com.stablemint.token.StableToken;
import com.stablemint.util.AddressUtil;
import com.stablemint.util.FixedPointMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the engine: the public operation surface and every read-only query.
 *
 * <p>Owns the two ledgers. The registered collateral set and its price feeds are fixed here, at construction,
 * and never change afterwards. All addresses are normalized before they reach the ledgers.</p>
 */
@Slf4j
public class DscEngine {

    private final CollateralLedger collateralLedger;
    private final DebtLedger debtLedger;
    private final PriceOracleAdapter oracle;
    private final SolvencyCalculator solvency;
    private final PositionEngine positions;
    private final LiquidationEngine liquidations;
    private final EngineGuard guard;
    private final StableToken stableToken;
    private final String custody;

    /**
     * @param collateralTokens    registered collateral token addresses, in order
     * @param priceFeeds          price feed address of each collateral token, same order and length
     * @param stableToken         the minted unit; {@code custody} must be its owner
     * @param tokenGateway        collateral token transfers
     * @param priceFeed           source of feed rounds
     * @param staleTimeout        maximum age of a feed round, zero to disable the age check
     * @param clock               clock for the age check
     * @param publisher           receives committed events
     * @param custody             account holding deposited collateral and stable units being burned
     */
    public DscEngine(List<String> collateralTokens,
                     List<String> priceFeeds,
                     StableToken stableToken,
                     CollateralTokenGateway tokenGateway,
                     PriceFeed priceFeed,
                     Duration staleTimeout,
                     Clock clock,
                     ApplicationEventPublisher publisher,
                     String custody) {
        if (collateralTokens.size() != priceFeeds.size()) {
            throw new EngineException(ErrorCode.LENGTH_MISMATCH,
                    "Token addresses and price feed addresses must be the same length",
                    Map.of("tokenAddresses", collateralTokens.size(), "priceFeedAddresses", priceFeeds.size()));
        }
        Map<String, String> feedByAsset = new LinkedHashMap<>();
        for (int i = 0; i < collateralTokens.size(); i++) {
            String asset = AddressUtil.normalize(collateralTokens.get(i));
            if (feedByAsset.put(asset, AddressUtil.normalize(priceFeeds.get(i))) != null) {
                throw new EngineException(ErrorCode.INVALID_INPUT, "Collateral token registered twice: " + asset);
            }
        }

        this.stableToken = stableToken;
        this.custody = AddressUtil.normalize(custody);
        this.collateralLedger = new CollateralLedger(new ArrayList<>(feedByAsset.keySet()));
        this.debtLedger = new DebtLedger();
        this.oracle = new PriceOracleAdapter(feedByAsset, priceFeed, staleTimeout, clock);
        this.solvency = new SolvencyCalculator(collateralLedger, debtLedger, oracle);
        this.guard = new EngineGuard(publisher);
        this.positions = new PositionEngine(collateralLedger, debtLedger, solvency, tokenGateway, stableToken,
                this.custody, guard);
        this.liquidations = new LiquidationEngine(positions, solvency, oracle, collateralLedger, guard);
        log.info("[engine] registered collateral {} with stable token {}", feedByAsset, stableToken.address());
    }

    // ---------------------------- Operations ----------------------------

    public void depositCollateral(String actor, String asset, BigInteger amount) {
        positions.depositCollateral(addr(actor), addr(asset), uint(amount, "amount"));
    }

    public void mintDsc(String actor, BigInteger amount) {
        positions.mintDsc(addr(actor), uint(amount, "amount"));
    }

    public void depositCollateralAndMintDsc(String actor, String asset, BigInteger collateralAmount, BigInteger mintAmount) {
        positions.depositCollateralAndMintDsc(addr(actor), addr(asset),
                uint(collateralAmount, "amountCollateral"), uint(mintAmount, "amountDscToMint"));
    }

    public void redeemCollateral(String actor, String asset, BigInteger amount) {
        positions.redeemCollateral(addr(actor), addr(asset), uint(amount, "amount"));
    }

    public void burnDsc(String actor, BigInteger amount) {
        positions.burnDsc(addr(actor), uint(amount, "amount"));
    }

    public void redeemCollateralForDsc(String actor, String asset, BigInteger collateralAmount, BigInteger burnAmount) {
        positions.redeemCollateralForDsc(addr(actor), addr(asset),
                uint(collateralAmount, "amountCollateral"), uint(burnAmount, "amountDscToBurn"));
    }

    public LiquidationResult liquidate(String liquidator, String asset, String target, BigInteger debtToCover) {
        return liquidations.liquidate(addr(liquidator), addr(asset), addr(target), uint(debtToCover, "debtToCover"));
    }

    // ---------------------------- Queries ----------------------------

    public BigInteger getHealthFactor(String actor) {
        String a = addr(actor);
        return guard.read(() -> solvency.healthFactor(a));
    }

    public AccountSnapshot getAccountInformation(String actor) {
        String a = addr(actor);
        return guard.read(() -> solvency.accountSnapshot(a));
    }

    public BigInteger getAccountCollateralValue(String actor) {
        String a = addr(actor);
        return guard.read(() -> solvency.collateralValueUsd(a));
    }

    public BigInteger getDscMinted(String actor) {
        String a = addr(actor);
        return guard.read(() -> debtLedger.debtOf(a));
    }

    public BigInteger getUsdValue(String asset, BigInteger amount) {
        return oracle.usdValue(addr(asset), uint(amount, "amount"));
    }

    public BigInteger getTokenAmountFromUsd(String asset, BigInteger usdAmountInWei) {
        return oracle.amountForUsd(addr(asset), uint(usdAmountInWei, "usdAmountInWei"));
    }

    public BigInteger getCollateralBalanceOfUser(String actor, String asset) {
        String a = addr(actor);
        String t = addr(asset);
        return guard.read(() -> collateralLedger.balanceOf(a, t));
    }

    public Map<String, BigInteger> getCollateralBalances(String actor) {
        String a = addr(actor);
        return guard.read(() -> collateralLedger.balancesOf(a));
    }

    /** Sum of all actors' deposits of one asset. */
    public BigInteger getTotalCollateral(String asset) {
        String t = addr(asset);
        return guard.read(() -> collateralLedger.totalOf(t));
    }

    public BigInteger getTotalDscMinted() {
        return guard.read(debtLedger::totalDebt);
    }

    public List<String> getCollateralTokens() {
        return collateralLedger.registeredAssets();
    }

    public String getCollateralTokenPriceFeed(String asset) {
        return oracle.priceFeedOf(addr(asset));
    }

    public String getStableToken() {
        return stableToken.address();
    }

    public String getCustody() {
        return custody;
    }

    /** Every actor that ever held collateral or debt. */
    public Set<String> getKnownActors() {
        return guard.read(() -> {
            Set<String> out = new LinkedHashSet<>(collateralLedger.actors());
            out.addAll(debtLedger.actors());
            return out;
        });
    }

    public BigInteger calculateHealthFactor(BigInteger totalDscMinted, BigInteger collateralValueInUsd) {
        return SolvencyCalculator.calculateHealthFactor(uint(totalDscMinted, "totalDscMinted"),
                uint(collateralValueInUsd, "collateralValueInUsd"));
    }

    private static String addr(String a) {
        return AddressUtil.normalize(a);
    }

    private static BigInteger uint(BigInteger v, String name) {
        return FixedPointMath.requireUint256(v, name);
    }
}
