package com.stablemint.api;

import static com.stablemint.engine.EngineFixture.ALICE;
import static com.stablemint.engine.EngineFixture.BOB;
import static com.stablemint.engine.EngineFixture.ETH_FEED;
import static com.stablemint.engine.EngineFixture.WETH;
import static com.stablemint.engine.EngineFixture.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablemint.engine.EngineFixture;
import com.stablemint.exception.GlobalExceptionHandler;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Unit tests for EngineController over an in-memory engine.
 *
 * <p>Verifies: operations return 204, liquidation returns its result, engine failures map to their
 * error codes and HTTP statuses, and request validation.
 */
class EngineControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EngineFixture f;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        f = new EngineFixture();
        mockMvc = MockMvcBuilders.standaloneSetup(new EngineController(f.engine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private String collateralBody(String asset, Object amount) {
        return "{\"asset\":\"" + asset + "\",\"amount\":" + amount + "}";
    }

    @Nested
    @DisplayName("Operations")
    class Operations {

        @Test
        @DisplayName("Deposit returns 204 and credits the actor")
        void deposit() throws Exception {
            f.fund(WETH, ALICE, units(10));

            mockMvc.perform(post("/api/v1/engine/deposit")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(collateralBody(WETH, units(10))))
                    .andExpect(status().isNoContent());

            assertThat(f.engine.getCollateralBalanceOfUser(ALICE, WETH)).isEqualTo(units(10));
        }

        @Test
        @DisplayName("Deposit and mint in one request")
        void depositAndMint() throws Exception {
            f.fund(WETH, ALICE, units(10));

            mockMvc.perform(post("/api/v1/engine/deposit-and-mint")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"asset\":\"" + WETH + "\",\"collateralAmount\":" + units(10)
                                    + ",\"dscAmount\":" + units(15000) + "}"))
                    .andExpect(status().isNoContent());

            assertThat(f.engine.getDscMinted(ALICE)).isEqualTo(units(15000));
        }

        @Test
        @DisplayName("Mint, burn and redeem")
        void mintBurnRedeem() throws Exception {
            f.fund(WETH, ALICE, units(10));
            f.engine.depositCollateral(ALICE, WETH, units(10));

            mockMvc.perform(post("/api/v1/engine/mint")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":" + units(1000) + "}"))
                    .andExpect(status().isNoContent());
            mockMvc.perform(post("/api/v1/engine/burn")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":" + units(400) + "}"))
                    .andExpect(status().isNoContent());
            mockMvc.perform(post("/api/v1/engine/redeem")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(collateralBody(WETH, units(1))))
                    .andExpect(status().isNoContent());

            assertThat(f.engine.getDscMinted(ALICE)).isEqualTo(units(600));
            assertThat(f.engine.getCollateralBalanceOfUser(ALICE, WETH)).isEqualTo(units(9));
        }

        @Test
        @DisplayName("Redeem for DSC in one request")
        void redeemForDsc() throws Exception {
            f.openPosition(ALICE, 10, 15000);

            mockMvc.perform(post("/api/v1/engine/redeem-for-dsc")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"asset\":\"" + WETH + "\",\"collateralAmount\":" + units(5)
                                    + ",\"dscAmount\":" + units(7500) + "}"))
                    .andExpect(status().isNoContent());

            assertThat(f.engine.getCollateralBalanceOfUser(ALICE, WETH)).isEqualTo(units(5));
        }

        @Test
        @DisplayName("Liquidation returns the payout breakdown")
        void liquidate() throws Exception {
            f.openPosition(ALICE, 10, 15000);
            f.openPosition(BOB, 20, 15000);
            f.setPrice(ETH_FEED, 1650);

            String body = mockMvc.perform(post("/api/v1/engine/liquidate")
                            .header(EngineController.ACTOR_HEADER, BOB)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"asset\":\"" + WETH + "\",\"target\":\"" + ALICE
                                    + "\",\"debtToCover\":" + units(15000) + "}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.liquidator").value(BOB))
                    .andExpect(jsonPath("$.target").value(ALICE))
                    .andReturn().getResponse().getContentAsString();

            JsonNode json = mapper.readTree(body);
            assertThat(json.get("totalCollateralRedeemed").bigIntegerValue())
                    .isEqualTo(new BigInteger("9999999999999999999"));
            assertThat(json.get("bonusCollateral").bigIntegerValue())
                    .isEqualTo(new BigInteger("909090909090909090"));
        }

        @Test
        @DisplayName("Engine info lists collateral, feeds and constants")
        void info() throws Exception {
            mockMvc.perform(get("/api/v1/engine/info"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.stableToken").value(EngineFixture.DSC))
                    .andExpect(jsonPath("$.collateralPriceFeeds['" + WETH + "']").value(ETH_FEED))
                    .andExpect(jsonPath("$.liquidationThreshold").value(50))
                    .andExpect(jsonPath("$.liquidationBonus").value(10));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Unhealthy mint maps to 422 with the engine error code")
        void unhealthyMint() throws Exception {
            mockMvc.perform(post("/api/v1/engine/mint")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":1}"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.error.code").value("HEALTH_FACTOR_BELOW_THRESHOLD"))
                    .andExpect(jsonPath("$.error.path").value("/api/v1/engine/mint"));
        }

        @Test
        @DisplayName("Liquidating a healthy target is a conflict")
        void healthyTarget() throws Exception {
            f.openPosition(ALICE, 10, 100);

            mockMvc.perform(post("/api/v1/engine/liquidate")
                            .header(EngineController.ACTOR_HEADER, BOB)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"asset\":\"" + WETH + "\",\"target\":\"" + ALICE + "\",\"debtToCover\":1}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error.code").value("HEALTH_FACTOR_OK"));
        }

        @Test
        @DisplayName("Missing actor header is a bad request")
        void missingActor() throws Exception {
            mockMvc.perform(post("/api/v1/engine/mint")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":1}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }

        @Test
        @DisplayName("Missing amount fails validation")
        void missingAmount() throws Exception {
            mockMvc.perform(post("/api/v1/engine/deposit")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"asset\":\"" + WETH + "\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                    .andExpect(jsonPath("$.error.details.amount").exists());
        }

        @Test
        @DisplayName("Malformed address is invalid input")
        void malformedAddress() throws Exception {
            mockMvc.perform(post("/api/v1/engine/deposit")
                            .header(EngineController.ACTOR_HEADER, "0x1234")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(collateralBody(WETH, 1)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("INVALID_INPUT"));
        }

        @Test
        @DisplayName("Declined collateral transfer is a bad gateway")
        void transferFailed() throws Exception {
            mockMvc.perform(post("/api/v1/engine/deposit")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(collateralBody(WETH, 1)))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.error.code").value("TRANSFER_FAILED"));
        }

        @Test
        @DisplayName("Unreadable body is a bad request")
        void unreadableBody() throws Exception {
            mockMvc.perform(post("/api/v1/engine/mint")
                            .header(EngineController.ACTOR_HEADER, ALICE)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\":\"lots\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
        }
    }
}
