package com.stablemint.api;

import static com.stablemint.engine.EngineFixture.ALICE;
import static com.stablemint.engine.EngineFixture.ETH_FEED;
import static com.stablemint.engine.EngineFixture.WBTC;
import static com.stablemint.engine.EngineFixture.WETH;
import static com.stablemint.engine.EngineFixture.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stablemint.engine.EngineFixture;
import com.stablemint.exception.GlobalExceptionHandler;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class AccountControllerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EngineFixture f;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        f = new EngineFixture();
        mockMvc = MockMvcBuilders.standaloneSetup(new AccountController(f.engine), new PriceController(f.engine))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private JsonNode getJson(String url) throws Exception {
        String body = mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return mapper.readTree(body);
    }

    @Test
    void account_returnsPositionAndHealth() throws Exception {
        f.openPosition(ALICE, 10, 15000);
        f.setPrice(ETH_FEED, 1650);

        JsonNode json = getJson("/api/v1/accounts/" + ALICE);

        assertThat(json.get("actor").asText()).isEqualTo(ALICE);
        assertThat(json.get("totalDscMinted").bigIntegerValue()).isEqualTo(units(15000));
        assertThat(json.get("collateralValueInUsd").bigIntegerValue()).isEqualTo(units(16500));
        assertThat(json.get("healthFactor").bigIntegerValue()).isEqualTo(new BigInteger("550000000000000000"));
        assertThat(json.get("liquidatable").asBoolean()).isTrue();
        assertThat(json.get("collateral").get(WETH).bigIntegerValue()).isEqualTo(units(10));
        assertThat(json.get("collateral").get(WBTC).bigIntegerValue()).isZero();
    }

    @Test
    void account_echoesNormalizedActor() throws Exception {
        f.openPosition(ALICE, 1, 100);
        String raw = " " + ALICE.toUpperCase().replace("0X", "0x");

        String body = mockMvc.perform(get("/api/v1/accounts/{actor}", raw))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = mapper.readTree(body);

        assertThat(json.get("actor").asText()).isEqualTo(ALICE);
        assertThat(json.get("totalDscMinted").bigIntegerValue()).isEqualTo(units(100));
    }

    @Test
    void collateralBalance_singleAsset() throws Exception {
        f.openPosition(ALICE, 3, 1);

        JsonNode json = getJson("/api/v1/accounts/" + ALICE + "/collateral/" + WETH);

        assertThat(json.bigIntegerValue()).isEqualTo(units(3));
    }

    @Test
    void healthFactor_pureCalculation() throws Exception {
        JsonNode json = getJson("/api/v1/accounts/health-factor?debt=" + units(100) + "&collateralUsd=" + units(300));

        assertThat(json.bigIntegerValue()).isEqualTo(new BigInteger("1500000000000000000"));
    }

    @Test
    void healthFactor_nonNumericParam_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/accounts/health-factor").param("debt", "x").param("collateralUsd", "1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    void prices_convertBothWays() throws Exception {
        f.setPrice(ETH_FEED, 2000);

        assertThat(getJson("/api/v1/prices/" + WETH + "/usd-value?amount=" + units(15)).bigIntegerValue())
                .isEqualTo(units(30000));
        assertThat(getJson("/api/v1/prices/" + WETH + "/token-amount?usd=" + units(100)).bigIntegerValue())
                .isEqualTo(new BigInteger("50000000000000000"));
    }

    @Test
    void prices_staleFeed_returns503() throws Exception {
        f.feed.setRound(ETH_FEED, f.feed.latestRoundData(ETH_FEED).toBuilder().updatedAt(0).build());

        mockMvc.perform(get("/api/v1/prices/" + WETH + "/usd-value").param("amount", "1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("ORACLE_FAILURE"));
    }
}
