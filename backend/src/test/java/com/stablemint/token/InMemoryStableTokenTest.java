package com.stablemint.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryStableTokenTest {

    private static final String TOKEN = "0x3000000000000000000000000000000000000003";
    private static final String OWNER = "0x4000000000000000000000000000000000000004";
    private static final String HOLDER = "0xa11ce00000000000000000000000000000000001";
    private static final String ZERO = "0x0000000000000000000000000000000000000000";

    private final InMemoryStableToken token = new InMemoryStableToken(TOKEN, OWNER);

    @Test
    @DisplayName("Mint credits the holder and the supply")
    void mint() {
        assertThat(token.mint(HOLDER, BigInteger.TEN)).isTrue();

        assertThat(token.balanceOf(HOLDER)).isEqualTo(BigInteger.TEN);
        assertThat(token.totalSupply()).isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("Mint refuses zero amount and the zero address")
    void mintRefusals() {
        assertThatThrownBy(() -> token.mint(HOLDER, BigInteger.ZERO)).isInstanceOf(TokenException.class);
        assertThatThrownBy(() -> token.mint(ZERO, BigInteger.ONE)).isInstanceOf(TokenException.class);
    }

    @Test
    @DisplayName("Burn spends only the owner's balance")
    void burn() {
        token.mint(HOLDER, BigInteger.TEN);
        token.transferFrom(HOLDER, OWNER, BigInteger.valueOf(4));

        token.burn(BigInteger.valueOf(4));

        assertThat(token.balanceOf(OWNER)).isZero();
        assertThat(token.totalSupply()).isEqualTo(BigInteger.valueOf(6));
        assertThatThrownBy(() -> token.burn(BigInteger.ONE)).isInstanceOf(TokenException.class);
    }

    @Test
    @DisplayName("Transfer beyond the balance is declined")
    void transferDeclined() {
        token.mint(HOLDER, BigInteger.ONE);

        assertThat(token.transferFrom(HOLDER, OWNER, BigInteger.TWO)).isFalse();
        assertThat(token.balanceOf(HOLDER)).isEqualTo(BigInteger.ONE);
    }
}
