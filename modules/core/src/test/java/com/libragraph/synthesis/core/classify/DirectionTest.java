package com.libragraph.synthesis.core.classify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DirectionTest {

    @Test
    void fromLabel_ignoresCase() {
        assertThat(Direction.fromLabel("A_to_B")).isEqualTo(Direction.A_TO_B);
        assertThat(Direction.fromLabel("b_to_a")).isEqualTo(Direction.B_TO_A);
        assertThat(Direction.fromLabel(" Bidirectional ")).isEqualTo(Direction.BIDIRECTIONAL);
    }

    @Test
    void fromLabel_defaultsToAToB() {
        assertThat(Direction.fromLabel(null)).isEqualTo(Direction.A_TO_B);
        assertThat(Direction.fromLabel("both ways")).isEqualTo(Direction.A_TO_B);
    }
}
