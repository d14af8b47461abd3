package com.tableops.backend.modules.order.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OrderNumberFormatterTest {

    @Test
    @DisplayName("sequence is zero padded to three digits")
    void formatsWithPadding() {
        assertThat(OrderNumberFormatter.format(LocalDate.of(2024, 3, 5), 7)).isEqualTo("ORD-20240305-007");
    }

    @Test
    @DisplayName("sequences past 999 keep all digits")
    void formatsLargeSequence() {
        assertThat(OrderNumberFormatter.format(LocalDate.of(2024, 12, 31), 1234)).isEqualTo("ORD-20241231-1234");
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> OrderNumberFormatter.format(null, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OrderNumberFormatter.format(LocalDate.of(2024, 1, 1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
