package com.example.pdfrewrite.config;

import com.example.pdfrewrite.util.rewrite.RewriteStrategyKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewriteConfigTest {

    @Test
    void strategiesAreParsedInOrder() {
        assertThat(RewriteConfig.parseStrategies(" literal , SUBSTITUTE_FONT"))
                .containsExactly(RewriteStrategyKind.LITERAL, RewriteStrategyKind.SUBSTITUTE_FONT);
    }

    @Test
    void emptyStrategyListIsRejected() {
        assertThatThrownBy(() -> RewriteConfig.parseStrategies(" , "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
