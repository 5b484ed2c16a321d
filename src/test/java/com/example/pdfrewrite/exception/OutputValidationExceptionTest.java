package com.example.pdfrewrite.exception;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class OutputValidationExceptionTest {

    @Test
    void messageListsFirstFiveErrors() {
        OutputValidationException e = new OutputValidationException(
                Arrays.asList("e1", "e2", "e3", "e4", "e5", "e6", "e7"));

        assertThat(e.getMessage()).contains("7").contains("e1").contains("e5").doesNotContain("e6").endsWith("...");
        assertThat(e.getErrors()).hasSize(7);
        assertThat(e.getResult()).isNull();
    }

    @Test
    void shortListIsNotTruncated() {
        OutputValidationException e = new OutputValidationException(Arrays.asList("only"));

        assertThat(e.getMessage()).contains("only").doesNotContain("...");
        assertThat(e).isInstanceOf(RenderException.class);
    }
}
