package com.example.pdfrewrite.service;

import com.example.pdfrewrite.TestDocuments;
import com.example.pdfrewrite.config.RewriteSettings;
import com.example.pdfrewrite.util.locate.SubstringLocator;
import com.example.pdfrewrite.util.locate.dto.MappingEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutputValidatorTest {

    private final OutputValidator validator = new OutputValidator(new RewriteSettings());

    private static MappingEntry locatedEntry(byte[] pdf, String original, String replacement) throws Exception {
        MappingEntry entry = new MappingEntry("9", 0, original, replacement);
        entry.setPageIndex(0);
        new SubstringLocator().locate(TestDocuments.layout(pdf, 0), entry, new ArrayList<>(), new HashSet<>());
        return entry;
    }

    @Test
    void unchangedOutputFailsBothChecks() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");

        List<String> errors = validator.validate(pdf, Collections.singletonList(locatedEntry(pdf, "brown", "red")));

        assertThat(errors).hasSize(2);
        assertThat(errors.get(0)).contains("brown");
        assertThat(errors.get(1)).contains("red").contains("0");
    }

    @Test
    void replacementContainingOriginalIsAllowed() throws Exception {
        byte[] pdf = TestDocuments.singlePage("The quick brown fox");

        List<String> errors = validator.validate(pdf,
                Collections.singletonList(locatedEntry(pdf, "brown", "brown")));

        assertThat(errors).isEmpty();
    }

    @Test
    void entriesWithoutRectAreIgnored() throws Exception {
        MappingEntry entry = new MappingEntry("9", 0, "brown", "red");
        entry.setPageIndex(0);

        assertThat(validator.validate(TestDocuments.singlePage("x"), Collections.singletonList(entry))).isEmpty();
    }

    @Test
    void occurrencesDoNotOverlap() {
        assertThat(OutputValidator.countOccurrences("aaaa", "aa")).isEqualTo(2);
        assertThat(OutputValidator.countOccurrences("abc", "")).isZero();
        assertThat(OutputValidator.countOccurrences("catcat", "cat")).isEqualTo(2);
    }
}
