package com.example.sectionfinder.util.similarity;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class TextUtilsTest {

    @Test
    void normalize_shouldLowercaseTrimAndCollapseWhitespace() {
        assertThat(TextUtils.normalize("  Section\t2.1 \n Overview ")).isEqualTo("section 2.1 overview");
        assertThat(TextUtils.normalize(null)).isEmpty();
    }

    @Test
    void significantWords_shouldKeepWordsLongerThanLimit() {
        assertThat(TextUtils.significantWords("The fee is due in 30 days", 2))
                .containsExactlyInAnyOrder("the", "fee", "due", "days");
        assertThat(TextUtils.words("   ")).isEmpty();
    }

    @Test
    void jaccard_shouldBeZero_whenBothSetsAreEmpty() {
        assertThat(TextUtils.jaccard(Collections.emptySet(), Collections.emptySet())).isZero();
        assertThat(TextUtils.jaccard(Arrays.asList("a", "b"), Arrays.asList("b", "c"))).isEqualTo(1.0 / 3.0);
    }
}
