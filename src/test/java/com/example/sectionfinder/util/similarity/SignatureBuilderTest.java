package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.SectionGroup;
import com.example.sectionfinder.util.similarity.dto.Signature;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.example.sectionfinder.util.similarity.FragmentFixtures.styled;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignatureBuilderTest {

    @Test
    void buildSignature_shouldAggregateStyleAndGeometry() {
        // Arrange
        List<TextFragment> fragments = Arrays.asList(
                styled("Hello", 60, 100, 40, 10, 1, "Times-Roman", 10f, false),
                styled("world", 45, 115, 40, 14, 1, "Arial", 14f, true));

        // Act
        Signature signature = SignatureBuilder.buildSignature(fragments);

        // Assert
        assertThat(signature.getElementCount()).isEqualTo(2);
        assertThat(signature.getFontFamily()).isEqualTo("Times-Roman");
        assertThat(signature.getAvgFontSize()).isCloseTo(12f, within(1e-6f));
        assertThat(signature.isBold()).isTrue();
        assertThat(signature.getLineHeight()).isCloseTo(29f, within(1e-6f));
        assertThat(signature.getLeft()).isCloseTo(45f, within(1e-6f));
    }

    @Test
    void textLength_shouldExcludeSeparators() {
        SectionGroup group = SectionGrouper.createGroup(Arrays.asList(
                styled("Hello", 50, 100, 40, 12, 1, "Arial", 12f, false),
                styled("world", 95, 100, 40, 12, 1, "Arial", 12f, false)));

        assertThat(group.getText()).isEqualTo("Hello world");
        assertThat(group.getSignature().getTextLength()).isEqualTo(10);
    }

    @Test
    void buildSignature_shouldReturnDegenerateSignature_whenNoFragments() {
        Signature signature = SignatureBuilder.buildSignature(Collections.emptyList());

        assertThat(signature).isSameAs(Signature.EMPTY);
        assertThat(signature.isDegenerate()).isTrue();
    }
}
