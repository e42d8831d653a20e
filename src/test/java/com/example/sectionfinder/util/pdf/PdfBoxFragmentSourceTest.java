package com.example.sectionfinder.util.pdf;

import com.example.sectionfinder.util.similarity.TextUtils;
import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PdfBoxFragmentSourceTest {

    private PDDocument document;

    @BeforeEach
    void setUp() throws IOException {
        document = new PDDocument();
        PdfFixtures.addPage(document, Standard14Fonts.FontName.HELVETICA_BOLD, 12, 50, 700, "Hello World");
        PdfFixtures.addPage(document, Standard14Fonts.FontName.HELVETICA, 10, 80, 400, "Second page text");
    }

    @AfterEach
    void tearDown() throws IOException {
        document.close();
    }

    private static String joined(List<TextFragment> fragments) {
        return TextUtils.normalize(fragments.stream().map(TextFragment::getText).collect(Collectors.joining(" ")));
    }

    @Test
    void getFragments_shouldExtractTextPositionsAndStyle() throws IOException {
        // Act
        List<TextFragment> fragments = new PdfBoxFragmentSource(document).getFragments(1);

        // Assert
        assertThat(joined(fragments)).isEqualTo("hello world");
        TextFragment first = fragments.get(0);
        assertThat(first.getPageNumber()).isEqualTo(1);
        assertThat(first.getFontFamily()).isEqualTo("Helvetica-Bold");
        assertThat(first.getFontSize()).isCloseTo(12f, within(0.5f));
        assertThat(first.isBold()).isTrue();

        // 基线 y=700 对应自顶向下 842 - 700 = 142
        Rect bounds = first.getBounds();
        assertThat(bounds.getLeft()).isCloseTo(50, within(1.0));
        assertThat(bounds.bottom()).isCloseTo(142, within(1.5));
        assertThat(bounds.getTop()).isLessThan(bounds.bottom());
    }

    @Test
    void getFragments_shouldOnlyReturnRequestedPage() throws IOException {
        PdfBoxFragmentSource source = new PdfBoxFragmentSource(document);

        List<TextFragment> second = source.getFragments(2);
        List<TextFragment> first = source.getFragments(1);

        assertThat(joined(second)).isEqualTo("second page text");
        assertThat(second).allMatch(f -> f.getPageNumber() == 2 && !f.isBold());
        assertThat(joined(first)).isEqualTo("hello world");
    }

    @Test
    void getFragments_shouldApplyRenderScale() throws IOException {
        TextFragment plain = new PdfBoxFragmentSource(document).getFragments(1).get(0);
        TextFragment scaled = new PdfBoxFragmentSource(document, 2.0f).getFragments(1).get(0);

        assertThat(scaled.getBounds().getLeft()).isCloseTo(plain.getBounds().getLeft() * 2, within(0.01));
        assertThat(scaled.getBounds().getTop()).isCloseTo(plain.getBounds().getTop() * 2, within(0.01));
        assertThat(scaled.getFontSize()).isCloseTo(plain.getFontSize() * 2, within(0.01f));
    }

    @Test
    void getFragments_shouldFail_whenPageIsOutOfRange() throws IOException {
        PdfBoxFragmentSource source = new PdfBoxFragmentSource(document);

        assertThatThrownBy(() -> source.getFragments(3)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> source.getFragments(0)).isInstanceOf(IOException.class);
    }
}
