package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.NormalizedPosition;
import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.SimilarityResult;
import com.example.sectionfinder.util.similarity.source.ScaledViewportConverter;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.example.sectionfinder.util.similarity.FragmentFixtures.fragment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NgramSectionFinderTest {

    private static final String[] WORDS = {"the", "quick", "brown", "fox", "jumps", "over"};

    /**
     * 每个词一个片段，从 left=50 起每 35px 一个
     */
    private static void addSentence(InMemoryDocument document, int page, double top) {
        for (int i = 0; i < WORDS.length; i++) {
            document.add(fragment(WORDS[i], 50 + 35 * i, top, 30, 12, page));
        }
    }

    private static SearchOptions selectionOnPage2() {
        NormalizedRect rect = new NormalizedRect(50, 100, 220, 112, 600, 800, 2);
        return SearchOptions.builder()
                .selectedText("the quick brown fox jumps")
                .selectedPosition(new NormalizedPosition(2, rect, Collections.singletonList(rect)))
                .threshold(0.8)
                .build();
    }

    @Test
    void findSimilarSections_shouldMapMatchedWordsBackToFragments() {
        // Arrange
        InMemoryDocument document = new InMemoryDocument(5);
        addSentence(document, 2, 100);
        addSentence(document, 4, 300);
        NgramSectionFinder finder = new NgramSectionFinder(document, document, new ScaledViewportConverter());

        // Act
        List<SimilarityResult> results = finder.findSimilarSections(selectionOnPage2());

        // Assert: 选区自身被跳过，只剩第 4 页
        assertThat(results).hasSize(1);
        SimilarityResult result = results.get(0);
        assertThat(result.getText()).isEqualTo("the quick brown fox jumps");
        assertThat(result.getScore()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getPosition().getPageNumber()).isEqualTo(4);
        assertThat(result.getPosition().getRects()).hasSize(5);
        NormalizedRect bounds = result.getPosition().getBoundingRect();
        assertThat(bounds.getX1()).isEqualTo(50);
        assertThat(bounds.getX2()).isEqualTo(220);
        assertThat(bounds.getY1()).isEqualTo(300);
    }

    @Test
    void findSimilarSections_shouldKeepOtherOccurrenceOnSelectionPage() {
        InMemoryDocument document = new InMemoryDocument(3);
        addSentence(document, 2, 100);
        String[] filler = {"terms", "and", "conditions", "apply", "to", "all", "orders"};
        for (int i = 0; i < filler.length; i++) {
            document.add(fragment(filler[i], 50 + 45 * i, 300, 40, 12, 2));
        }
        addSentence(document, 2, 500);
        NgramSectionFinder finder = new NgramSectionFinder(document, document, new ScaledViewportConverter());

        List<SimilarityResult> results = finder.findSimilarSections(selectionOnPage2());

        assertThat(results).hasSize(1);
        assertThat(results.get(0).getPosition().getBoundingRect().getY1()).isEqualTo(500);
    }

    @Test
    void findSimilarSections_shouldSkipPage_whenExtractionFails() {
        InMemoryDocument document = new InMemoryDocument(5);
        addSentence(document, 2, 100);
        addSentence(document, 3, 300);
        addSentence(document, 4, 300);
        document.failOn(3);
        NgramSectionFinder finder = new NgramSectionFinder(document, document, new ScaledViewportConverter());

        List<SimilarityResult> results = finder.findSimilarSections(selectionOnPage2());

        assertThat(results).extracting(r -> r.getPosition().getPageNumber()).containsExactly(4);
    }

    @Test
    void findSimilarSections_shouldReturnEmpty_whenTextIsTooShort() {
        InMemoryDocument document = new InMemoryDocument(5);
        addSentence(document, 4, 300);
        NgramSectionFinder finder = new NgramSectionFinder(document, document, new ScaledViewportConverter());

        List<SimilarityResult> results = finder.findSimilarSections(selectionOnPage2().toBuilder()
                .selectedText("fox")
                .build());

        assertThat(results).isEmpty();
        assertThat(document.getExtractions()).isZero();
    }

    @Test
    void findSimilarSections_shouldReturnEmpty_whenSelectionHasNoDimensions() {
        InMemoryDocument document = new InMemoryDocument(5);
        addSentence(document, 2, 100);
        addSentence(document, 4, 300);
        NgramSectionFinder finder = new NgramSectionFinder(document, document, new ScaledViewportConverter());
        NormalizedRect flat = new NormalizedRect(50, 100, 220, 112, 0, 0, 2);

        List<SimilarityResult> results = finder.findSimilarSections(selectionOnPage2().toBuilder()
                .selectedPosition(new NormalizedPosition(2, flat, Collections.singletonList(flat)))
                .build());

        assertThat(results).isEmpty();
        assertThat(document.getExtractions()).isZero();
    }
}
