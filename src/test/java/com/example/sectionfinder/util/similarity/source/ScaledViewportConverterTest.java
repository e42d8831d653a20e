package com.example.sectionfinder.util.similarity.source;

import com.example.sectionfinder.util.similarity.dto.NormalizedRect;
import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.dto.Rect;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScaledViewportConverterTest {

    private final ScaledViewportConverter converter = new ScaledViewportConverter();

    @Test
    void toNormalized_shouldKeepPixelEdgesAndRecordViewportSize() {
        NormalizedRect rect = converter.toNormalized(new Rect(10, 20, 30, 40), new PageViewport(600, 800), 3);

        assertThat(rect.getX1()).isEqualTo(10);
        assertThat(rect.getY1()).isEqualTo(20);
        assertThat(rect.getX2()).isEqualTo(40);
        assertThat(rect.getY2()).isEqualTo(60);
        assertThat(rect.getWidth()).isEqualTo(600);
        assertThat(rect.getHeight()).isEqualTo(800);
        assertThat(rect.getPageNumber()).isEqualTo(3);
    }

    @Test
    void toPixels_shouldScaleToTargetViewport() {
        NormalizedRect normalized = new NormalizedRect(10, 20, 40, 60, 600, 800, 3);

        Rect pixels = converter.toPixels(normalized, new PageViewport(1200, 1600));

        assertThat(pixels).isEqualTo(new Rect(20, 40, 60, 80));
    }

    @Test
    void toPixels_shouldRejectRectWithoutDimensions() {
        NormalizedRect normalized = new NormalizedRect(10, 20, 40, 60, 0, 0, 1);

        assertThatThrownBy(() -> converter.toPixels(normalized, new PageViewport(600, 800)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
