package com.example.sectionfinder.util.pdf;

import com.example.sectionfinder.util.similarity.dto.FontWeight;
import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import com.example.sectionfinder.util.similarity.source.PageFragmentSource;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 基于 PDFBox 的页面片段来源
 *
 * 重写 writeString 捕获每个词的 TextPosition，合并为一个片段：
 * - 边界框使用 DirAdj 系列坐标（左上角为原点，y 轴向下），再乘以渲染缩放
 * - 字体、字号取第一个字符
 * - 粗体：字体描述的 ForceBold 标志、字重 >= 700，或字体名包含 bold
 *
 * PDFTextStripper 非线程安全，所有提取方法同步执行
 */
public class PdfBoxFragmentSource extends PDFTextStripper implements PageFragmentSource {

    private final PDDocument pdfDocument;
    private final float scale;

    private int pageNumber;
    private List<TextFragment> fragments = new ArrayList<>();

    public PdfBoxFragmentSource(PDDocument document) throws IOException {
        this(document, 1.0f);
    }

    /**
     * @param document 已加载的文档（由调用方关闭）
     * @param scale 渲染缩放（PDF 点 -> 视口像素）
     */
    public PdfBoxFragmentSource(PDDocument document, float scale) throws IOException {
        super();
        if (scale <= 0) {
            throw new IllegalArgumentException("scale 必须为正: " + scale);
        }
        this.pdfDocument = document;
        this.scale = scale;
        setSortByPosition(true);
    }

    @Override
    public synchronized List<TextFragment> getFragments(int pageNumber) throws IOException {
        if (pageNumber < 1 || pageNumber > pdfDocument.getNumberOfPages()) {
            throw new IOException("页码超出范围: " + pageNumber + " / " + pdfDocument.getNumberOfPages());
        }

        this.pageNumber = pageNumber;
        this.fragments = new ArrayList<>();
        setStartPage(pageNumber);
        setEndPage(pageNumber);

        // 输出文本不需要，只收集片段
        getText(pdfDocument);

        List<TextFragment> result = fragments;
        fragments = new ArrayList<>();
        return result;
    }

    /**
     * 每次调用对应一个词，合并为一个片段
     */
    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (textPositions == null || textPositions.isEmpty() || text == null || text.trim().isEmpty()) {
            return;
        }

        float minX = Float.MAX_VALUE;
        float minY = Float.MAX_VALUE;
        float maxX = -Float.MAX_VALUE;
        float maxY = -Float.MAX_VALUE;

        for (TextPosition tp : textPositions) {
            float x = tp.getXDirAdj();
            float baseline = tp.getYDirAdj();

            minX = Math.min(minX, x);
            maxX = Math.max(maxX, x + tp.getWidthDirAdj());
            minY = Math.min(minY, baseline - tp.getHeightDir());
            maxY = Math.max(maxY, baseline);
        }

        TextPosition first = textPositions.get(0);
        PDFont font = first.getFont();
        FontWeight weight = fontWeight(font);

        Rect bounds = Rect.fromEdges(minX * scale, minY * scale, maxX * scale, maxY * scale);
        fragments.add(new TextFragment(text, bounds, pageNumber, fontFamily(font),
                first.getFontSizeInPt() * scale, weight, weight.isBold() || nameSuggestsBold(font)));
    }

    static String fontFamily(PDFont font) {
        if (font == null || font.getName() == null) {
            return "";
        }
        String name = font.getName();
        // 去掉子集前缀，如 ABCDEF+Helvetica
        int plus = name.indexOf('+');
        return plus == 6 ? name.substring(plus + 1) : name;
    }

    static FontWeight fontWeight(PDFont font) {
        if (font == null) {
            return FontWeight.NORMAL;
        }
        PDFontDescriptor descriptor = font.getFontDescriptor();
        if (descriptor != null) {
            if (descriptor.isForceBold()) {
                return FontWeight.BOLD;
            }
            float weight = descriptor.getFontWeight();
            if (weight > 0) {
                return FontWeight.numeric(Math.round(weight));
            }
        }
        return nameSuggestsBold(font) ? FontWeight.BOLD : FontWeight.NORMAL;
    }

    private static boolean nameSuggestsBold(PDFont font) {
        return font != null && font.getName() != null
                && font.getName().toLowerCase(Locale.ROOT).contains("bold");
    }

    public float getScale() {
        return scale;
    }
}
