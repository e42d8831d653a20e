package com.example.sectionfinder.util.pdf;

import com.example.sectionfinder.util.similarity.dto.PageViewport;
import com.example.sectionfinder.util.similarity.source.DocumentInfo;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.util.Optional;

/**
 * 基于 PDFBox 的文档信息
 *
 * 视口 = CropBox 尺寸 * 缩放；页面旋转 90/270 度时宽高互换
 */
public class PdfBoxDocumentInfo implements DocumentInfo {

    private final PDDocument document;
    private final float scale;

    public PdfBoxDocumentInfo(PDDocument document, float scale) {
        this.document = document;
        this.scale = scale;
    }

    @Override
    public int getTotalPages() {
        return document.getNumberOfPages();
    }

    @Override
    public Optional<PageViewport> viewportFor(int pageNumber) {
        if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
            return Optional.empty();
        }

        PDPage page = document.getPage(pageNumber - 1);
        PDRectangle cropBox = page.getCropBox();
        if (cropBox == null || cropBox.getWidth() <= 0 || cropBox.getHeight() <= 0) {
            return Optional.empty();
        }

        double width = cropBox.getWidth() * scale;
        double height = cropBox.getHeight() * scale;
        int rotation = page.getRotation() % 360;
        if (rotation == 90 || rotation == 270 || rotation == -90 || rotation == -270) {
            return Optional.of(new PageViewport(height, width));
        }
        return Optional.of(new PageViewport(width, height));
    }
}
