package com.example.sectionfinder.util.similarity.source;

import com.example.sectionfinder.util.similarity.dto.TextFragment;

import java.io.IOException;
import java.util.List;

/**
 * 页面片段来源（渲染器/内容流读取器的适配接口）
 */
public interface PageFragmentSource {

    /**
     * 获取指定页的文本片段（页码从 1 开始）
     *
     * @param pageNumber 页码
     * @return 该页片段，坐标为该页视口像素空间
     * @throws IOException 该页内容无法读取
     */
    List<TextFragment> getFragments(int pageNumber) throws IOException;
}
