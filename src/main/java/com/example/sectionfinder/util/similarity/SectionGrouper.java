package com.example.sectionfinder.util.similarity;

import com.example.sectionfinder.util.similarity.dto.Rect;
import com.example.sectionfinder.util.similarity.dto.SectionGroup;
import com.example.sectionfinder.util.similarity.dto.TextFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 分组器：把一页的文本片段聚类为逻辑行/段落
 *
 * 规则：
 * 1. 去除空白片段
 * 2. 按 top 升序排序；top 相差 5px 以内视为同一视觉行，行内按 left 升序
 * 3. 顺序扫描，维护当前分组的外接矩形：
 *    - 同行：片段垂直范围与分组重叠，直接并入（同一视觉行内的折行 span）
 *    - 下一行续行：0 <= 垂直间距 <= maxLineGap，且水平范围在 maxColumnGap 容差内相交
 *    - 否则关闭当前分组，以该片段开启新分组
 */
public class SectionGrouper {

    private static final Logger log = LoggerFactory.getLogger(SectionGrouper.class);

    /** 默认最大行间距（px） */
    public static final double DEFAULT_MAX_LINE_GAP = 30.0;

    /** 默认最大列间距（px） */
    public static final double DEFAULT_MAX_COLUMN_GAP = 150.0;

    /** 同一视觉行的 top 容差（px） */
    static final double SAME_ROW_TOLERANCE = 5.0;

    private final double maxLineGap;
    private final double maxColumnGap;

    public SectionGrouper() {
        this(DEFAULT_MAX_LINE_GAP, DEFAULT_MAX_COLUMN_GAP);
    }

    public SectionGrouper(double maxLineGap, double maxColumnGap) {
        checkGaps(maxLineGap, maxColumnGap);
        this.maxLineGap = maxLineGap;
        this.maxColumnGap = maxColumnGap;
    }

    public double getMaxLineGap() {
        return maxLineGap;
    }

    public double getMaxColumnGap() {
        return maxColumnGap;
    }

    /**
     * 使用实例配置的间距分组
     */
    public List<SectionGroup> groupFragments(List<TextFragment> fragments) {
        return groupFragments(fragments, maxLineGap, maxColumnGap);
    }

    /**
     * 分组
     *
     * @param fragments 片段（同一页）
     * @param maxLineGap 视为下一行的最大垂直间距
     * @param maxColumnGap 水平范围相交的容差
     * @return 分组列表（自上而下），输入为空时返回空列表
     */
    public List<SectionGroup> groupFragments(List<TextFragment> fragments, double maxLineGap, double maxColumnGap) {
        checkGaps(maxLineGap, maxColumnGap);

        List<SectionGroup> groups = new ArrayList<>();
        if (fragments == null || fragments.isEmpty()) {
            return groups;
        }

        List<TextFragment> sorted = sortIntoRows(fragments.stream()
                .filter(f -> !f.isBlank())
                .collect(Collectors.toList()));
        if (sorted.isEmpty()) {
            return groups;
        }

        List<TextFragment> current = new ArrayList<>();
        current.add(sorted.get(0));
        Rect groupBounds = sorted.get(0).getBounds();

        for (int i = 1; i < sorted.size(); i++) {
            TextFragment fragment = sorted.get(i);
            Rect b = fragment.getBounds();

            boolean onSameLine = b.getTop() <= groupBounds.bottom() && b.bottom() >= groupBounds.getTop();

            double verticalGap = b.getTop() - groupBounds.bottom();
            boolean horizontalOverlap = b.right() >= groupBounds.getLeft() - maxColumnGap
                    && b.getLeft() <= groupBounds.right() + maxColumnGap;
            boolean nextLine = verticalGap >= 0 && verticalGap <= maxLineGap && horizontalOverlap;

            if (onSameLine || nextLine) {
                current.add(fragment);
                groupBounds = groupBounds.union(b);
            } else {
                groups.add(createGroup(current));
                current = new ArrayList<>();
                current.add(fragment);
                groupBounds = b;
            }
        }
        groups.add(createGroup(current));

        if (log.isDebugEnabled()) {
            log.debug("页面 {} 分组完成: {} 个片段 -> {} 个分组",
                    sorted.get(0).getPageNumber(), sorted.size(), groups.size());
        }
        return groups;
    }

    /**
     * 由有序片段创建分组
     *
     * @throws IllegalArgumentException 片段为空或跨页
     */
    public static SectionGroup createGroup(List<TextFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("分组至少需要一个片段");
        }

        int pageNumber = fragments.get(0).getPageNumber();
        List<Rect> rects = new ArrayList<>(fragments.size());
        StringBuilder text = new StringBuilder();

        for (TextFragment f : fragments) {
            if (f.getPageNumber() != pageNumber) {
                throw new IllegalArgumentException("分组片段跨页: " + pageNumber + " / " + f.getPageNumber());
            }
            rects.add(f.getBounds());
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(f.getText());
        }

        return new SectionGroup(fragments, Rect.unionOf(rects), text.toString(), pageNumber,
                SignatureBuilder.buildSignature(fragments));
    }

    /**
     * 按 top 排序后划分视觉行（以行首片段的 top 为基准，5px 容差），行内按 left 排序
     */
    static List<TextFragment> sortIntoRows(List<TextFragment> fragments) {
        List<TextFragment> byTop = new ArrayList<>(fragments);
        byTop.sort(Comparator.comparingDouble((TextFragment f) -> f.getBounds().getTop())
                .thenComparingDouble(f -> f.getBounds().getLeft()));

        List<TextFragment> result = new ArrayList<>(byTop.size());
        List<TextFragment> row = new ArrayList<>();
        double rowTop = 0.0;

        for (TextFragment f : byTop) {
            double top = f.getBounds().getTop();
            if (!row.isEmpty() && top - rowTop >= SAME_ROW_TOLERANCE) {
                flushRow(row, result);
            }
            if (row.isEmpty()) {
                rowTop = top;
            }
            row.add(f);
        }
        flushRow(row, result);

        return result;
    }

    private static void flushRow(List<TextFragment> row, List<TextFragment> out) {
        row.sort(Comparator.comparingDouble(f -> f.getBounds().getLeft()));
        out.addAll(row);
        row.clear();
    }

    private static void checkGaps(double maxLineGap, double maxColumnGap) {
        if (maxLineGap < 0 || maxColumnGap < 0) {
            throw new IllegalArgumentException(
                    "间距参数不能为负: maxLineGap=" + maxLineGap + ", maxColumnGap=" + maxColumnGap);
        }
    }
}
