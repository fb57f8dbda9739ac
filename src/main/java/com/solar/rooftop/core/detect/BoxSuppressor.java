package com.solar.rooftop.core.detect;

import com.solar.rooftop.core.model.BoundingBox;
import com.solar.rooftop.core.model.Polygon;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 基于边界框的贪心非极大值抑制
 * <p>
 * 以框面积代替置信度排序：面积大者优先保留，
 * 其余框与已保留框的交集占自身面积比例超过阈值即被抑制。
 */
public class BoxSuppressor {

    private final double overlapThreshold;

    public BoxSuppressor(double overlapThreshold) {
        this.overlapThreshold = overlapThreshold;
    }

    /**
     * @param candidates 候选轮廓
     * @return 保留的轮廓，按边界框面积降序（面积相同时保持输入顺序）
     */
    public List<Polygon> suppress(List<Polygon> candidates) {
        List<Polygon> kept = new ArrayList<>();
        if (candidates.isEmpty()) return kept;

        int size = candidates.size();
        List<Integer> order = new ArrayList<>(size);
        BoundingBox[] boxes = new BoundingBox[size];
        for (int i = 0; i < size; i++) {
            boxes[i] = candidates.get(i).boundingBox();
            order.add(i);
        }

        // 1. 按框面积降序（稳定排序）
        order.sort(Comparator.comparingLong((Integer i) -> boxes[i].area()).reversed());

        boolean[] suppressed = new boolean[size];
        for (int a = 0; a < size; a++) {
            int i = order.get(a);
            if (suppressed[i]) continue;
            kept.add(candidates.get(i));

            // 2. 抑制与当前框重叠过多的较小框
            for (int b = a + 1; b < size; b++) {
                int j = order.get(b);
                if (suppressed[j]) continue;
                if (overlapRatio(boxes[i], boxes[j]) > overlapThreshold) {
                    suppressed[j] = true;
                }
            }
        }
        return kept;
    }

    /**
     * 交集面积 / 较小框（smaller）面积；退化的零面积框视为完全重叠
     */
    static double overlapRatio(BoundingBox larger, BoundingBox smaller) {
        long area = smaller.area();
        if (area == 0) {
            return 1.0;
        }
        return (double) larger.intersectionArea(smaller) / area;
    }
}
