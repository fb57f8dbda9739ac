package com.solar.rooftop.core.energy;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.model.Rating;
import com.solar.rooftop.core.model.Rooftop;
import com.solar.rooftop.core.model.SuitabilityScore;

/**
 * 屋顶适宜度评分（0-100）
 * <p>
 * 面积 35 分、板数 35 分、形状 15 分、障碍物 15 分，合计后按分档给出等级。
 */
public class SuitabilityScorer {

    public static final int MAX_SCORE = 100;

    // 面积（m²）
    static final double AREA_LARGE_M2 = 50;
    static final double AREA_MEDIUM_M2 = 30;
    static final double AREA_SMALL_M2 = 20;
    static final int AREA_LARGE_POINTS = 35;
    static final int AREA_MEDIUM_POINTS = 25;
    static final int AREA_SMALL_POINTS = 15;

    // 板数
    static final int PANELS_MANY = 10;
    static final int PANELS_SOME = 5;
    static final int PANELS_FEW = 2;
    static final int PANELS_MANY_POINTS = 35;
    static final int PANELS_SOME_POINTS = 25;
    static final int PANELS_FEW_POINTS = 15;

    // 长宽比越接近正方形越好
    static final double SHAPE_TIGHT_MIN = 0.8;
    static final double SHAPE_TIGHT_MAX = 1.5;
    static final double SHAPE_LOOSE_MIN = 0.5;
    static final double SHAPE_LOOSE_MAX = 2.0;
    static final int SHAPE_TIGHT_POINTS = 15;
    static final int SHAPE_LOOSE_POINTS = 10;

    // 障碍物数量
    static final int OBSTACLES_FEW = 2;
    static final int OBSTACLES_SOME = 5;
    static final int OBSTACLES_NONE_POINTS = 15;
    static final int OBSTACLES_FEW_POINTS = 10;
    static final int OBSTACLES_SOME_POINTS = 5;

    private final int excellentCutoff;
    private final int goodCutoff;
    private final int fairCutoff;

    public SuitabilityScorer(AnalysisConfig config) {
        this(config.getExcellentCutoff(), config.getGoodCutoff(), config.getFairCutoff());
    }

    public SuitabilityScorer(int excellentCutoff, int goodCutoff, int fairCutoff) {
        this.excellentCutoff = excellentCutoff;
        this.goodCutoff = goodCutoff;
        this.fairCutoff = fairCutoff;
    }

    public SuitabilityScore score(Rooftop rooftop, int panelCount, int obstacleCount) {
        int score = areaPoints(rooftop.getAreaM2())
                + panelPoints(panelCount)
                + shapePoints(rooftop.getOrientedRect().aspectRatio())
                + obstaclePoints(obstacleCount);

        return SuitabilityScore.builder()
                .score(score)
                .rating(rate(score))
                .maxScore(MAX_SCORE)
                .obstaclesFound(obstacleCount)
                .build();
    }

    public Rating rate(int score) {
        if (score >= excellentCutoff) return Rating.EXCELLENT;
        if (score >= goodCutoff) return Rating.GOOD;
        if (score >= fairCutoff) return Rating.FAIR;
        return Rating.POOR;
    }

    static int areaPoints(double areaM2) {
        if (areaM2 >= AREA_LARGE_M2) return AREA_LARGE_POINTS;
        if (areaM2 >= AREA_MEDIUM_M2) return AREA_MEDIUM_POINTS;
        if (areaM2 >= AREA_SMALL_M2) return AREA_SMALL_POINTS;
        return 0;
    }

    static int panelPoints(int panelCount) {
        if (panelCount >= PANELS_MANY) return PANELS_MANY_POINTS;
        if (panelCount >= PANELS_SOME) return PANELS_SOME_POINTS;
        if (panelCount >= PANELS_FEW) return PANELS_FEW_POINTS;
        return 0;
    }

    static int shapePoints(double aspectRatio) {
        if (aspectRatio >= SHAPE_TIGHT_MIN && aspectRatio <= SHAPE_TIGHT_MAX) return SHAPE_TIGHT_POINTS;
        if (aspectRatio >= SHAPE_LOOSE_MIN && aspectRatio <= SHAPE_LOOSE_MAX) return SHAPE_LOOSE_POINTS;
        return 0;
    }

    // 超过 5 个障碍物不加分
    static int obstaclePoints(int obstacleCount) {
        if (obstacleCount == 0) return OBSTACLES_NONE_POINTS;
        if (obstacleCount <= OBSTACLES_FEW) return OBSTACLES_FEW_POINTS;
        if (obstacleCount <= OBSTACLES_SOME) return OBSTACLES_SOME_POINTS;
        return 0;
    }
}
