package com.solar.rooftop.core.energy;

import com.solar.rooftop.core.AnalysisConfig;
import com.solar.rooftop.core.model.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SuitabilityScorerTest {

    private final SuitabilityScorer scorer = new SuitabilityScorer(AnalysisConfig.defaults());

    private static Rooftop rooftop(double areaM2, double width, double height) {
        OrientedRect rect = OrientedRect.builder()
                .center(new Point(50, 50))
                .width(width)
                .height(height)
                .angleDegrees(0)
                .build();
        return new Rooftop(1, Polygon.rectangle(0, 0, 100, 100), areaM2 / 0.0225, areaM2,
                new Point(50, 50), rect);
    }

    @Test
    void idealRoofScoresFull() {
        SuitabilityScore score = scorer.score(rooftop(80, 100, 90), 12, 0);

        assertEquals(100, score.getScore());
        assertEquals(Rating.EXCELLENT, score.getRating());
        assertEquals(100, score.getMaxScore());
        assertEquals(0, score.getObstaclesFound());
    }

    @Test
    void tinyCrowdedRoofScoresPoor() {
        SuitabilityScore score = scorer.score(rooftop(10, 300, 50), 1, 8);

        assertEquals(0, score.getScore());
        assertEquals(Rating.POOR, score.getRating());
    }

    @Test
    void componentsAddUp() {
        // 面积 25 + 板数 25 + 形状 10 + 障碍物 10
        SuitabilityScore score = scorer.score(rooftop(35, 180, 100), 7, 2);

        assertEquals(70, score.getScore());
        assertEquals(Rating.GOOD, score.getRating());
    }

    @Test
    void ratingBands() {
        assertEquals(Rating.EXCELLENT, scorer.rate(80));
        assertEquals(Rating.GOOD, scorer.rate(79));
        assertEquals(Rating.GOOD, scorer.rate(60));
        assertEquals(Rating.FAIR, scorer.rate(59));
        assertEquals(Rating.FAIR, scorer.rate(40));
        assertEquals(Rating.POOR, scorer.rate(39));
        assertEquals(Rating.POOR, scorer.rate(0));
    }

    @Test
    void pointTables() {
        assertEquals(35, SuitabilityScorer.areaPoints(50));
        assertEquals(25, SuitabilityScorer.areaPoints(49.9));
        assertEquals(15, SuitabilityScorer.areaPoints(20));
        assertEquals(0, SuitabilityScorer.areaPoints(19.9));

        assertEquals(35, SuitabilityScorer.panelPoints(10));
        assertEquals(25, SuitabilityScorer.panelPoints(5));
        assertEquals(15, SuitabilityScorer.panelPoints(2));
        assertEquals(0, SuitabilityScorer.panelPoints(1));

        assertEquals(15, SuitabilityScorer.shapePoints(1.0));
        assertEquals(15, SuitabilityScorer.shapePoints(1.5));
        assertEquals(10, SuitabilityScorer.shapePoints(2.0));
        assertEquals(0, SuitabilityScorer.shapePoints(2.1));

        assertEquals(15, SuitabilityScorer.obstaclePoints(0));
        assertEquals(10, SuitabilityScorer.obstaclePoints(2));
        assertEquals(5, SuitabilityScorer.obstaclePoints(5));
        assertEquals(0, SuitabilityScorer.obstaclePoints(6));
    }

    @Test
    void scoreNeverDecreasesWithMorePanels() {
        Rooftop roof = rooftop(40, 100, 100);
        int previous = -1;
        for (int panels = 0; panels <= 20; panels++) {
            int score = scorer.score(roof, panels, 1).getScore();
            assertTrue(score >= previous);
            assertTrue(score >= 0 && score <= SuitabilityScorer.MAX_SCORE);
            previous = score;
        }
    }

    @Test
    void scoreNeverIncreasesWithMoreObstacles() {
        Rooftop roof = rooftop(40, 100, 100);
        int previous = Integer.MAX_VALUE;
        for (int obstacles = 0; obstacles <= 10; obstacles++) {
            int score = scorer.score(roof, 6, obstacles).getScore();
            assertTrue(score <= previous);
            previous = score;
        }
    }

    @Test
    void degenerateRectangleTreatedAsSquare() {
        // 面积 0 + 板数 0 + 形状 15（长宽比按 1）+ 障碍物 15
        assertEquals(30, scorer.score(rooftop(0, 10, 0), 0, 0).getScore());
    }
}
