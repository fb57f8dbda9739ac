package com.solar.rooftop.core.render;

import com.solar.rooftop.core.model.*;
import com.solar.rooftop.core.model.Point;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 结果标注：在原图副本上绘制屋顶轮廓（按等级着色）、光伏板和编号，
 * 并在底部追加汇总信息与图例
 */
public class ResultAnnotator {

    public static final int SUMMARY_HEIGHT = 120;

    // BGR
    private static final Map<Rating, Scalar> RATING_COLORS = new EnumMap<>(Rating.class);

    static {
        RATING_COLORS.put(Rating.EXCELLENT, new Scalar(0, 255, 0));   // 绿
        RATING_COLORS.put(Rating.GOOD, new Scalar(0, 255, 255));      // 黄
        RATING_COLORS.put(Rating.FAIR, new Scalar(0, 165, 255));      // 橙
        RATING_COLORS.put(Rating.POOR, new Scalar(0, 0, 255));        // 红
    }

    private static final Scalar PANEL_FILL = new Scalar(255, 200, 0);
    private static final Scalar PANEL_OUTLINE = new Scalar(0, 100, 255);
    private static final Scalar WHITE = new Scalar(255, 255, 255);
    private static final Scalar LIGHT_GRAY = new Scalar(200, 200, 200);
    private static final Scalar SUMMARY_BACKGROUND = new Scalar(40, 40, 40);

    public static Scalar colorOf(Rating rating) {
        return RATING_COLORS.getOrDefault(rating, new Scalar(128, 128, 128));
    }

    /**
     * 绘制标注并追加汇总条
     *
     * @return 新图像（高度 = 原图高度 + {@link #SUMMARY_HEIGHT}），调用方负责释放
     */
    public Mat annotate(Mat image, AnalysisResult result) {
        Mat drawn = drawResults(image, result);
        Mat summary = createSummaryStrip(drawn.cols(), result);
        try {
            Mat output = new Mat();
            Core.vconcat(Arrays.asList(drawn, summary), output);
            return output;
        } finally {
            drawn.release();
            summary.release();
        }
    }

    /**
     * 在原图副本上绘制屋顶与光伏板
     */
    public Mat drawResults(Mat image, AnalysisResult result) {
        Mat output = toBgr(image);

        for (RooftopAnalysis analysis : result.getAnalyses()) {
            Scalar color = colorOf(analysis.getSuitability().getRating());

            Rooftop rooftop = analysis.getRooftop();
            if (rooftop != null) {
                MatOfPoint outline = rooftop.getBoundary().toMatOfPoint();
                Imgproc.drawContours(output, Collections.singletonList(outline), -1, color, 3);
                outline.release();
            }

            for (Panel panel : analysis.getPanels()) {
                MatOfPoint pts = toMatOfPoint(panel.getCorners());
                List<MatOfPoint> polys = Collections.singletonList(pts);
                Imgproc.fillPoly(output, polys, PANEL_FILL);
                Imgproc.polylines(output, polys, true, PANEL_OUTLINE, 2);
                pts.release();
            }

            Point anchor = labelAnchor(analysis);
            String label = "#" + analysis.getRooftopId() + ": " + analysis.getPanelCount() + " panels";
            Imgproc.putText(output, label,
                    new org.opencv.core.Point((int) anchor.x - 40, (int) anchor.y - 10),
                    Imgproc.FONT_HERSHEY_SIMPLEX, 0.5, WHITE, 2);
        }
        return output;
    }

    /**
     * 标签位置：屋顶质心，没有屋顶信息时取第一块板中心
     */
    private static Point labelAnchor(RooftopAnalysis analysis) {
        if (analysis.getRooftop() != null) {
            return analysis.getRooftop().getCentroid();
        }
        if (!analysis.getPanels().isEmpty()) {
            return analysis.getPanels().get(0).getCenter();
        }
        return new Point(100, 50);
    }

    Mat createSummaryStrip(int width, AnalysisResult result) {
        Mat summary = new Mat(SUMMARY_HEIGHT, width, CvType.CV_8UC3, SUMMARY_BACKGROUND);

        int y = 25;
        Imgproc.putText(summary, "SOLAR ANALYSIS SUMMARY", new org.opencv.core.Point(10, y),
                Imgproc.FONT_HERSHEY_SIMPLEX, 0.7, WHITE, 2);

        y += 30;
        String stats = String.format("Rooftops: %d  |  Panels: %d  |  Capacity: %.1f kW  |  Annual Energy: %.0f kWh",
                result.getAnalyses().size(), result.getTotalPanels(),
                result.getTotalCapacityKw(), result.getTotalAnnualKwh());
        Imgproc.putText(summary, stats, new org.opencv.core.Point(10, y),
                Imgproc.FONT_HERSHEY_SIMPLEX, 0.5, LIGHT_GRAY, 1);

        // 图例
        y += 35;
        int x = 10;
        for (Rating rating : new Rating[]{Rating.EXCELLENT, Rating.GOOD, Rating.FAIR, Rating.POOR}) {
            Imgproc.rectangle(summary, new org.opencv.core.Point(x, y - 12),
                    new org.opencv.core.Point(x + 15, y + 3), colorOf(rating), -1);
            Imgproc.putText(summary, rating.getLabel(), new org.opencv.core.Point(x + 20, y),
                    Imgproc.FONT_HERSHEY_SIMPLEX, 0.4, LIGHT_GRAY, 1);
            x += 100;
        }
        return summary;
    }

    private static Mat toBgr(Mat image) {
        Mat bgr = new Mat();
        if (image.channels() == 1) {
            Imgproc.cvtColor(image, bgr, Imgproc.COLOR_GRAY2BGR);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, bgr, Imgproc.COLOR_BGRA2BGR);
        } else {
            image.copyTo(bgr);
        }
        return bgr;
    }

    private static MatOfPoint toMatOfPoint(List<Point> corners) {
        List<org.opencv.core.Point> pts = new ArrayList<>(corners.size());
        for (Point c : corners) {
            pts.add(new org.opencv.core.Point((int) c.x, (int) c.y));
        }
        MatOfPoint mat = new MatOfPoint();
        mat.fromList(pts);
        return mat;
    }
}
