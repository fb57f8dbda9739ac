package com.solar.rooftop.core.placement;

import com.solar.rooftop.core.mask.MaskUtils;
import com.solar.rooftop.core.model.Dimensions;
import com.solar.rooftop.core.model.Panel;
import com.solar.rooftop.core.model.Point;
import com.solar.rooftop.core.model.Polygon;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 光伏板排布引擎
 * <p>
 * 对横向、纵向两种朝向各做一次贪心排布，取板数多者（相同时取横向）。
 * 单次排布按行优先、固定步长（板尺寸 + 间距）扫描候选左上角，
 * 候选需同时满足覆盖率与内部采样点在屋顶轮廓内两个条件；
 * 一旦接受即在工作掩码上清零其占用区域，后续候选不会与之重叠。
 * <p>
 * 扫描网格始终轴对齐，只有输出的角点按屋顶角度旋转。
 */
public class PanelPlacementEngine {
    private static final Logger logger = LoggerFactory.getLogger(PanelPlacementEngine.class);

    public enum Orientation {
        LANDSCAPE,  // 配置的 宽 x 高
        PORTRAIT    // 宽高互换
    }

    private final double pixelToMeter;
    private final double coverageThreshold;
    private final int minValidInteriorPoints;

    public PanelPlacementEngine(double pixelToMeter, double coverageThreshold, int minValidInteriorPoints) {
        this.pixelToMeter = pixelToMeter;
        this.coverageThreshold = coverageThreshold;
        this.minValidInteriorPoints = minValidInteriorPoints;
    }

    /**
     * 两种朝向各排布一次，返回板数更多的结果
     *
     * @param usableMask    可用掩码（只读，不会被修改）
     * @param roofAngle     屋顶角度（度），用于旋转输出角点
     * @param roofBoundary  屋顶轮廓，用于内部采样点检验
     * @param panelWidthPx  板宽（像素）
     * @param panelHeightPx 板高（像素）
     * @param spacingPx     板间距（像素）
     */
    public List<Panel> place(Mat usableMask, double roofAngle, Polygon roofBoundary,
                             int panelWidthPx, int panelHeightPx, int spacingPx) {
        List<Panel> landscape = placeWithOrientation(usableMask, roofAngle, roofBoundary,
                panelWidthPx, panelHeightPx, spacingPx);
        List<Panel> portrait = placeWithOrientation(usableMask, roofAngle, roofBoundary,
                panelHeightPx, panelWidthPx, spacingPx);

        Orientation chosen = landscape.size() >= portrait.size() ? Orientation.LANDSCAPE : Orientation.PORTRAIT;
        logger.debug("Placement: landscape={}, portrait={}, chosen={}", landscape.size(), portrait.size(), chosen);
        return chosen == Orientation.LANDSCAPE ? landscape : portrait;
    }

    /**
     * 单一朝向的贪心排布
     */
    public List<Panel> placeWithOrientation(Mat usableMask, double roofAngle, Polygon roofBoundary,
                                            int panelW, int panelH, int spacingPx) {
        List<Panel> panels = new ArrayList<>();
        int rows = usableMask.rows();
        int cols = usableMask.cols();
        if (panelW <= 0 || panelH <= 0 || panelW >= cols || panelH >= rows) {
            return panels;
        }

        // 工作副本：本次调用独占，接受的板位清零
        byte[] available = MaskUtils.toBytes(usableMask);

        int stepX = panelW + spacingPx;
        int stepY = panelH + spacingPx;
        int panelId = 1;

        MatOfPoint2f contour = roofBoundary.toMatOfPoint2f();
        try {
            for (int y = 0; y < rows - panelH; y += stepY) {
                for (int x = 0; x < cols - panelW; x += stepX) {
                    double coverage = coverage(available, cols, x, y, panelW, panelH);
                    if (coverage <= coverageThreshold) continue;
                    if (!interiorPointsValid(contour, x, y, panelW, panelH)) continue;

                    panels.add(createPanelGeometry(panelId++, x, y, panelW, panelH, roofAngle));
                    clear(available, cols, x, y, panelW, panelH);
                }
            }
        } finally {
            contour.release();
        }
        return panels;
    }

    /**
     * 板位内仍可用像素占比
     */
    static double coverage(byte[] available, int cols, int x, int y, int w, int h) {
        int size = w * h;
        if (size == 0) return 0;
        int usable = 0;
        for (int row = y; row < y + h; row++) {
            int offset = row * cols;
            for (int col = x; col < x + w; col++) {
                if (available[offset + col] != 0) usable++;
            }
        }
        return (double) usable / size;
    }

    private static void clear(byte[] available, int cols, int x, int y, int w, int h) {
        for (int row = y; row < y + h; row++) {
            int offset = row * cols;
            for (int col = x; col < x + w; col++) {
                available[offset + col] = 0;
            }
        }
    }

    /**
     * 四个内部采样点（从四角向中心偏移 1/4）至少 minValidInteriorPoints 个在轮廓内或轮廓上
     */
    boolean interiorPointsValid(MatOfPoint2f contour, int x, int y, int w, int h) {
        int[][] samples = {
                {x + w / 4, y + h / 4},
                {x + 3 * w / 4, y + h / 4},
                {x + w / 4, y + 3 * h / 4},
                {x + 3 * w / 4, y + 3 * h / 4}
        };
        int valid = 0;
        for (int[] s : samples) {
            if (Imgproc.pointPolygonTest(contour, new org.opencv.core.Point(s[0], s[1]), false) >= 0) {
                valid++;
            }
        }
        return valid >= minValidInteriorPoints;
    }

    /**
     * 生成单块板的几何：中心、绕中心旋转后的四角（两位小数）、尺寸
     */
    Panel createPanelGeometry(int panelId, int x, int y, int width, int height, double angle) {
        Point center = new Point(x + width / 2.0, y + height / 2.0);
        Point[] local = {
                new Point(x, y),                    // 左上
                new Point(x + width, y),            // 右上
                new Point(x + width, y + height),   // 右下
                new Point(x, y + height)            // 左下
        };

        List<Point> corners = new ArrayList<>(4);
        for (Point p : local) {
            Point r = p.rotateAround(center, angle);
            corners.add(new Point(round2(r.x), round2(r.y)));
        }

        return Panel.builder()
                .panelId(panelId)
                .center(new Point(round2(center.x), round2(center.y)))
                .corners(corners)
                .rotationDegrees(round2(angle))
                .dimensionsPixels(new Dimensions(width, height))
                .dimensionsMeters(new Dimensions(round2(width * pixelToMeter), round2(height * pixelToMeter)))
                .build();
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
