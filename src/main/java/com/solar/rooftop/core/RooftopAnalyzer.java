package com.solar.rooftop.core;

import com.solar.rooftop.core.detect.ObstacleDetector;
import com.solar.rooftop.core.detect.RooftopDetector;
import com.solar.rooftop.core.energy.EnergyModel;
import com.solar.rooftop.core.energy.RoofCharacteristicsAnalyzer;
import com.solar.rooftop.core.energy.SuitabilityScorer;
import com.solar.rooftop.core.mask.MaskUtils;
import com.solar.rooftop.core.model.*;
import com.solar.rooftop.core.placement.PanelPlacementEngine;
import com.solar.rooftop.core.placement.UsableAreaResolver;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 屋顶光伏分析流水线
 * <p>
 * 图像 → 屋顶检测 → (每个屋顶) 障碍物检测 → 可用区域 → 排布 → 发电量 + 评分
 * <p>
 * 单线程顺序执行，屋顶按检测顺序输出。单个屋顶失败只记录并跳过，
 * 不影响其余屋顶；只有非法输入（图像/配置）才向调用方抛出。
 */
public class RooftopAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(RooftopAnalyzer.class);

    private final AnalysisConfig config;
    private final RooftopDetector rooftopDetector;
    private final ObstacleDetector obstacleDetector;
    private final UsableAreaResolver usableAreaResolver;
    private final PanelPlacementEngine placementEngine;
    private final SuitabilityScorer scorer;
    private final RoofCharacteristicsAnalyzer characteristicsAnalyzer;

    public RooftopAnalyzer(AnalysisConfig config) {
        this.config = config.validate();
        this.rooftopDetector = new RooftopDetector(config);
        this.obstacleDetector = new ObstacleDetector(config);
        this.usableAreaResolver = new UsableAreaResolver(config.getEdgeMarginFraction(), config.getMinEdgeMarginPx());
        this.placementEngine = new PanelPlacementEngine(config.getPixelToMeter(),
                config.getCoverageThreshold(), config.getMinValidInteriorPoints());
        this.scorer = new SuitabilityScorer(config);
        this.characteristicsAnalyzer = new RoofCharacteristicsAnalyzer();
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    /**
     * 分析一张图像
     *
     * @param image 已解码的 8 位图像（调用方负责释放）
     */
    public AnalysisResult analyze(Mat image) {
        long start = System.currentTimeMillis();
        List<Rooftop> rooftops = rooftopDetector.detect(image);
        logger.info("Found {} rooftop(s) in {}x{} image", rooftops.size(), image.cols(), image.rows());

        List<RooftopAnalysis> analyses = new ArrayList<>(rooftops.size());
        List<Integer> failed = new ArrayList<>();
        for (Rooftop rooftop : rooftops) {
            try {
                RooftopAnalysis analysis = analyzeRooftop(image, rooftop);
                analyses.add(analysis);
                logger.info("Rooftop #{}: {} panels, {} rating", rooftop.getId(),
                        analysis.getPanelCount(), analysis.getSuitability().getRating().getLabel());
            } catch (RooftopAnalysisException e) {
                logger.warn("Skipping rooftop: {}", e.getMessage(), e.getCause());
                failed.add(e.getRooftopId());
            }
        }

        logger.info("Analysis finished in {} ms: {} analysed, {} failed",
                System.currentTimeMillis() - start, analyses.size(), failed.size());
        return new AnalysisResult(image.cols(), image.rows(), analyses, failed);
    }

    /**
     * 分析单个屋顶，任何意外异常包装为 {@link RooftopAnalysisException}
     */
    RooftopAnalysis analyzeRooftop(Mat image, Rooftop rooftop) {
        Mat roofMask = null;
        Mat obstacleMask = null;
        Mat usableMask = null;
        try {
            roofMask = MaskUtils.fillPolygon(image.rows(), image.cols(), rooftop.getBoundary());
            obstacleMask = obstacleDetector.detect(image, roofMask);

            int panelW = config.panelWidthPx();
            int panelH = config.panelHeightPx();
            usableMask = usableAreaResolver.resolve(roofMask, obstacleMask, panelW, panelH);

            double roofAngle = rooftop.getAngle();
            List<Panel> panels = placementEngine.place(usableMask, roofAngle, rooftop.getBoundary(),
                    panelW, panelH, config.panelSpacingPx());

            int obstacleCount = obstacleDetector.countObstacles(obstacleMask);
            RoofCharacteristics characteristics = characteristicsAnalyzer.analyze(image, roofMask, rooftop);
            characteristics = characteristics.toBuilder()
                    .adjustedIrradiance(EnergyModel.round(EnergyModel.adjustedIrradiance(characteristics, config), 1))
                    .build();

            return RooftopAnalysis.builder()
                    .rooftopId(rooftop.getId())
                    .roofAreaM2(rooftop.getAreaM2())
                    .usableAreaM2(UsableAreaResolver.usableAreaM2(usableMask, config.getPixelToMeter()))
                    .roofOrientationDegrees(roofAngle)
                    .obstaclesDetected(obstacleCount)
                    .panelCount(panels.size())
                    .panels(panels)
                    .energy(EnergyModel.estimate(panels.size(), config))
                    .suitability(scorer.score(rooftop, panels.size(), obstacleCount))
                    .roofCharacteristics(characteristics)
                    .rooftop(rooftop)
                    .build();
        } catch (RuntimeException e) {
            throw new RooftopAnalysisException(rooftop.getId(), e.getMessage(), e);
        } finally {
            MaskUtils.release(roofMask, obstacleMask, usableMask);
        }
    }
}
