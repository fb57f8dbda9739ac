package com.solar.rooftop.core;

/**
 * 单个屋顶分析失败（例如几何退化）
 * <p>
 * 由 {@link RooftopAnalyzer} 在屋顶边界捕获，不影响同一图像中其余屋顶
 */
public class RooftopAnalysisException extends RuntimeException {

    private final int rooftopId;

    public RooftopAnalysisException(int rooftopId, String message, Throwable cause) {
        super("Rooftop #" + rooftopId + ": " + message, cause);
        this.rooftopId = rooftopId;
    }

    public int getRooftopId() {
        return rooftopId;
    }
}
