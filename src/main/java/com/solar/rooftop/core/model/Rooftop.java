package com.solar.rooftop.core.model;

/**
 * 检测到的单个屋顶及其几何指标
 * <p>
 * id 在一次分析内唯一（从 1 开始，按检测顺序编号），创建后不再修改
 */
public final class Rooftop {
    private final int id;
    private final Polygon boundary;
    private final double areaPixels;
    private final double areaM2;
    private final Point centroid;
    private final OrientedRect orientedRect;

    public Rooftop(int id, Polygon boundary, double areaPixels, double areaM2,
                   Point centroid, OrientedRect orientedRect) {
        this.id = id;
        this.boundary = boundary;
        this.areaPixels = areaPixels;
        this.areaM2 = areaM2;
        this.centroid = centroid;
        this.orientedRect = orientedRect;
    }

    public int getId() { return id; }
    public Polygon getBoundary() { return boundary; }
    public double getAreaPixels() { return areaPixels; }
    public double getAreaM2() { return areaM2; }
    public Point getCentroid() { return centroid; }
    public OrientedRect getOrientedRect() { return orientedRect; }

    /**
     * 屋顶朝向角（度）
     */
    public double getAngle() {
        return orientedRect.getAngleDegrees();
    }

    @Override
    public String toString() {
        return "Rooftop{" +
                "id=" + id +
                ", areaPx=" + areaPixels +
                ", areaM2=" + String.format("%.2f", areaM2) +
                ", centroid=" + centroid +
                ", angle=" + orientedRect.getAngleDegrees() +
                '}';
    }
}
