package com.example.pdfrewrite.util.overlay;

/**
 * 视觉覆盖统计：覆盖区域个数与面积占页面面积的百分比
 */
public class OverlayStats {

    private int count;
    private double overlayArea;
    private double pageArea;

    public void record(double area) {
        count++;
        overlayArea += area;
    }

    public void addPageArea(double area) {
        pageArea += area;
    }

    public void merge(OverlayStats other) {
        count += other.count;
        overlayArea += other.overlayArea;
        pageArea += other.pageArea;
    }

    public int getCount() {
        return count;
    }

    public double getOverlayArea() {
        return overlayArea;
    }

    public double getPageArea() {
        return pageArea;
    }

    /**
     * 覆盖面积百分比，保留两位小数
     */
    public double getAreaPct() {
        if (pageArea <= 0) {
            return 0.0;
        }
        return Math.round(overlayArea / pageArea * 10000.0) / 100.0;
    }

    @Override
    public String toString() {
        return "OverlayStats{count=" + count + ", areaPct=" + getAreaPct() + "%}";
    }
}
