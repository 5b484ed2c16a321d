package com.example.pdfrewrite.util.coordinate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 页面矩形（左上角为原点，y 向下）
 *
 * 与 {@code TextPosition} 的 DirAdj 坐标一致；需要写回 PDF 用户空间时用
 * {@link #toPdfY(float, float)} 翻转。
 */
public final class Rect {

    public final float x0;
    public final float y0;
    public final float x1;
    public final float y1;

    public Rect(float x0, float y0, float x1, float y1) {
        this.x0 = Math.min(x0, x1);
        this.y0 = Math.min(y0, y1);
        this.x1 = Math.max(x0, x1);
        this.y1 = Math.max(y0, y1);
    }

    /**
     * 从 [x0, y0, x1, y1] 数组构建，长度不为 4 时返回 null
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Rect of(List<? extends Number> values) {
        if (values == null || values.size() != 4) {
            return null;
        }
        for (Number n : values) {
            if (n == null) {
                return null;
            }
        }
        return new Rect(values.get(0).floatValue(), values.get(1).floatValue(),
                values.get(2).floatValue(), values.get(3).floatValue());
    }

    /**
     * 选区四边形合并为外接矩形
     *
     * 每个四边形为 8 个数（4 个点）或 4 个数（矩形）
     */
    public static Rect fromQuads(List<List<Double>> quads) {
        Rect result = null;
        if (quads == null) {
            return null;
        }
        for (List<Double> quad : quads) {
            if (quad == null || (quad.size() != 8 && quad.size() != 4)) {
                continue;
            }
            float minX = Float.MAX_VALUE;
            float minY = Float.MAX_VALUE;
            float maxX = -Float.MAX_VALUE;
            float maxY = -Float.MAX_VALUE;
            for (int i = 0; i + 1 < quad.size(); i += 2) {
                float x = quad.get(i).floatValue();
                float y = quad.get(i + 1).floatValue();
                minX = Math.min(minX, x);
                minY = Math.min(minY, y);
                maxX = Math.max(maxX, x);
                maxY = Math.max(maxY, y);
            }
            Rect r = new Rect(minX, minY, maxX, maxY);
            result = result == null ? r : result.union(r);
        }
        return result;
    }

    public float width() {
        return x1 - x0;
    }

    public float height() {
        return y1 - y0;
    }

    public float area() {
        return Math.max(0f, width()) * Math.max(0f, height());
    }

    public boolean isEmpty() {
        return width() <= 0f || height() <= 0f;
    }

    /**
     * 相交判断（边界接触不算相交）
     */
    public boolean intersects(Rect other) {
        if (other == null) {
            return false;
        }
        return x0 < other.x1 && other.x0 < x1 && y0 < other.y1 && other.y0 < y1;
    }

    public boolean contains(Rect other) {
        return other != null && x0 <= other.x0 && y0 <= other.y0 && x1 >= other.x1 && y1 >= other.y1;
    }

    public Rect union(Rect other) {
        if (other == null) {
            return this;
        }
        return new Rect(Math.min(x0, other.x0), Math.min(y0, other.y0),
                Math.max(x1, other.x1), Math.max(y1, other.y1));
    }

    public Rect expand(float padding) {
        return new Rect(x0 - padding, y0 - padding, x1 + padding, y1 + padding);
    }

    /**
     * 顶部坐标翻转为 PDF 用户空间（左下角原点）的 y
     */
    public static float toPdfY(float topY, float pageHeight) {
        return pageHeight - topY;
    }

    @JsonValue
    public float[] toArray() {
        return new float[]{x0, y0, x1, y1};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rect)) {
            return false;
        }
        Rect r = (Rect) o;
        return Float.compare(x0, r.x0) == 0 && Float.compare(y0, r.y0) == 0
                && Float.compare(x1, r.x1) == 0 && Float.compare(y1, r.y1) == 0;
    }

    @Override
    public int hashCode() {
        int h = Float.hashCode(x0);
        h = 31 * h + Float.hashCode(y0);
        h = 31 * h + Float.hashCode(x1);
        return 31 * h + Float.hashCode(y1);
    }

    @Override
    public String toString() {
        return String.format("[%.2f, %.2f, %.2f, %.2f]", x0, y0, x1, y1);
    }
}
