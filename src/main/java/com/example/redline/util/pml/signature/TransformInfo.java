package com.example.redline.util.pml.signature;

/**
 * a:xfrm，单位 EMU，旋转为 1/60000 度
 */
public class TransformInfo {

    private final long x;
    private final long y;
    private final long cx;
    private final long cy;
    private final int rotation;
    private final boolean flipH;
    private final boolean flipV;

    public TransformInfo(long x, long y, long cx, long cy, int rotation, boolean flipH, boolean flipV) {
        this.x = x;
        this.y = y;
        this.cx = cx;
        this.cy = cy;
        this.rotation = rotation;
        this.flipH = flipH;
        this.flipV = flipV;
    }

    /**
     * 位置在容差内
     */
    public boolean isNear(TransformInfo other, long tolerance) {
        return Math.abs(x - other.x) <= tolerance && Math.abs(y - other.y) <= tolerance;
    }

    /**
     * 尺寸在容差内
     */
    public boolean isSameSize(TransformInfo other, long tolerance) {
        return Math.abs(cx - other.cx) <= tolerance && Math.abs(cy - other.cy) <= tolerance;
    }

    public double distanceTo(TransformInfo other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public long getX() { return x; }

    public long getY() { return y; }

    public long getCx() { return cx; }

    public long getCy() { return cy; }

    public int getRotation() { return rotation; }

    public boolean isFlipH() { return flipH; }

    public boolean isFlipV() { return flipV; }
}
