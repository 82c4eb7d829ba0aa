package com.example.redline.util.pml.dto;

/**
 * PowerPoint 变更类型
 */
public enum PmlChangeType {
    // 演示文稿
    SlideSizeChanged,
    ThemeChanged,

    // 幻灯片
    SlideInserted,
    SlideDeleted,
    SlideMoved,
    SlideLayoutChanged,
    SlideBackgroundChanged,
    SlideNotesChanged,

    // 形状
    ShapeInserted,
    ShapeDeleted,
    ShapeMoved,
    ShapeResized,
    ShapeRotated,
    ShapeZOrderChanged,

    // 内容
    TextChanged,
    TextFormattingChanged,
    ImageReplaced,
    TableContentChanged,
    ChartDataChanged;

    /**
     * 幻灯片级变更（变更列表中不与形状变更合并）
     */
    public boolean isSlideLevel() {
        switch (this) {
            case SlideInserted:
            case SlideDeleted:
            case SlideMoved:
            case SlideLayoutChanged:
            case SlideBackgroundChanged:
            case SlideNotesChanged:
                return true;
            default:
                return false;
        }
    }
}
