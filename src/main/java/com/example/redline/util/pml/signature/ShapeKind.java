package com.example.redline.util.pml.signature;

/**
 * 形状类别
 */
public enum ShapeKind {
    Unknown,
    AutoShape,
    /** 有文字的 AutoShape */
    TextBox,
    Picture,
    Table,
    Chart,
    SmartArt,
    Group,
    Connector,
    OleObject
}
