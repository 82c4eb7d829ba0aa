package com.example.redline.util.pml.signature;

import java.util.ArrayList;
import java.util.List;

/**
 * 段落签名
 */
public class ParagraphSignature {

    private final List<RunSignature> runs = new ArrayList<>();
    private String alignment;
    private boolean hasBullet;

    public void addRun(RunSignature run) {
        runs.add(run);
    }

    public String getPlainText() {
        StringBuilder sb = new StringBuilder();
        for (RunSignature r : runs) {
            sb.append(r.getText());
        }
        return sb.toString();
    }

    public List<RunSignature> getRuns() { return runs; }

    public String getAlignment() { return alignment; }
    public void setAlignment(String alignment) { this.alignment = alignment; }

    public boolean isHasBullet() { return hasBullet; }
    public void setHasBullet(boolean hasBullet) { this.hasBullet = hasBullet; }
}
