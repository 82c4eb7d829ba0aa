package com.example.redline.util.pml.signature;

import java.util.ArrayList;
import java.util.List;

/**
 * 演示文稿签名
 */
public class PresentationSignature {

    private long slideCx;
    private long slideCy;
    private String themeHash;
    private final List<SlideSignature> slides = new ArrayList<>();

    public void addSlide(SlideSignature slide) {
        slides.add(slide);
    }

    public long getSlideCx() { return slideCx; }
    public void setSlideCx(long slideCx) { this.slideCx = slideCx; }

    public long getSlideCy() { return slideCy; }
    public void setSlideCy(long slideCy) { this.slideCy = slideCy; }

    public String getThemeHash() { return themeHash; }
    public void setThemeHash(String themeHash) { this.themeHash = themeHash; }

    public List<SlideSignature> getSlides() { return slides; }
}
