package com.storylens.highlight;

public class ApplyOutcome {
    private final int marked;
    private final int unmarked;
    private final int unchanged;

    public ApplyOutcome(int marked, int unmarked, int unchanged) {
        this.marked = marked;
        this.unmarked = unmarked;
        this.unchanged = unchanged;
    }

    public int getMarked() {
        return marked;
    }

    public int getUnmarked() {
        return unmarked;
    }

    public int getUnchanged() {
        return unchanged;
    }

    @Override
    public String toString() {
        return "+" + marked + " -" + unmarked + " =" + unchanged;
    }
}
