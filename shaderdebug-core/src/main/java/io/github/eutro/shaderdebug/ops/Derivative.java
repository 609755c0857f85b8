package io.github.eutro.shaderdebug.ops;

public enum Derivative {
    DDX_COARSE(true, false),
    DDX_FINE(true, true),
    DDY_COARSE(false, false),
    DDY_FINE(false, true);

    public final boolean horizontal;
    public final boolean fine;

    Derivative(boolean horizontal, boolean fine) {
        this.horizontal = horizontal;
        this.fine = fine;
    }
}
