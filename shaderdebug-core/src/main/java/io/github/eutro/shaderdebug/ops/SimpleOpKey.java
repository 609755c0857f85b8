package io.github.eutro.shaderdebug.ops;

/**
 * A key for ops without immediates, all sharing one {@link Op} instance.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
