package io.github.eutro.shaderdebug.ops;

import io.github.eutro.shaderdebug.ext.ExtHolder;

/**
 * A kind of operation, without immediates. Behaviour shared by all ops of a kind is
 * attached to the key as exts.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    public OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
