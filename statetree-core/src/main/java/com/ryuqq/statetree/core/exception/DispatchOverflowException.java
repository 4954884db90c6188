package com.ryuqq.statetree.core.exception;

/**
 * Listeners kept mutating the tree for more follow-up passes than the dispatcher allows.
 *
 * <p>Reported to the error observer; the remaining queued passes are dropped.</p>
 *
 * @author StateTree Team
 * @since 1.0.0
 */
public class DispatchOverflowException extends StateTreeException {

    private final int droppedPasses;

    public DispatchOverflowException(int maxCascadePasses, int droppedPasses) {
        super("Listener cascade exceeded " + maxCascadePasses + " follow-up passes; dropped " + droppedPasses);
        this.droppedPasses = droppedPasses;
    }

    public int getDroppedPasses() {
        return droppedPasses;
    }
}
