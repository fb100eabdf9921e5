package com.accesslist.core.condition;

/**
 * Outcome of evaluating a version condition, declared in ascending severity.
 */
public enum ConditionResult {

    /** The operation may proceed. */
    SUCCEEDED,

    /** A read may answer "not modified" instead of returning the entity. */
    UNMODIFIED,

    /** The precondition does not hold; the operation must be rejected. */
    FAILED;

    /**
     * The more severe of the two results.
     */
    public ConditionResult max(ConditionResult other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
