package com.tapas.orderstream.validator.processing;

/**
 * Where the micro-batch processor currently is. A batch walks the stages in declaration
 * order and returns to {@link #IDLE}.
 */
public enum BatchStage {
    IDLE,
    FETCHING_BATCH,
    PARSING,
    CLASSIFYING,
    PERSISTING_VALID,
    PERSISTING_INVALID,
    COMMITTING_CHECKPOINT
}
