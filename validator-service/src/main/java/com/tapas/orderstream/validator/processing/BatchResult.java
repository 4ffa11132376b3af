package com.tapas.orderstream.validator.processing;

public record BatchResult(long batchId, int records, int valid, int invalid) {
}
