package com.saleslog.pipeline.model;

public enum PipelineState {
    IDLE,
    SCANNING,
    PROCESSING,
    DONE
}
