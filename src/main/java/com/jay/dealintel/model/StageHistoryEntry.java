package com.jay.dealintel.model;

import com.jay.dealintel.model.enums.PipelineStage;

import java.time.LocalDateTime;

/** The moment a deal entered a stage. */
public record StageHistoryEntry(PipelineStage stage, LocalDateTime timestamp) {}
