package com.example.sendworker.model;

// throttleCount は試行中に受けた 429 の回数
public record SendResponse(SendOutcome outcome, int throttleCount) {}
