package com.example.sendworker.api;

import java.time.Instant;

public record WorkerStatusResponse(Instant retryNotBefore, boolean sendingDeferred) {}
