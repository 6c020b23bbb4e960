package com.traceforge.database.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Link between an internal testcase and its id in one external tool. At most one per
 * (testcase, tool).
 */
public record TcmTestcaseMapping(
        int mappingId,
        UUID testcaseId,
        TcmTool tool,
        String externalTestcaseId,
        SyncDirection syncDirection,
        Instant lastSyncedAt) {}
