package com.work.chainexec.crosschain.domain;

public enum StepStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED
}
