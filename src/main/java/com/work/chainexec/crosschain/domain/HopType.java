package com.work.chainexec.crosschain.domain;

public enum HopType {
    SWAP,
    BRIDGE
}
