package com.mouse.scanner.enums;

public enum ScanState {
    IDLE,
    FETCHING,
    DETECTING,
    DISPATCHING
}
