package com.pipewright.core.state;

public enum StateLocation {
    CANONICAL,
    LEGACY
}
