package com.agilab.log_collecting.remote;

public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
