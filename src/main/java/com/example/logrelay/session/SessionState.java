package com.example.logrelay.session;

public enum SessionState {
    CREATED, ACTIVE, EXPIRED, CLOSED;

    public boolean isTerminal() {
        return this == EXPIRED || this == CLOSED;
    }
}
