package com.di.pgproof.target;

public enum TargetKind {
    REPLICA("replica"),
    PRIMARY("primary"),
    NONE("none");

    private final String code;

    TargetKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
