package com.deviceotp.domain;

public enum AuditAction {
    REGISTER("register"),
    VERIFY("verify"),
    DEACTIVATE("deactivate");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
