package com.wpanther.documentsigning.model;

public enum SignerRole {
    LANDLORD("landlord"),
    TENANT("tenant"),
    AGENT("agent");

    private final String code;

    SignerRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
