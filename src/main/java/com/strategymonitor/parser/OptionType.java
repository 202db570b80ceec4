package com.strategymonitor.parser;

public enum OptionType {
    CALL("C"),
    PUT("P");

    private final String code;

    OptionType(String code) {
        this.code = code;
    }

    /** One-letter code used in option tickers. */
    public String getCode() {
        return code;
    }
}
