package com.tokendraw.engine.model;

public record DisbursingBalanceReport(
    boolean valid, String address, long balance, long minimumBalance, String error) {}
