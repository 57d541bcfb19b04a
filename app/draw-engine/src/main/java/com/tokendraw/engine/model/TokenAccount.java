package com.tokendraw.engine.model;

/** A single token account as reported by the ledger. */
public record TokenAccount(String address, String owner, String mint, long amount) {}
