package com.tokendraw.engine.model;

/** A holder's slice of the eligible weight, as drawn on the wheel. */
public record HolderShare(String address, String displayName, long balance, double percentage) {}
