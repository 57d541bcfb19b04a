package com.tokendraw.engine.model;

public record TransferInstruction(String recipient, long amount, boolean createRecipientAccount) {}
