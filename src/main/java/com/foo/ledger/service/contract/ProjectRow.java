package com.foo.ledger.service.contract;

public record ProjectRow(String name, String displayName) {}
