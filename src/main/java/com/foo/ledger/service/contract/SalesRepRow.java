package com.foo.ledger.service.contract;

public record SalesRepRow(String id, String name) {}
