package com.foo.ledger.service.pipeline.load;

import com.foo.ledger.model.ParsedUnitRecord;
import com.foo.ledger.service.contract.SaleRow;

/** A sale row built from one parsed record, before it is written. */
record PreparedSale(ParsedUnitRecord record, SaleRow row) {}
