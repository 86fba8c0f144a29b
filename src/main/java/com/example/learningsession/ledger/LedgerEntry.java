package com.example.learningsession.ledger;

import com.example.learningsession.model.Message;
import lombok.Value;

/**
 * One append to the ledger: either a new message or a new revision of one.
 */
@Value
public class LedgerEntry {
    long sequenceNumber;
    Message message;
}
