package com.example.learningsession.session;

import com.example.learningsession.bridge.Subscription;
import com.example.learningsession.ledger.LedgerEntry;
import lombok.Value;

import java.util.List;

/**
 * What a newly attached observer starts from: the ledger so far, then live
 * events through {@link #subscription}. Taken atomically, so nothing falls
 * between the two.
 */
@Value
public class SessionAttachment {
    SessionContext context;
    List<LedgerEntry> entries;
    Subscription subscription;
}
