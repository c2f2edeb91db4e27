package com.example.partstream.audit;

import com.example.partstream.part.PartContext;

/**
 * Receives one notification per served or rejected delivery request.
 */
public interface AuditListener {

    enum Mode { CURSOR, KEYS }

    AuditListener NOOP = new AuditListener() {
        @Override
        public void onDelivery(PartContext context, Mode mode, int partsServed, boolean cursorUsed) {
        }

        @Override
        public void onRejected(PartContext context, String code) {
        }
    };

    void onDelivery(PartContext context, Mode mode, int partsServed, boolean cursorUsed);

    void onRejected(PartContext context, String code);
}
