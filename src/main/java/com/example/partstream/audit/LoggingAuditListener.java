package com.example.partstream.audit;

import com.example.partstream.part.PartContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to the {@code partstream.audit} logger so they can be routed
 * to a separate appender.
 */
public class LoggingAuditListener implements AuditListener {

    public static final String LOGGER_NAME = "partstream.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void onDelivery(PartContext context, Mode mode, int partsServed, boolean cursorUsed) {
        audit.info("delivery mode={} principal={} parts={} cursor={}",
                mode, principal(context), partsServed, cursorUsed);
    }

    @Override
    public void onRejected(PartContext context, String code) {
        audit.warn("rejected code={} principal={}", code, principal(context));
    }

    private static String principal(PartContext context) {
        return context == null ? "-" : context.principal().orElse("anonymous");
    }
}
