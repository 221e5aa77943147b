package com.rigwatch.core.alert;

import com.rigwatch.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcast channel that writes every alert to the log.
 */
public class LoggingAlertSink implements AlertSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertSink.class);

    @Override
    public boolean send(Alert alert) {
        LOG.info("ALERT [{}] device={} type={} severity={} ts={} payload={}",
                alert.getId(), alert.getDeviceId(), alert.getAlertType(),
                alert.getSeverity(), alert.getTimestamp(), alert.getPayload());
        return true;
    }

    @Override
    public String getName() {
        return "log";
    }
}
