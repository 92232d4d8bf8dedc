package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each critical alert to the log.
 *
 * @since 1.0.0
 */
public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    @Override
    public void notify(Alert alert, Finding finding) {
        LOG.warn("CRITICAL ALERT: {} [key={}, count={}, action={}]",
                finding.getDescription(), alert.getKey(), alert.getCount(), finding.getSuggestedAction());
    }
}
