package com.hostsentinel.core.alert;

import com.hostsentinel.core.model.Alert;
import com.hostsentinel.core.model.Finding;

/**
 * Side channel told about every critical finding.
 *
 * <p>
 * Implementations may throw; the {@link AlertManager} catches and logs
 * the failure and carries on.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertNotifier {

    /**
     * @param alert   the alert state after the finding was recorded
     * @param finding the critical finding
     */
    void notify(Alert alert, Finding finding);
}
