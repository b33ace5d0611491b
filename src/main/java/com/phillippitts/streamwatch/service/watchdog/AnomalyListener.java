package com.phillippitts.streamwatch.service.watchdog;

import com.phillippitts.streamwatch.domain.Anomaly;

/**
 * Receives anomalies that survived gate confirmation and debounce.
 * Always invoked on the control executor.
 */
@FunctionalInterface
public interface AnomalyListener {

    void onAnomaly(Anomaly anomaly);
}
