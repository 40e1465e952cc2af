package com.realtime.admission.availability;

import com.realtime.admission.model.ProbeResult;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous health check for one dependency, registered with
 * {@link ServiceAvailabilityManager#registerProbe}.
 *
 * <p>A probe reports FAILED either by returning {@link ProbeResult#failed(String)} or by
 * completing exceptionally (typically with {@link ProbeException}). The manager bounds every
 * probe with its own timeout, so implementations need not time-box themselves.</p>
 */
@FunctionalInterface
public interface ServiceHealthProbe {
    
    CompletionStage<ProbeResult> check();
}
