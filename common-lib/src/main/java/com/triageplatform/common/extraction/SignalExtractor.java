package com.triageplatform.common.extraction;

import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.common.model.Signal;

import java.util.List;

/**
 * Turns a raw incident into verified signals before any worker runs.
 *
 * <p>Contract:
 * <ul>
 *   <li>Returned signals carry unique, sequential ids ({@code sig_001}, {@code sig_002}, ...).</li>
 *   <li>A failing sub-analysis must not prevent the others' signals from being returned.</li>
 *   <li>Deterministic: the same incident always yields the same signals.</li>
 * </ul>
 */
public interface SignalExtractor {
    List<Signal> extract(IncidentInput incident);
}
