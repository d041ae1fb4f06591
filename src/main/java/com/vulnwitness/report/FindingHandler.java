package com.vulnwitness.report;

import com.vulnwitness.model.Finding;

/**
 * Receives the results of an analysis. Each vulnerability id is passed to
 * {@link #osv(String)} once, before its first finding.
 */
public interface FindingHandler {
    void osv(String id);

    void finding(Finding finding);
}
