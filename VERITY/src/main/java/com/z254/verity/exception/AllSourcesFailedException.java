package com.z254.verity.exception;

import com.z254.verity.domain.model.FetchError;

import java.util.List;

/**
 * No query slot returned data and at least one failed; there is nothing to analyze.
 */
public class AllSourcesFailedException extends VerityException {

    private final List<FetchError> errors;

    public AllSourcesFailedException(List<FetchError> errors) {
        super("All data sources failed: " + errors.size() + " query slot(s) returned no data");
        this.errors = List.copyOf(errors);
    }

    public List<FetchError> getErrors() {
        return errors;
    }
}
