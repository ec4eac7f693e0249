package com.scorebot.core.error;

import java.time.LocalDate;
import java.util.List;

/**
 * Thrown when a required tuning parameter has no version on or before the requested date.
 */
public final class MissingParameterException extends ConfigurationException {
    private final LocalDate asOfDate;
    private final List<String> missingNames;

    public MissingParameterException(LocalDate asOfDate, List<String> missingNames) {
        super("missing tuning parameters as_of=" + asOfDate + " names=" + missingNames);
        this.asOfDate = asOfDate;
        this.missingNames = missingNames == null ? List.of() : List.copyOf(missingNames);
    }

    public LocalDate asOfDate() {
        return asOfDate;
    }

    public List<String> missingNames() {
        return missingNames;
    }
}
