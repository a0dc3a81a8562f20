package com.whereq.ferry.exception;

import java.util.List;

/**
 * Rules of a grouped job disagree on whether they may run on preemptible instances
 */
public class PreemptibleMismatchException extends ResourceSpecException {
    public PreemptibleMismatchException(List<String> rules) {
        super("All grouped rules should be homogeneously set as preemptible rules: " + rules);
    }
}
