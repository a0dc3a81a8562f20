package com.whereq.ferry.exception;

/**
 * Memory or disk was not declared for a job
 */
public class MissingResourceSpecException extends ResourceSpecException {

    public MissingResourceSpecException(String resource, String ruleName) {
        super(String.format(
            "No %s resource defined for job from rule %s. Make sure to configure default resources.",
            resource, ruleName));
    }
}
