package com.whereq.ferry.resource;

/**
 * Decides whether a rule may run on a preemptible instance
 */
@FunctionalInterface
public interface PreemptiblePolicy {

    boolean isPreemptible(String ruleName);
}
