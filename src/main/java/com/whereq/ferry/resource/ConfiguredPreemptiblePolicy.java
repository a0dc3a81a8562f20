package com.whereq.ferry.resource;

import com.whereq.ferry.config.FerryProperties;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Preemptible rules from {@code ferry.preemptible.*}
 */
@Component
public class ConfiguredPreemptiblePolicy implements PreemptiblePolicy {

    private final boolean all;
    private final Set<String> rules;

    public ConfiguredPreemptiblePolicy(FerryProperties properties) {
        this.all = properties.getPreemptible().isAll();
        this.rules = new HashSet<>(properties.getPreemptible().getRules());
    }

    @Override
    public boolean isPreemptible(String ruleName) {
        return all || rules.contains(ruleName);
    }
}
