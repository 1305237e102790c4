package com.vidnyan.cursormcp.domain.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rules fetched for a technology in one go.
 * {@code total} always equals the number of rules.
 */
public record RuleSet(
    List<Rule> rules,
    int total,
    @JsonProperty("fetched_at") Instant fetchedAt
) {

    public RuleSet {
        rules = List.copyOf(rules);
        if (total != rules.size()) {
            throw new IllegalArgumentException(
                    "total " + total + " does not match rule count " + rules.size());
        }
        Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    public static RuleSet of(List<Rule> rules, Instant fetchedAt) {
        return new RuleSet(rules, rules.size(), fetchedAt);
    }

    public Optional<Rule> findById(String ruleId) {
        return rules.stream()
                .filter(rule -> rule.id().equals(ruleId))
                .findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rules.isEmpty();
    }
}
