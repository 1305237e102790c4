package com.vidnyan.cursormcp.application.port.out;

import com.vidnyan.cursormcp.domain.rule.Rule;

import java.util.List;

/**
 * Port for fetching rule definitions from wherever they are published.
 * Implementations never throw: failures degrade to fallback rules or an empty list.
 */
public interface RuleSource {

    /**
     * Fetch all rules published for a technology.
     */
    List<Rule> fetchRulesForTechnology(String technology);

    /**
     * Fetch the rules for the technology a file path's extension maps to.
     */
    List<Rule> fetchRulesByFilePattern(String filePath);
}
