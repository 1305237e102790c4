package com.vidnyan.cursormcp.application.service;

import com.vidnyan.cursormcp.application.port.out.RuleRepository;
import com.vidnyan.cursormcp.application.port.out.RuleSource;
import com.vidnyan.cursormcp.domain.rule.FileContext;
import com.vidnyan.cursormcp.domain.rule.Rule;
import com.vidnyan.cursormcp.domain.rule.RuleSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Serves rule sets from the cache, refreshing stale ones from the rule source
 * and keeping a local copy of everything fetched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleManager {

    private final RuleSource ruleSource;
    private final RuleRepository ruleRepository;
    private final RuleCache ruleCache;
    private final Clock clock;

    public RuleSet getRulesForTechnology(String technology) {
        log.debug("Getting rules for technology: {}", technology);
        return ruleCache.getOrLoad(technology, () -> fetchAndStore(technology));
    }

    public RuleSet getRulesForFile(FileContext fileContext) {
        log.info("Getting rules for file: {}", fileContext.filePath());
        return getRulesForTechnology(fileContext.resolveTechnology());
    }

    public Optional<Rule> getRuleById(String ruleId, String technology) {
        return getRulesForTechnology(technology).findById(ruleId);
    }

    private RuleSet fetchAndStore(String technology) {
        List<Rule> rules = ruleSource.fetchRulesForTechnology(technology);
        RuleSet ruleSet = RuleSet.of(rules, clock.instant());

        int saved = ruleRepository.saveAll(technology, ruleSet);
        log.info("Cached {} rules for {} ({} saved locally)", ruleSet.total(), technology, saved);
        return ruleSet;
    }
}
