package com.vidnyan.cursormcp.application.port.out;

import com.vidnyan.cursormcp.domain.rule.RuleSet;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Port for the local copy of fetched rules.
 * Rules are kept one file per rule, grouped by technology.
 */
public interface RuleRepository {

    /**
     * Write every rule of the set, overwriting earlier copies.
     * A rule that cannot be written is skipped.
     * @return number of rules written
     */
    int saveAll(String technology, RuleSet ruleSet);

    /**
     * Directory holding a technology's rule files, if rules were ever saved for it.
     */
    Optional<Path> findTechnologyDirectory(String technology);
}
