package com.mailrules.api;

import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.api.model.Rule;

import java.nio.file.Path;
import java.util.List;

/**
 * Contract for reading a persisted rule file.
 */
public interface IRuleLoader {

    /**
     * Loads all rules from a file, in file order.
     *
     * @param rulesPath path to the rule file
     * @return the rules (possibly empty)
     * @throws RuleLoadException if the file cannot be read or parsed
     */
    List<Rule> load(Path rulesPath) throws RuleLoadException;
}
