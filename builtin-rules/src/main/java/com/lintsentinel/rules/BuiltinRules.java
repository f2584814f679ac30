package com.lintsentinel.rules;

import com.lintsentinel.core.catalog.RuleCatalog;
import com.lintsentinel.rules.eslint.Eqeqeq;
import com.lintsentinel.rules.eslint.NoConsole;
import com.lintsentinel.rules.eslint.NoDebugger;
import com.lintsentinel.rules.eslint.NoUnusedVars;
import com.lintsentinel.rules.jest.NoDisabledTests;
import com.lintsentinel.rules.react.JsxKey;
import com.lintsentinel.rules.typescript.NoExplicitAny;
import com.lintsentinel.rules.unicorn.NoNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Registry of the rules shipped with Lint Sentinel.
 *
 * <p>
 * This is the single point of extension when adding a built-in rule:
 * implement the rule with a {@code fromConfig} factory and list it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class BuiltinRules {

    private static final Logger LOG = LoggerFactory.getLogger(BuiltinRules.class);

    private static final RuleCatalog CATALOG = RuleCatalog.of(List.of(
            new BuiltinRuleDescriptor("eslint", NoConsole.NAME, NoConsole::fromConfig),
            new BuiltinRuleDescriptor("eslint", NoDebugger.NAME, NoDebugger::fromConfig),
            new BuiltinRuleDescriptor("eslint", NoUnusedVars.NAME, NoUnusedVars::fromConfig),
            new BuiltinRuleDescriptor("eslint", Eqeqeq.NAME, Eqeqeq::fromConfig),
            new BuiltinRuleDescriptor("react", JsxKey.NAME, JsxKey::fromConfig),
            new BuiltinRuleDescriptor("typescript", NoExplicitAny.NAME, NoExplicitAny::fromConfig),
            new BuiltinRuleDescriptor("jest", NoDisabledTests.NAME, NoDisabledTests::fromConfig),
            new BuiltinRuleDescriptor("unicorn", NoNull.NAME, NoNull::fromConfig)));

    static {
        LOG.debug("Registered {} built-in rule(s)", CATALOG.size());
    }

    private BuiltinRules() {
        // not instantiable
    }

    /**
     * @return the immutable catalog of built-in rules
     */
    public static RuleCatalog catalog() {
        return CATALOG;
    }
}
