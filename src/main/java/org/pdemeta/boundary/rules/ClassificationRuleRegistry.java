package org.pdemeta.boundary.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry for classification rules applied in order.
 */
public final class ClassificationRuleRegistry {

    private final List<IClassificationRule> rules = new ArrayList<>();

    /**
     * Registers a new classification rule after the existing ones.
     * @param rule The rule to register.
     */
    public void register(IClassificationRule rule) { rules.add(rule); }

    /**
     * @return The registered rules, in the order they are tried.
     */
    public List<IClassificationRule> rules() { return rules; }

    /**
     * Initializes a new registry with the initial-condition, edge and interface rules.
     * @return A new registry with default rules.
     */
    public static ClassificationRuleRegistry initializeWithDefaults() {
        ClassificationRuleRegistry reg = new ClassificationRuleRegistry();
        reg.register(new InitialConditionRule());
        reg.register(new EdgeRule());
        reg.register(new InterfaceRule());
        return reg;
    }
}
