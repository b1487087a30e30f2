package com.auctionhouse.core.error;

/**
 * Malformed or type-inconsistent listing configuration or request arguments.
 */
public class ValidationException extends MarketplaceException {

    private final ValidationRule rule;

    public ValidationException(ValidationRule rule, String message) {
        super(rule.name(), message);
        this.rule = rule;
    }

    public ValidationRule getRule() {
        return rule;
    }
}
