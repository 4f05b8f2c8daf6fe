package gr.engine.limiter;

/**
 * Tokens available in both budgets at one instant.
 */
public record BudgetSnapshot(double countAvailable, double throughputAvailable) {
}
