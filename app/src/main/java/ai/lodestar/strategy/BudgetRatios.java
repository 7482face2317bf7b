package ai.lodestar.strategy;

import ai.lodestar.evidence.ProviderType;
import ai.lodestar.exception.InvalidInputException;

/** Fractions of the total token budget given to each provider type. They sum to 1 within {@link #SUM_TOLERANCE}. */
public record BudgetRatios(double diff, double lsp, double search) {
    public static final double SUM_TOLERANCE = 0.1;
    private static final double EPSILON = 1e-9;

    public BudgetRatios {
        checkRatio("diff", diff);
        checkRatio("lsp", lsp);
        checkRatio("search", search);
        double sum = diff + lsp + search;
        InvalidInputException.check(
                Math.abs(sum - 1.0) <= SUM_TOLERANCE + EPSILON, "budget ratios must sum to 1 (+/- 0.1), got " + sum);
    }

    private static void checkRatio(String name, double value) {
        InvalidInputException.check(
                value >= 0.0 && value <= 1.0, "budget ratio " + name + " must be within [0,1]: " + value);
    }

    public double ratioFor(ProviderType type) {
        return switch (type) {
            case DIFF -> diff;
            case LSP -> lsp;
            case SEARCH -> search;
        };
    }

    public double sum() {
        return diff + lsp + search;
    }
}
