package my.teampricing.app.pricing;

/**
 * One explanation tree, already converted, together with the view and currency it was computed for.
 */
public record StackBreakdown(String viewId, CurrencyConverter converter, BreakdownNode node) {
}
