package my.teampricing.app.pricing;

import java.util.List;
import java.util.Optional;

/**
 * Result of one engine run. Money values are already converted by {@link #converter()}.
 */
public class PricingReport {
	private final String viewId;
	private final PricingSettings settings;
	private final CurrencyConverter converter;
	private final List<StackPricing> stacks;
	private final SharedCosts sharedCosts;
	private final ValidationReport validation;
	private final TeamCostSummary summary;
	private final BreakdownBuilder breakdowns;

	public PricingReport(String viewId,
						 PricingSettings settings,
						 CurrencyConverter converter,
						 List<StackPricing> stacks,
						 SharedCosts sharedCosts,
						 ValidationReport validation,
						 TeamCostSummary summary,
						 BreakdownBuilder breakdowns) {
		this.viewId = viewId;
		this.settings = settings;
		this.converter = converter;
		this.stacks = List.copyOf(stacks);
		this.sharedCosts = sharedCosts;
		this.validation = validation;
		this.summary = summary;
		this.breakdowns = breakdowns;
	}

	public String viewId() {
		return viewId;
	}

	public PricingSettings settings() {
		return settings;
	}

	public CurrencyConverter converter() {
		return converter;
	}

	public List<StackPricing> stacks() {
		return stacks;
	}

	public List<StackPricing> stacks(EmployeeCategory category) {
		return stacks.stream().filter(stack -> stack.category() == category).toList();
	}

	public Optional<StackPricing> stack(EmployeeCategory category, String stackId) {
		return stacks.stream()
				.filter(stack -> stack.category() == category && stack.stackId().equals(stackId))
				.findFirst();
	}

	public SharedCosts sharedCosts() {
		return sharedCosts;
	}

	public ValidationReport validation() {
		return validation;
	}

	public TeamCostSummary summary() {
		return summary;
	}

	public Optional<BreakdownNode> breakdown(EmployeeCategory category, String stackId, String key) {
		return breakdowns.breakdown(category, stackId, key).map(node -> node.convertedWith(converter));
	}

	public List<String> breakdownKeys(EmployeeCategory category) {
		return breakdowns.keys(category);
	}
}
