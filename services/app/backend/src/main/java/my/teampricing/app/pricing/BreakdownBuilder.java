package my.teampricing.app.pricing;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the explanation tree for one metric of one stack on request. Only the subtree under the requested key is
 * computed.
 */
public class BreakdownBuilder {
	public static final String FINAL_PRICE = "final_price_hr";
	public static final String TOTAL_RELEASEABLE_COST = "total_releaseable_cost_hr";
	public static final String COGS = "cogs_hr";
	public static final String TOTAL_OVERHEADS = "total_overheads_hr";
	public static final String OVERHEAD = "overhead_hr";
	public static final String MARGIN_MULTIPLIER = "margin_multiplier";
	public static final String RISK_MULTIPLIER = "risk_multiplier";

	private static final String RAW = "_raw_hr";
	private static final String COST = "_cost_hr";
	private static final String OWN_OVERHEAD = "_overhead_hr";
	private static final String CAPACITY = "_capacity_hours";
	private static final String ADD_ON = "_addon_hr";
	private static final String RAW_ADD_ON = "_raw_addon_hr";
	private static final String OVERHEAD_ADD_ON = "_overhead_addon_hr";

	private final PricingFormulaEngine formulas;
	private final CategoryStackAggregator aggregator;
	private final EffectiveDataset dataset;

	public BreakdownBuilder(PricingFormulaEngine formulas, CategoryStackAggregator aggregator, EffectiveDataset dataset) {
		this.formulas = formulas;
		this.aggregator = aggregator;
		this.dataset = dataset;
	}

	public Optional<BreakdownNode> breakdown(EmployeeCategory category, String stackId, String key) {
		if (category == null || !category.isStackBound()) {
			throw new IllegalArgumentException("Breakdowns are available for DEV and AGENTIC_AI stacks only");
		}
		if (key == null || stackId == null || dataset.techStacks().stream().noneMatch(stack -> stack.id().equals(stackId))) {
			return Optional.empty();
		}
		return new StackContext(category, stackId).node(key);
	}

	public List<String> keys(EmployeeCategory category) {
		String prefix = category.keyPrefix();
		List<String> keys = new ArrayList<>(List.of(FINAL_PRICE, TOTAL_RELEASEABLE_COST, COGS, TOTAL_OVERHEADS,
				MARGIN_MULTIPLIER, RISK_MULTIPLIER, prefix + RAW, prefix + COST, prefix + CAPACITY));
		boolean dev = category == EmployeeCategory.DEV;
		if (dev) {
			keys.addAll(List.of("qa" + ADD_ON, "ba" + ADD_ON, "qa" + RAW_ADD_ON, "ba" + RAW_ADD_ON));
		}
		for (PricingOverheadType type : dataset.activeOverheadTypes()) {
			keys.add(OVERHEAD + ":" + type.id());
			keys.add(prefix + OWN_OVERHEAD + ":" + type.id());
			if (dev) {
				keys.add("qa" + OVERHEAD_ADD_ON + ":" + type.id());
				keys.add("ba" + OVERHEAD_ADD_ON + ":" + type.id());
			}
		}
		return keys;
	}

	private final class StackContext {
		private final EmployeeCategory category;
		private final String stackId;
		private final String prefix;
		private CategoryPool pool;

		private StackContext(EmployeeCategory category, String stackId) {
			this.category = category;
			this.stackId = stackId;
			this.prefix = category.keyPrefix();
		}

		private Optional<BreakdownNode> node(String key) {
			int separator = key.indexOf(':');
			String base = separator < 0 ? key : key.substring(0, separator);
			String typeId = separator < 0 ? null : key.substring(separator + 1);
			if (typeId != null) {
				Optional<PricingOverheadType> type = dataset.activeOverheadTypes().stream()
						.filter(candidate -> candidate.id().equals(typeId))
						.findFirst();
				return type.flatMap(found -> overheadNode(base, found));
			}
			if (base.equals(FINAL_PRICE)) {
				return Optional.of(finalPrice());
			}
			if (base.equals(TOTAL_RELEASEABLE_COST)) {
				return Optional.of(releaseableCost());
			}
			if (base.equals(COGS)) {
				return Optional.of(cogs());
			}
			if (base.equals(TOTAL_OVERHEADS)) {
				return Optional.of(totalOverheads());
			}
			if (base.equals(MARGIN_MULTIPLIER)) {
				return Optional.of(multiplier(MARGIN_MULTIPLIER, "Margin multiplier", PricingSettings.MARGIN, formulas.settings().margin()));
			}
			if (base.equals(RISK_MULTIPLIER)) {
				return Optional.of(multiplier(RISK_MULTIPLIER, "Risk multiplier", PricingSettings.RISK, formulas.settings().risk()));
			}
			if (base.equals(prefix + RAW)) {
				return Optional.of(raw());
			}
			if (base.equals(prefix + COST)) {
				return Optional.of(cost());
			}
			if (base.equals(prefix + CAPACITY)) {
				return Optional.of(capacity());
			}
			if (category == EmployeeCategory.DEV) {
				for (EmployeeCategory shared : List.of(EmployeeCategory.QA, EmployeeCategory.BA)) {
					if (base.equals(shared.keyPrefix() + ADD_ON)) {
						return Optional.of(addOn(shared));
					}
					if (base.equals(shared.keyPrefix() + RAW_ADD_ON)) {
						return Optional.of(rawAddOn(shared));
					}
				}
			}
			return Optional.empty();
		}

		private Optional<BreakdownNode> overheadNode(String base, PricingOverheadType type) {
			if (base.equals(OVERHEAD)) {
				return Optional.of(overhead(type));
			}
			if (base.equals(prefix + OWN_OVERHEAD)) {
				return Optional.of(ownOverhead(type));
			}
			if (category == EmployeeCategory.DEV) {
				for (EmployeeCategory shared : List.of(EmployeeCategory.QA, EmployeeCategory.BA)) {
					if (base.equals(shared.keyPrefix() + OVERHEAD_ADD_ON)) {
						return Optional.of(overheadAddOn(shared, type));
					}
				}
			}
			return Optional.empty();
		}

		private CategoryPool pool() {
			if (pool == null) {
				pool = aggregator.stackPool(dataset, category, stackId);
			}
			return pool;
		}

		private BreakdownNode finalPrice() {
			return BreakdownNode.product(FINAL_PRICE, "Final price per hour", List.of(
					releaseableCost(),
					multiplier(MARGIN_MULTIPLIER, "Margin multiplier", PricingSettings.MARGIN, formulas.settings().margin()),
					multiplier(RISK_MULTIPLIER, "Risk multiplier", PricingSettings.RISK, formulas.settings().risk())));
		}

		private BreakdownNode releaseableCost() {
			return BreakdownNode.sum(TOTAL_RELEASEABLE_COST, "Total releasable cost per hour", List.of(cogs(), totalOverheads()));
		}

		private BreakdownNode cogs() {
			List<BreakdownNode> inputs = new ArrayList<>();
			inputs.add(raw());
			if (category == EmployeeCategory.DEV) {
				inputs.add(rawAddOn(EmployeeCategory.QA));
				inputs.add(rawAddOn(EmployeeCategory.BA));
			}
			return BreakdownNode.sum(COGS, "COGS per hour", inputs);
		}

		private BreakdownNode totalOverheads() {
			List<BreakdownNode> inputs = new ArrayList<>();
			for (PricingOverheadType type : dataset.activeOverheadTypes()) {
				inputs.add(overhead(type));
			}
			return BreakdownNode.sum(TOTAL_OVERHEADS, "Total overheads per hour", inputs);
		}

		private BreakdownNode overhead(PricingOverheadType type) {
			List<BreakdownNode> inputs = new ArrayList<>();
			inputs.add(ownOverhead(type));
			if (category == EmployeeCategory.DEV) {
				inputs.add(overheadAddOn(EmployeeCategory.QA, type));
				inputs.add(overheadAddOn(EmployeeCategory.BA, type));
			}
			return BreakdownNode.sum(OVERHEAD + ":" + type.id(), type.name() + " per hour", inputs);
		}

		private BreakdownNode multiplier(String key, String label, String settingKey, double setting) {
			return BreakdownNode.sum(key, label, List.of(
					BreakdownNode.value("one", "1", 1.0, false),
					BreakdownNode.value(settingKey, settingKey, setting, false)));
		}

		private BreakdownNode capacity() {
			return BreakdownNode.product(prefix + CAPACITY, label() + " capacity hours", List.of(
					BreakdownNode.value(PricingSettings.DEV_RELEASABLE_HOURS_PER_MONTH,
							PricingSettings.DEV_RELEASABLE_HOURS_PER_MONTH, formulas.settings().devReleasableHoursPerMonth(), false),
					BreakdownNode.value(prefix + "_fte", label() + " FTE", pool().totalFte(), false)));
		}

		private BreakdownNode raw() {
			return BreakdownNode.ratio(prefix + RAW, label() + " raw cost per hour",
					BreakdownNode.value(prefix + "_raw_monthly", label() + " raw monthly cost", pool().rawMonthlyCost(), true),
					capacity());
		}

		private BreakdownNode cost() {
			return BreakdownNode.ratio(prefix + COST, label() + " fully loaded cost per hour",
					BreakdownNode.value(prefix + "_monthly", label() + " fully loaded monthly cost", pool().monthlyCost(), true),
					capacity());
		}

		private BreakdownNode ownOverhead(PricingOverheadType type) {
			return BreakdownNode.ratio(prefix + OWN_OVERHEAD + ":" + type.id(), label() + " " + type.name() + " per hour",
					BreakdownNode.value(prefix + "_overhead_monthly:" + type.id(), label() + " " + type.name() + " monthly",
							pool().overheadMonthly(type.id()), true),
					capacity());
		}

		private BreakdownNode addOn(EmployeeCategory shared) {
			CategoryPool sharedPool = aggregator.sharedPool(dataset, shared);
			return sharedAddOn(sharedPool, shared.keyPrefix() + ADD_ON, shared + " cost per DEV hour",
					shared.keyPrefix() + "_monthly", shared + " fully loaded monthly cost", sharedPool.monthlyCost());
		}

		private BreakdownNode rawAddOn(EmployeeCategory shared) {
			CategoryPool sharedPool = aggregator.sharedPool(dataset, shared);
			return sharedAddOn(sharedPool, shared.keyPrefix() + RAW_ADD_ON, shared + " raw cost per DEV hour",
					shared.keyPrefix() + "_raw_monthly", shared + " raw monthly cost", sharedPool.rawMonthlyCost());
		}

		private BreakdownNode overheadAddOn(EmployeeCategory shared, PricingOverheadType type) {
			CategoryPool sharedPool = aggregator.sharedPool(dataset, shared);
			return sharedAddOn(sharedPool, shared.keyPrefix() + OVERHEAD_ADD_ON + ":" + type.id(),
					shared + " " + type.name() + " per DEV hour",
					shared.keyPrefix() + "_overhead_monthly:" + type.id(), shared + " " + type.name() + " monthly",
					sharedPool.overheadMonthly(type.id()));
		}

		private BreakdownNode sharedAddOn(CategoryPool sharedPool, String key, String label,
										  String monthlyKey, String monthlyLabel, double monthly) {
			if (sharedPool.isEmpty()) {
				return BreakdownNode.value(key, "No active " + sharedPool.category() + " employees", 0.0, true);
			}
			String ratioKey = sharedPool.category() == EmployeeCategory.QA ? PricingSettings.QA_RATIO : PricingSettings.BA_RATIO;
			return BreakdownNode.product(key, label, List.of(
					BreakdownNode.value(ratioKey, ratioKey, formulas.settings().ratioFor(sharedPool.category()), false),
					BreakdownNode.ratio(monthlyKey + "_per_hour", monthlyLabel + " per hour",
							BreakdownNode.value(monthlyKey, monthlyLabel, monthly, true),
							BreakdownNode.value(PricingSettings.STANDARD_HOURS_PER_MONTH,
									PricingSettings.STANDARD_HOURS_PER_MONTH, formulas.settings().standardHoursPerMonth(), false))));
		}

		private String label() {
			return category == EmployeeCategory.DEV ? "DEV" : "Agentic AI";
		}
	}
}
