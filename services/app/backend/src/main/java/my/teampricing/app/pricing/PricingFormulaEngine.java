package my.teampricing.app.pricing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PricingFormulaEngine {
	private final PricingSettings settings;
	private final List<PricingOverheadType> activeOverheadTypes;

	public PricingFormulaEngine(PricingSettings settings, List<PricingOverheadType> activeOverheadTypes) {
		this.settings = settings;
		this.activeOverheadTypes = activeOverheadTypes;
	}

	public PricingSettings settings() {
		return settings;
	}

	public double capacityHours(CategoryPool pool) {
		return settings.devReleasableHoursPerMonth() * pool.totalFte();
	}

	public double marginMultiplier() {
		return 1 + settings.margin();
	}

	public double riskMultiplier() {
		return 1 + settings.risk();
	}

	public Double perRelHour(CategoryPool pool, double monthly) {
		return PricingMath.ratio(monthly, capacityHours(pool));
	}

	/**
	 * Monthly amount of a shared QA/BA pool converted into cost per DEV releasable hour. An empty pool costs nothing.
	 */
	public Double sharedAddOn(CategoryPool pool, double monthly) {
		if (pool.isEmpty()) {
			return 0.0;
		}
		return PricingMath.product(settings.ratioFor(pool.category()),
				PricingMath.ratio(monthly, settings.standardHoursPerMonth()));
	}

	public SharedCosts sharedCosts(CategoryPool qaPool, CategoryPool baPool) {
		return new SharedCosts(
				sharedAddOn(qaPool, qaPool.monthlyCost()),
				sharedAddOn(baPool, baPool.monthlyCost()),
				sharedAddOn(qaPool, qaPool.rawMonthlyCost()),
				sharedAddOn(baPool, baPool.rawMonthlyCost()),
				overheadAddOns(qaPool),
				overheadAddOns(baPool),
				qaPool.employees().size(),
				baPool.employees().size()
		);
	}

	/**
	 * A DEV stack is only priced when its own pool has capacity and every shared QA/BA add-on resolved.
	 */
	public PricingStatus status(CategoryPool pool, SharedCosts shared) {
		if (pool.isEmpty()) {
			return PricingStatus.NO_EMPLOYEES;
		}
		if (capacityHours(pool) == 0.0) {
			return PricingStatus.NO_CAPACITY;
		}
		if (pool.category() == EmployeeCategory.DEV && !shared.resolved()) {
			return PricingStatus.NO_SHARED_CAPACITY;
		}
		return PricingStatus.PRICED;
	}

	public StackPricing price(TechStackRef stack, CategoryPool pool, SharedCosts shared) {
		boolean dev = pool.category() == EmployeeCategory.DEV;
		PricingStatus status = status(pool, shared);
		Double qaAddOn = dev ? shared.qaCostPerDevRelHour() : null;
		Double baAddOn = dev ? shared.baCostPerDevRelHour() : null;
		if (status != PricingStatus.PRICED) {
			Map<String, Double> nothing = new LinkedHashMap<>();
			activeOverheadTypes.forEach(type -> nothing.put(type.id(), null));
			return new StackPricing(stack.id(), stack.name(), pool.category(), status, pool.employees().size(),
					pool.totalFte(), capacityHours(pool), null, null, qaAddOn, baAddOn, null,
					Collections.unmodifiableMap(nothing), null, null, null);
		}

		Double cost = perRelHour(pool, pool.monthlyCost());
		Double raw = perRelHour(pool, pool.rawMonthlyCost());
		Double cogs = dev
				? PricingMath.sum(raw, shared.qaRawAddOnPerRelHour(), shared.baRawAddOnPerRelHour())
				: PricingMath.sum(raw);

		Map<String, Double> overheads = new LinkedHashMap<>();
		List<Double> overheadValues = new ArrayList<>();
		for (PricingOverheadType type : activeOverheadTypes) {
			Double own = perRelHour(pool, pool.overheadMonthly(type.id()));
			Double total = dev
					? PricingMath.sum(own, shared.overheadAddOn(EmployeeCategory.QA, type.id()),
					shared.overheadAddOn(EmployeeCategory.BA, type.id()))
					: PricingMath.sum(own);
			overheads.put(type.id(), total);
			overheadValues.add(total);
		}
		Double totalOverheads = PricingMath.sum(overheadValues);
		Double releaseable = PricingMath.sum(cogs, totalOverheads);
		Double finalPrice = PricingMath.product(releaseable, marginMultiplier(), riskMultiplier());

		return new StackPricing(stack.id(), stack.name(), pool.category(), status, pool.employees().size(),
				pool.totalFte(), capacityHours(pool), cost, raw, qaAddOn, baAddOn, cogs,
				Collections.unmodifiableMap(overheads), totalOverheads, releaseable, finalPrice);
	}

	private Map<String, Double> overheadAddOns(CategoryPool pool) {
		Map<String, Double> addOns = new LinkedHashMap<>();
		for (PricingOverheadType type : activeOverheadTypes) {
			addOns.put(type.id(), sharedAddOn(pool, pool.overheadMonthly(type.id())));
		}
		return Collections.unmodifiableMap(addOns);
	}
}
