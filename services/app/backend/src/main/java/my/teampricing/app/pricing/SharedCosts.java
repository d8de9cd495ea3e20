package my.teampricing.app.pricing;

import java.util.Map;
import java.util.Objects;

/**
 * QA and BA costs expressed per DEV releasable hour. These are pooled across the whole team and added to every DEV
 * stack. A null value means the standard hours setting leaves the pool without capacity.
 */
public record SharedCosts(Double qaCostPerDevRelHour,
						  Double baCostPerDevRelHour,
						  Double qaRawAddOnPerRelHour,
						  Double baRawAddOnPerRelHour,
						  Map<String, Double> qaOverheadAddOns,
						  Map<String, Double> baOverheadAddOns,
						  int qaEmployeeCount,
						  int baEmployeeCount) {
	/**
	 * False when any add-on is null, which happens when a non-empty QA/BA pool meets zero standard hours.
	 */
	public boolean resolved() {
		return qaCostPerDevRelHour != null
				&& baCostPerDevRelHour != null
				&& qaRawAddOnPerRelHour != null
				&& baRawAddOnPerRelHour != null
				&& qaOverheadAddOns.values().stream().allMatch(Objects::nonNull)
				&& baOverheadAddOns.values().stream().allMatch(Objects::nonNull);
	}

	public Double overheadAddOn(EmployeeCategory category, String overheadTypeId) {
		Map<String, Double> addOns = category == EmployeeCategory.QA ? qaOverheadAddOns : baOverheadAddOns;
		return addOns.containsKey(overheadTypeId) ? addOns.get(overheadTypeId) : Double.valueOf(0.0);
	}

	public SharedCosts converted(CurrencyConverter converter) {
		return new SharedCosts(
				converter.money(qaCostPerDevRelHour),
				converter.money(baCostPerDevRelHour),
				converter.money(qaRawAddOnPerRelHour),
				converter.money(baRawAddOnPerRelHour),
				converter.money(qaOverheadAddOns),
				converter.money(baOverheadAddOns),
				qaEmployeeCount,
				baEmployeeCount
		);
	}
}
