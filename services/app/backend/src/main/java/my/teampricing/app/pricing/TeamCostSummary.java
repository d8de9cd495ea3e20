package my.teampricing.app.pricing;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Team-wide totals shown on the dashboard. Monthly money values are in the primary currency until converted.
 */
public record TeamCostSummary(String viewId,
							  Map<EmployeeCategory, Integer> headcount,
							  Map<EmployeeCategory, Double> fte,
							  Map<EmployeeCategory, Double> monthlyCost,
							  double totalFte,
							  double totalMonthlyCost,
							  double totalOverheadMonthly,
							  List<OverheadAllocationStatus> overheadAllocations,
							  int inactiveEmployeeCount,
							  int inactiveOverheadTypeCount,
							  Set<String> overriddenEmployeeIds,
							  Set<String> overriddenOverheadTypeIds) {
	public int activeEmployeeCount() {
		return headcount.values().stream().mapToInt(Integer::intValue).sum();
	}

	public TeamCostSummary converted(CurrencyConverter converter) {
		if (!converter.converting()) {
			return this;
		}
		Map<EmployeeCategory, Double> convertedCost = new EnumMap<>(EmployeeCategory.class);
		monthlyCost.forEach((category, cost) -> convertedCost.put(category, converter.money(cost)));
		return new TeamCostSummary(viewId, headcount, fte, convertedCost, totalFte,
				converter.money(totalMonthlyCost), converter.money(totalOverheadMonthly), overheadAllocations,
				inactiveEmployeeCount, inactiveOverheadTypeCount, overriddenEmployeeIds, overriddenOverheadTypeIds);
	}
}
