package my.teampricing.app.dto;

import my.teampricing.app.pricing.EmployeeCategory;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record DashboardSummaryDto(
		String viewId,
		String currency,
		int activeEmployeeCount,
		Map<EmployeeCategory, Integer> headcount,
		Map<EmployeeCategory, Double> fte,
		Map<EmployeeCategory, Double> monthlyCost,
		double totalFte,
		double totalMonthlyCost,
		double totalOverheadMonthly,
		List<OverheadAllocationStatusDto> overheadAllocations,
		int inactiveEmployeeCount,
		int inactiveOverheadTypeCount,
		Set<String> overriddenEmployeeIds,
		Set<String> overriddenOverheadTypeIds
) {
}
