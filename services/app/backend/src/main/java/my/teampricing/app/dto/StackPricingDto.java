package my.teampricing.app.dto;

import my.teampricing.app.pricing.EmployeeCategory;
import my.teampricing.app.pricing.PricingStatus;

import java.util.List;

public record StackPricingDto(
		String stackId,
		String stackName,
		EmployeeCategory category,
		PricingStatus status,
		int employeeCount,
		double totalFte,
		double capacityHours,
		Double costPerRelHour,
		Double rawCostPerRelHour,
		Double qaAddOn,
		Double baAddOn,
		Double cogs,
		Double cogsPct,
		List<OverheadContributionDto> overheads,
		Double totalOverheads,
		Double totalOverheadsPct,
		Double releaseableCost,
		Double finalPrice
) {
}
