package my.teampricing.app.pricing;

import java.util.Map;

/**
 * Hourly pricing of one category (DEV or AGENTIC_AI) inside one tech stack. Money values are null whenever the
 * status is not {@link PricingStatus#PRICED}, except the QA/BA add-ons a DEV row always reports. AGENTIC_AI rows
 * never carry QA/BA add-ons.
 */
public record StackPricing(String stackId,
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
						   Map<String, Double> overheadsPerRelHour,
						   Double totalOverheads,
						   Double releaseableCost,
						   Double finalPrice) {
	/**
	 * Share of the releasable cost a component represents; null when either side is null or the cost is zero.
	 */
	public Double pct(Double component) {
		return PricingMath.ratio(component, releaseableCost);
	}

	public StackPricing converted(CurrencyConverter converter) {
		return new StackPricing(
				stackId,
				stackName,
				category,
				status,
				employeeCount,
				totalFte,
				capacityHours,
				converter.money(costPerRelHour),
				converter.money(rawCostPerRelHour),
				converter.money(qaAddOn),
				converter.money(baAddOn),
				converter.money(cogs),
				converter.money(overheadsPerRelHour),
				converter.money(totalOverheads),
				converter.money(releaseableCost),
				converter.money(finalPrice)
		);
	}
}
