package my.teampricing.app.dto;

public record SharedCostsDto(
		Double qaCostPerDevRelHour,
		Double baCostPerDevRelHour,
		Double qaRawAddOnPerRelHour,
		Double baRawAddOnPerRelHour,
		int qaEmployeeCount,
		int baEmployeeCount
) {
}
