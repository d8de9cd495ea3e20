package my.teampricing.app.dto;

public record OverheadContributionDto(
		String typeId,
		String typeName,
		Double perRelHour,
		Double pct
) {
}
