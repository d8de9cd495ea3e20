package my.teampricing.app.dto;

public record OverheadAllocationStatusDto(
		String typeId,
		String typeName,
		double sum,
		boolean valid,
		int missingAllocationCount
) {
}
