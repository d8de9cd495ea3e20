package my.teampricing.app.pricing;

public record OverheadAllocationStatus(String typeId,
									   String typeName,
									   double sum,
									   boolean valid,
									   int missingAllocationCount) {
}
