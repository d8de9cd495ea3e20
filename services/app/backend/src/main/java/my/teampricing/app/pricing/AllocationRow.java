package my.teampricing.app.pricing;

public record AllocationRow(String employeeId, String overheadTypeId, double share) {
	public AllocationKey key() {
		return new AllocationKey(employeeId, overheadTypeId);
	}

	public record AllocationKey(String employeeId, String overheadTypeId) {
	}
}
