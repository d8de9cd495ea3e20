package my.teampricing.app.pricing;

import java.util.List;

/**
 * Read-only copy of the base records one pricing run works on.
 */
public record PricingSnapshot(List<PricingEmployee> employees,
							  List<TechStackRef> techStacks,
							  List<PricingOverheadType> overheadTypes,
							  List<AllocationRow> allocations,
							  List<SettingRecord> settings) {
	public PricingSnapshot {
		employees = employees == null ? List.of() : List.copyOf(employees);
		techStacks = techStacks == null ? List.of() : List.copyOf(techStacks);
		overheadTypes = overheadTypes == null ? List.of() : List.copyOf(overheadTypes);
		allocations = allocations == null ? List.of() : List.copyOf(allocations);
		settings = settings == null ? List.of() : List.copyOf(settings);
	}
}
