package my.teampricing.app.pricing;

import java.util.Map;

/**
 * Override layer of one pricing view. Every map is keyed by the natural key of its base table.
 */
public record ScenarioOverrides(String viewId,
								Map<String, Boolean> employeeActive,
								Map<String, Boolean> overheadTypeActive,
								Map<String, SettingRecord> settings,
								Map<AllocationRow.AllocationKey, Double> allocationShares) {
	private static final ScenarioOverrides NONE = new ScenarioOverrides(null, Map.of(), Map.of(), Map.of(), Map.of());

	public ScenarioOverrides {
		employeeActive = employeeActive == null ? Map.of() : Map.copyOf(employeeActive);
		overheadTypeActive = overheadTypeActive == null ? Map.of() : Map.copyOf(overheadTypeActive);
		settings = settings == null ? Map.of() : Map.copyOf(settings);
		allocationShares = allocationShares == null ? Map.of() : Map.copyOf(allocationShares);
	}

	public static ScenarioOverrides none() {
		return NONE;
	}
}
