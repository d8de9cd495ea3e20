package my.teampricing.app.pricing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class EffectiveDatasetResolver {
	public EffectiveDataset resolve(PricingSnapshot snapshot, ScenarioOverrides overrides) {
		ScenarioOverrides scenario = overrides == null ? ScenarioOverrides.none() : overrides;

		List<PricingOverheadType> activeTypes = new ArrayList<>();
		Set<String> overriddenTypeIds = new LinkedHashSet<>();
		int inactiveTypes = 0;
		for (PricingOverheadType type : snapshot.overheadTypes()) {
			EffectiveActive effective = OverrideResolver.resolveActive(type.active(), scenario.overheadTypeActive().get(type.id()));
			if (effective.overridden()) {
				overriddenTypeIds.add(type.id());
			}
			if (effective.active()) {
				activeTypes.add(type);
			} else {
				inactiveTypes += 1;
			}
		}

		Map<AllocationRow.AllocationKey, Double> baseShares = new HashMap<>();
		for (AllocationRow row : snapshot.allocations()) {
			baseShares.put(row.key(), row.share());
		}

		List<EffectiveEmployee> activeEmployees = new ArrayList<>();
		Set<String> overriddenEmployeeIds = new LinkedHashSet<>();
		int inactiveEmployees = 0;
		for (PricingEmployee employee : snapshot.employees()) {
			EffectiveActive effective = OverrideResolver.resolveActive(employee.active(), scenario.employeeActive().get(employee.id()));
			if (effective.overridden()) {
				overriddenEmployeeIds.add(employee.id());
			}
			if (!effective.active()) {
				inactiveEmployees += 1;
				continue;
			}
			Map<String, Double> shares = new LinkedHashMap<>();
			for (PricingOverheadType type : activeTypes) {
				AllocationRow.AllocationKey key = new AllocationRow.AllocationKey(employee.id(), type.id());
				Double base = baseShares.get(key);
				Double override = scenario.allocationShares().get(key);
				if (base == null && override == null) {
					continue;
				}
				double share = OverrideResolver.resolveShare(base, override);
				if (share > 0.0) {
					shares.put(type.id(), share);
				}
			}
			activeEmployees.add(new EffectiveEmployee(employee, Collections.unmodifiableMap(shares), effective.overridden()));
		}

		return new EffectiveDataset(
				scenario.viewId(),
				List.copyOf(activeEmployees),
				List.copyOf(activeTypes),
				snapshot.techStacks(),
				resolveSettings(snapshot.settings(), scenario.settings()),
				inactiveEmployees,
				inactiveTypes,
				Collections.unmodifiableSet(overriddenEmployeeIds),
				Collections.unmodifiableSet(overriddenTypeIds)
		);
	}

	private Map<String, ParsedSetting> resolveSettings(List<SettingRecord> base, Map<String, SettingRecord> overrides) {
		Map<String, SettingRecord> baseByKey = new LinkedHashMap<>();
		for (SettingRecord setting : base) {
			if (setting.key() != null) {
				baseByKey.put(setting.key(), setting);
			}
		}
		Set<String> keys = new LinkedHashSet<>(baseByKey.keySet());
		keys.addAll(overrides.keySet());

		Map<String, ParsedSetting> resolved = new LinkedHashMap<>();
		for (String key : keys) {
			SettingRecord baseSetting = baseByKey.get(key);
			SettingRecord override = overrides.get(key);
			SettingValueType type = baseSetting != null ? baseSetting.valueType() : override.valueType();
			resolved.put(key, OverrideResolver.resolveSetting(
					baseSetting == null ? null : baseSetting.value(),
					override == null ? null : override.value(),
					type));
		}
		return Collections.unmodifiableMap(resolved);
	}
}
