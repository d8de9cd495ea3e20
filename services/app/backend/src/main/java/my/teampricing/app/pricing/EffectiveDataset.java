package my.teampricing.app.pricing;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record EffectiveDataset(String viewId,
							   List<EffectiveEmployee> activeEmployees,
							   List<PricingOverheadType> activeOverheadTypes,
							   List<TechStackRef> techStacks,
							   Map<String, ParsedSetting> settings,
							   int inactiveEmployeeCount,
							   int inactiveOverheadTypeCount,
							   Set<String> overriddenEmployeeIds,
							   Set<String> overriddenOverheadTypeIds) {
	public List<EffectiveEmployee> employeesOf(EmployeeCategory category) {
		return activeEmployees.stream()
				.filter(employee -> employee.category() == category)
				.toList();
	}

	public List<EffectiveEmployee> employeesOf(EmployeeCategory category, String techStackId) {
		return activeEmployees.stream()
				.filter(employee -> employee.category() == category)
				.filter(employee -> techStackId != null && techStackId.equals(employee.employee().techStackId()))
				.toList();
	}
}
