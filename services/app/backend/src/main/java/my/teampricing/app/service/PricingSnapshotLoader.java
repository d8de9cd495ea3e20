package my.teampricing.app.service;

import my.teampricing.app.domain.Employee;
import my.teampricing.app.domain.EmployeeActiveOverride;
import my.teampricing.app.domain.OverheadAllocation;
import my.teampricing.app.domain.OverheadAllocationOverride;
import my.teampricing.app.domain.OverheadType;
import my.teampricing.app.domain.OverheadTypeActiveOverride;
import my.teampricing.app.domain.Setting;
import my.teampricing.app.domain.SettingOverride;
import my.teampricing.app.domain.TechStack;
import my.teampricing.app.pricing.AllocationRow;
import my.teampricing.app.pricing.PricingEmployee;
import my.teampricing.app.pricing.PricingOverheadType;
import my.teampricing.app.pricing.PricingSnapshot;
import my.teampricing.app.pricing.ScenarioOverrides;
import my.teampricing.app.pricing.SettingRecord;
import my.teampricing.app.pricing.TechStackRef;
import my.teampricing.app.repository.EmployeeActiveOverrideRepository;
import my.teampricing.app.repository.EmployeeRepository;
import my.teampricing.app.repository.OverheadAllocationOverrideRepository;
import my.teampricing.app.repository.OverheadAllocationRepository;
import my.teampricing.app.repository.OverheadTypeActiveOverrideRepository;
import my.teampricing.app.repository.OverheadTypeRepository;
import my.teampricing.app.repository.PricingViewRepository;
import my.teampricing.app.repository.SettingOverrideRepository;
import my.teampricing.app.repository.SettingRepository;
import my.teampricing.app.repository.TechStackRepository;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the pricing tables into the immutable inputs of {@link my.teampricing.app.pricing.PricingEngine}.
 */
@Service
public class PricingSnapshotLoader {
	private static final Sort BY_NAME = Sort.by("name");

	private final EmployeeRepository employeeRepository;
	private final TechStackRepository techStackRepository;
	private final OverheadTypeRepository overheadTypeRepository;
	private final OverheadAllocationRepository allocationRepository;
	private final SettingRepository settingRepository;
	private final PricingViewRepository viewRepository;
	private final EmployeeActiveOverrideRepository employeeOverrideRepository;
	private final OverheadTypeActiveOverrideRepository overheadTypeOverrideRepository;
	private final SettingOverrideRepository settingOverrideRepository;
	private final OverheadAllocationOverrideRepository allocationOverrideRepository;

	public PricingSnapshotLoader(EmployeeRepository employeeRepository,
								 TechStackRepository techStackRepository,
								 OverheadTypeRepository overheadTypeRepository,
								 OverheadAllocationRepository allocationRepository,
								 SettingRepository settingRepository,
								 PricingViewRepository viewRepository,
								 EmployeeActiveOverrideRepository employeeOverrideRepository,
								 OverheadTypeActiveOverrideRepository overheadTypeOverrideRepository,
								 SettingOverrideRepository settingOverrideRepository,
								 OverheadAllocationOverrideRepository allocationOverrideRepository) {
		this.employeeRepository = employeeRepository;
		this.techStackRepository = techStackRepository;
		this.overheadTypeRepository = overheadTypeRepository;
		this.allocationRepository = allocationRepository;
		this.settingRepository = settingRepository;
		this.viewRepository = viewRepository;
		this.employeeOverrideRepository = employeeOverrideRepository;
		this.overheadTypeOverrideRepository = overheadTypeOverrideRepository;
		this.settingOverrideRepository = settingOverrideRepository;
		this.allocationOverrideRepository = allocationOverrideRepository;
	}

	/**
	 * Reads a view's overrides and the base tables from one database snapshot.
	 *
	 * @throws PricingViewNotFoundException when the view does not exist
	 * @throws InvalidPricingDataException when a stored row cannot be priced
	 */
	@Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
	public PricingInputs load(String viewId) {
		ScenarioOverrides overrides = loadOverrides(viewId);
		return new PricingInputs(loadSnapshot(), overrides);
	}

	@Transactional(readOnly = true)
	public PricingSnapshot loadSnapshot() {
		List<PricingEmployee> employees = employeeRepository.findAll(BY_NAME).stream()
				.map(this::toPricingEmployee)
				.toList();
		List<TechStackRef> stacks = techStackRepository.findAll(BY_NAME).stream()
				.map(stack -> new TechStackRef(stack.getId(), stack.getName()))
				.toList();
		List<PricingOverheadType> overheadTypes = overheadTypeRepository.findAll(BY_NAME).stream()
				.map(this::toPricingOverheadType)
				.toList();
		List<AllocationRow> allocations = allocationRepository.findAll().stream()
				.map(this::toAllocationRow)
				.toList();
		List<SettingRecord> settings = settingRepository.findAll().stream()
				.map(this::toSettingRecord)
				.toList();
		return new PricingSnapshot(employees, stacks, overheadTypes, allocations, settings);
	}

	/**
	 * Loads the override layer of a view. A null or blank id selects the base data.
	 *
	 * @throws PricingViewNotFoundException when the view does not exist
	 */
	@Transactional(readOnly = true)
	public ScenarioOverrides loadOverrides(String viewId) {
		if (viewId == null || viewId.isBlank()) {
			return ScenarioOverrides.none();
		}
		String id = viewId.trim();
		if (!viewRepository.existsById(id)) {
			throw new PricingViewNotFoundException(id);
		}

		Map<String, Boolean> employeeActive = new LinkedHashMap<>();
		for (EmployeeActiveOverride override : employeeOverrideRepository.findByViewId(id)) {
			employeeActive.put(override.getEmployeeId(), override.isActive());
		}
		Map<String, Boolean> overheadTypeActive = new LinkedHashMap<>();
		for (OverheadTypeActiveOverride override : overheadTypeOverrideRepository.findByViewId(id)) {
			overheadTypeActive.put(override.getOverheadTypeId(), override.isActive());
		}
		Map<String, SettingRecord> settings = new LinkedHashMap<>();
		for (SettingOverride override : settingOverrideRepository.findByViewId(id)) {
			settings.put(override.getKey(), new SettingRecord(override.getKey(), override.getValue(), override.getValueType()));
		}
		Map<AllocationRow.AllocationKey, Double> shares = new LinkedHashMap<>();
		for (OverheadAllocationOverride override : allocationOverrideRepository.findByViewId(id)) {
			shares.put(new AllocationRow.AllocationKey(override.getEmployeeId(), override.getOverheadTypeId()),
					toDouble(override.getShare(), 0.0));
		}
		return new ScenarioOverrides(id, employeeActive, overheadTypeActive, settings, shares);
	}

	private PricingEmployee toPricingEmployee(Employee employee) {
		try {
			return newPricingEmployee(employee);
		} catch (IllegalArgumentException ex) {
			throw new InvalidPricingDataException("Employee " + employee.getId() + " has invalid pricing data: "
					+ ex.getMessage(), ex);
		}
	}

	private PricingEmployee newPricingEmployee(Employee employee) {
		return new PricingEmployee(
				employee.getId(),
				employee.getName(),
				employee.getCategory(),
				employee.getTechStackId(),
				employee.isActive(),
				toDouble(employee.getGrossMonthly(), 0.0),
				toDouble(employee.getNetMonthly(), 0.0),
				toDouble(employee.getOncostRate()),
				toDouble(employee.getAnnualBenefits()),
				toDouble(employee.getAnnualBonus()),
				toDouble(employee.getFte(), 1.0)
		);
	}

	private PricingOverheadType toPricingOverheadType(OverheadType type) {
		try {
			return new PricingOverheadType(type.getId(), type.getName(), type.isActive(), toDouble(type.getAmount(), 0.0),
					type.getPeriod());
		} catch (IllegalArgumentException ex) {
			throw new InvalidPricingDataException("Overhead type " + type.getId() + " has invalid pricing data: "
					+ ex.getMessage(), ex);
		}
	}

	private AllocationRow toAllocationRow(OverheadAllocation allocation) {
		return new AllocationRow(allocation.getEmployeeId(), allocation.getOverheadTypeId(), toDouble(allocation.getShare(), 0.0));
	}

	private SettingRecord toSettingRecord(Setting setting) {
		return new SettingRecord(setting.getKey(), setting.getValue(), setting.getValueType());
	}

	private static Double toDouble(BigDecimal value) {
		return value == null ? null : value.doubleValue();
	}

	private static double toDouble(BigDecimal value, double fallback) {
		return value == null ? fallback : value.doubleValue();
	}
}
