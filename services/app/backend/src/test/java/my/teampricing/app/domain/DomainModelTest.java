package my.teampricing.app.domain;

import my.teampricing.app.pricing.EmployeeCategory;
import my.teampricing.app.pricing.OverheadPeriod;
import my.teampricing.app.pricing.SettingValueType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class DomainModelTest {
	@Test
	void employeeGettersSetters() {
		Employee employee = new Employee();
		employee.setId("e-1");
		employee.setName("Mona");
		employee.setCategory(EmployeeCategory.DEV);
		employee.setTechStackId("java");
		employee.setActive(true);
		employee.setGrossMonthly(new BigDecimal("30000"));
		employee.setNetMonthly(new BigDecimal("24000"));
		employee.setOncostRate(new BigDecimal("0.15"));
		employee.setAnnualBenefits(new BigDecimal("12000"));
		employee.setAnnualBonus(new BigDecimal("6000"));
		employee.setFte(new BigDecimal("0.5"));

		assertThat(employee.getId()).isEqualTo("e-1");
		assertThat(employee.getName()).isEqualTo("Mona");
		assertThat(employee.getCategory()).isEqualTo(EmployeeCategory.DEV);
		assertThat(employee.getTechStackId()).isEqualTo("java");
		assertThat(employee.isActive()).isTrue();
		assertThat(employee.getGrossMonthly()).isEqualByComparingTo("30000");
		assertThat(employee.getNetMonthly()).isEqualByComparingTo("24000");
		assertThat(employee.getOncostRate()).isEqualByComparingTo("0.15");
		assertThat(employee.getAnnualBenefits()).isEqualByComparingTo("12000");
		assertThat(employee.getAnnualBonus()).isEqualByComparingTo("6000");
		assertThat(employee.getFte()).isEqualByComparingTo("0.5");
	}

	@Test
	void overheadTypeAndAllocationGettersSetters() {
		OverheadType type = new OverheadType();
		type.setId("office");
		type.setName("Office rent");
		type.setAmount(new BigDecimal("9000"));
		type.setPeriod(OverheadPeriod.QUARTERLY);
		type.setActive(false);

		OverheadAllocation allocation = new OverheadAllocation();
		allocation.setId(3L);
		allocation.setEmployeeId("e-1");
		allocation.setOverheadTypeId("office");
		allocation.setShare(new BigDecimal("0.25"));

		assertThat(type.getId()).isEqualTo("office");
		assertThat(type.getName()).isEqualTo("Office rent");
		assertThat(type.getAmount()).isEqualByComparingTo("9000");
		assertThat(type.getPeriod()).isEqualTo(OverheadPeriod.QUARTERLY);
		assertThat(type.isActive()).isFalse();
		assertThat(allocation.getId()).isEqualTo(3L);
		assertThat(allocation.getEmployeeId()).isEqualTo("e-1");
		assertThat(allocation.getOverheadTypeId()).isEqualTo("office");
		assertThat(allocation.getShare()).isEqualByComparingTo("0.25");
	}

	@Test
	void settingAndViewGettersSetters() {
		Setting setting = new Setting();
		setting.setId(1L);
		setting.setKey("margin");
		setting.setValue("0.2");
		setting.setValueType(SettingValueType.FLOAT);
		setting.setGroupName("pricing");
		setting.setUnit("%");

		PricingView view = new PricingView();
		LocalDateTime createdAt = LocalDateTime.of(2026, 1, 15, 9, 30);
		view.setId("lean");
		view.setName("Lean team");
		view.setDescription("Without the second QA");
		view.setCreatedAt(createdAt);

		assertThat(setting.getId()).isEqualTo(1L);
		assertThat(setting.getKey()).isEqualTo("margin");
		assertThat(setting.getValue()).isEqualTo("0.2");
		assertThat(setting.getValueType()).isEqualTo(SettingValueType.FLOAT);
		assertThat(setting.getGroupName()).isEqualTo("pricing");
		assertThat(setting.getUnit()).isEqualTo("%");
		assertThat(view.getId()).isEqualTo("lean");
		assertThat(view.getName()).isEqualTo("Lean team");
		assertThat(view.getDescription()).isEqualTo("Without the second QA");
		assertThat(view.getCreatedAt()).isEqualTo(createdAt);
	}

	@Test
	void overrideGettersSetters() {
		EmployeeActiveOverride employeeOverride = new EmployeeActiveOverride();
		employeeOverride.setId(1L);
		employeeOverride.setViewId("lean");
		employeeOverride.setEmployeeId("qa-2");
		employeeOverride.setActive(false);

		OverheadTypeActiveOverride typeOverride = new OverheadTypeActiveOverride();
		typeOverride.setId(2L);
		typeOverride.setViewId("lean");
		typeOverride.setOverheadTypeId("office");
		typeOverride.setActive(true);

		SettingOverride settingOverride = new SettingOverride();
		settingOverride.setId(3L);
		settingOverride.setViewId("lean");
		settingOverride.setKey("risk");
		settingOverride.setValue("0.05");
		settingOverride.setValueType(SettingValueType.FLOAT);

		OverheadAllocationOverride allocationOverride = new OverheadAllocationOverride();
		allocationOverride.setId(4L);
		allocationOverride.setViewId("lean");
		allocationOverride.setEmployeeId("e-1");
		allocationOverride.setOverheadTypeId("office");
		allocationOverride.setShare(BigDecimal.ONE);

		assertThat(employeeOverride.getViewId()).isEqualTo("lean");
		assertThat(employeeOverride.getEmployeeId()).isEqualTo("qa-2");
		assertThat(employeeOverride.isActive()).isFalse();
		assertThat(typeOverride.getOverheadTypeId()).isEqualTo("office");
		assertThat(typeOverride.isActive()).isTrue();
		assertThat(settingOverride.getKey()).isEqualTo("risk");
		assertThat(settingOverride.getValue()).isEqualTo("0.05");
		assertThat(settingOverride.getValueType()).isEqualTo(SettingValueType.FLOAT);
		assertThat(allocationOverride.getId()).isEqualTo(4L);
		assertThat(allocationOverride.getShare()).isEqualByComparingTo("1");
	}
}
