package my.teampricing.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import my.teampricing.app.pricing.EmployeeCategory;

import java.math.BigDecimal;

@Entity
@Table(name = "employees")
public class Employee {
	@Id
	@Column(name = "id")
	private String id;

	@Column(name = "name", nullable = false, columnDefinition = "TEXT")
	private String name;

	@Enumerated(EnumType.STRING)
	@Column(name = "category", nullable = false)
	private EmployeeCategory category;

	@Column(name = "tech_stack_id")
	private String techStackId;

	@Column(name = "is_active", nullable = false)
	private boolean active;

	@Column(name = "gross_monthly", nullable = false)
	private BigDecimal grossMonthly;

	@Column(name = "net_monthly")
	private BigDecimal netMonthly;

	@Column(name = "oncost_rate")
	private BigDecimal oncostRate;

	@Column(name = "annual_benefits")
	private BigDecimal annualBenefits;

	@Column(name = "annual_bonus")
	private BigDecimal annualBonus;

	@Column(name = "fte", nullable = false)
	private BigDecimal fte;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public EmployeeCategory getCategory() {
		return category;
	}

	public void setCategory(EmployeeCategory category) {
		this.category = category;
	}

	public String getTechStackId() {
		return techStackId;
	}

	public void setTechStackId(String techStackId) {
		this.techStackId = techStackId;
	}

	public boolean isActive() {
		return active;
	}

	public void setActive(boolean active) {
		this.active = active;
	}

	public BigDecimal getGrossMonthly() {
		return grossMonthly;
	}

	public void setGrossMonthly(BigDecimal grossMonthly) {
		this.grossMonthly = grossMonthly;
	}

	public BigDecimal getNetMonthly() {
		return netMonthly;
	}

	public void setNetMonthly(BigDecimal netMonthly) {
		this.netMonthly = netMonthly;
	}

	public BigDecimal getOncostRate() {
		return oncostRate;
	}

	public void setOncostRate(BigDecimal oncostRate) {
		this.oncostRate = oncostRate;
	}

	public BigDecimal getAnnualBenefits() {
		return annualBenefits;
	}

	public void setAnnualBenefits(BigDecimal annualBenefits) {
		this.annualBenefits = annualBenefits;
	}

	public BigDecimal getAnnualBonus() {
		return annualBonus;
	}

	public void setAnnualBonus(BigDecimal annualBonus) {
		this.annualBonus = annualBonus;
	}

	public BigDecimal getFte() {
		return fte;
	}

	public void setFte(BigDecimal fte) {
		this.fte = fte;
	}
}
