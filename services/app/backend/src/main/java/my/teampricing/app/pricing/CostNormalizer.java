package my.teampricing.app.pricing;

public class CostNormalizer {
	private static final int MONTHS_PER_YEAR = 12;

	private final double annualIncrease;

	public CostNormalizer() {
		this(0.0);
	}

	public CostNormalizer(double annualIncrease) {
		this.annualIncrease = annualIncrease;
	}

	public double annualIncrease() {
		return annualIncrease;
	}

	public double adjustedGrossMonthly(PricingEmployee employee) {
		return employee.grossMonthly() * (1 + annualIncrease);
	}

	public double annualBase(PricingEmployee employee) {
		double grossAnnual = adjustedGrossMonthly(employee) * MONTHS_PER_YEAR;
		return grossAnnual * (1 + oncostRate(employee)) + annualBenefits(employee) + annualBonus(employee);
	}

	public double rawMonthly(PricingEmployee employee) {
		return adjustedGrossMonthly(employee) * (1 + oncostRate(employee))
				+ annualBenefits(employee) / MONTHS_PER_YEAR
				+ annualBonus(employee) / MONTHS_PER_YEAR;
	}

	public static double overheadMonthlyEquivalent(PricingOverheadType type) {
		return type.amount() / type.period().months();
	}

	static double oncostRate(PricingEmployee employee) {
		return employee.oncostRate() == null ? 0.0 : employee.oncostRate();
	}

	static double annualBenefits(PricingEmployee employee) {
		return employee.annualBenefits() == null ? 0.0 : employee.annualBenefits();
	}

	static double annualBonus(PricingEmployee employee) {
		return employee.annualBonus() == null ? 0.0 : employee.annualBonus();
	}
}
