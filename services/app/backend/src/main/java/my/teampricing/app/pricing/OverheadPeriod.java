package my.teampricing.app.pricing;

public enum OverheadPeriod {
	ANNUAL(12),
	QUARTERLY(3),
	MONTHLY(1);

	private final int months;

	OverheadPeriod(int months) {
		this.months = months;
	}

	public int months() {
		return months;
	}
}
