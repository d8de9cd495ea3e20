package my.teampricing.app.pricing;

public enum PricingStatus {
	PRICED,
	NO_EMPLOYEES,
	NO_CAPACITY,
	NO_SHARED_CAPACITY
}
