package my.teampricing.app.service;

public class PricingViewNotFoundException extends RuntimeException {
	private final String viewId;

	public PricingViewNotFoundException(String viewId) {
		super("Pricing view not found: " + viewId);
		this.viewId = viewId;
	}

	public String getViewId() {
		return viewId;
	}
}
