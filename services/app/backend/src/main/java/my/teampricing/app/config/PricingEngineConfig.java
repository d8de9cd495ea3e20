package my.teampricing.app.config;

import my.teampricing.app.pricing.PricingEngine;
import my.teampricing.app.pricing.PricingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PricingEngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(PricingEngineConfig.class);

	@Bean
	public PricingEngine pricingEngine(AppProperties properties) {
		double tolerance = allocationTolerance(properties);
		logger.info("Pricing engine ready (allocation tolerance={}).", tolerance);
		return new PricingEngine(new PricingValidator(tolerance));
	}

	static double allocationTolerance(AppProperties properties) {
		if (properties == null || properties.pricing() == null || properties.pricing().allocationTolerance() == null) {
			return PricingValidator.DEFAULT_TOLERANCE;
		}
		return properties.pricing().allocationTolerance();
	}
}
