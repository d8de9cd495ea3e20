package my.teampricing.app.service;

import my.teampricing.app.pricing.PricingSnapshot;
import my.teampricing.app.pricing.ScenarioOverrides;

public record PricingInputs(PricingSnapshot snapshot, ScenarioOverrides overrides) {
}
