package my.teampricing.app.pricing;

public record EffectiveActive(boolean active, boolean overridden) {
}
