package my.teampricing.app.pricing;

public record TechStackRef(String id, String name) {
}
