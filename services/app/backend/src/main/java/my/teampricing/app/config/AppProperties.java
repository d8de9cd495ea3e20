package my.teampricing.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Pricing pricing
) {
	public record Pricing(
			@DecimalMin("0.0") @DecimalMax("1.0") Double allocationTolerance,
			@NotBlank String primaryCurrency,
			@NotBlank String secondaryCurrency
	) {
	}
}
