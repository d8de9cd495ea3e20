package my.teampricing.app.repository;

import my.teampricing.app.domain.PricingView;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PricingViewRepository extends JpaRepository<PricingView, String> {
}
