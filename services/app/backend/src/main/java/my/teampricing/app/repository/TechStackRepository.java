package my.teampricing.app.repository;

import my.teampricing.app.domain.TechStack;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TechStackRepository extends JpaRepository<TechStack, String> {
}
