package my.teampricing.app.repository;

import my.teampricing.app.domain.OverheadType;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OverheadTypeRepository extends JpaRepository<OverheadType, String> {
}
