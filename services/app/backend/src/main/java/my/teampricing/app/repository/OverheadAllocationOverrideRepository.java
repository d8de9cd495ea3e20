package my.teampricing.app.repository;

import my.teampricing.app.domain.OverheadAllocationOverride;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OverheadAllocationOverrideRepository extends JpaRepository<OverheadAllocationOverride, Long> {
	List<OverheadAllocationOverride> findByViewId(String viewId);
}
