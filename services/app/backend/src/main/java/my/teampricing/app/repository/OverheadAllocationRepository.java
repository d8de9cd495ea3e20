package my.teampricing.app.repository;

import my.teampricing.app.domain.OverheadAllocation;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OverheadAllocationRepository extends JpaRepository<OverheadAllocation, Long> {
}
